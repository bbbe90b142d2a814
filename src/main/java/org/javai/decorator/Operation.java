package org.javai.decorator;

import java.util.Objects;

/**
 * A fallible unit of work with no parameters.
 * Real arguments are bound upstream by the lambda that implements it.
 *
 * <pre>{@code
 * Operation<Order> fetch = () -> ordersApi.fetch(orderId);
 * Operation<Order> resilient = fetch
 *     .decorate(decorators.retry(RetryConfig.of(3, Duration.ofMillis(100))))
 *     .decorate(decorators.timeout(TimeoutConfig.ofMillis(2_000)));
 * }</pre>
 *
 * @param <T> The type of the successful value
 */
@FunctionalInterface
public interface Operation<T> {

    Outcome<T> invoke();

    /**
     * Applies a wrapper to this operation.
     *
     * @param decorator the wrapper to apply
     * @return a new operation with the same input/output contract
     */
    default Operation<T> decorate(Decorator<T> decorator) {
        Objects.requireNonNull(decorator, "decorator must not be null");
        return decorator.apply(this);
    }
}
