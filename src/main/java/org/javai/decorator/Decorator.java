package org.javai.decorator;

import java.util.Objects;

/**
 * A wrapper: turns an operation into another operation with the same contract.
 *
 * <p>Composition is ordinary function application and is order-sensitive:
 * {@code first.andThen(second)} produces {@code second.apply(first.apply(op))},
 * so {@code second} is the outermost wrapper.
 *
 * @param <T> The type of the successful value
 */
@FunctionalInterface
public interface Decorator<T> {

    Operation<T> apply(Operation<T> operation);

    default Decorator<T> andThen(Decorator<T> outer) {
        Objects.requireNonNull(outer, "outer must not be null");
        return operation -> outer.apply(apply(operation));
    }

    static <T> Decorator<T> identity() {
        return operation -> operation;
    }
}
