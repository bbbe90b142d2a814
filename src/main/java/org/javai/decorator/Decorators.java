package org.javai.decorator;

import org.javai.decorator.callback.Callback;
import org.javai.decorator.callback.CallbackRef;
import org.javai.decorator.callback.CallbackRegistry;
import org.javai.decorator.dispatch.DispatchConfig;
import org.javai.decorator.dispatch.OutcomeDispatcher;
import org.javai.decorator.hook.HookConfig;
import org.javai.decorator.hook.HookController;
import org.javai.decorator.ops.OpReporter;
import org.javai.decorator.retry.Retrier;
import org.javai.decorator.retry.RetryConfig;
import org.javai.decorator.timeout.Deadline;
import org.javai.decorator.timeout.TimeoutConfig;

import java.util.Objects;

/**
 * Produces wrappers for blocking operations from their configuration.
 *
 * <p>Callback references are resolved here, when the wrapper is created, so a missing
 * or unknown callback is a {@link CompositionException} at composition time and never
 * a failure of the wrapped call.</p>
 *
 * <pre>{@code
 * Decorators decorators = Decorators.builder()
 *     .registry(registry)
 *     .reporter(new Log4jOpReporter())
 *     .build();
 *
 * Operation<Order> fetch = () -> ordersApi.fetch(id);
 * Operation<Order> resilient = fetch
 *     .decorate(decorators.hook(HookConfig.of(CallbackRef.named("begin"), CallbackRef.named("end"))))
 *     .decorate(decorators.retry("OrdersApi.fetch", RetryConfig.ofMillis(3, 100)));
 * }</pre>
 */
public final class Decorators {

    static final String DEFAULT_OPERATION = "operation";

    private final CallbackRegistry registry;
    private final OpReporter reporter;

    private Decorators(CallbackRegistry registry, OpReporter reporter) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    /**
     * Decorators with an empty registry and no reporting.
     * Only bound callback references can be used.
     */
    public static Decorators standard() {
        return new Decorators(CallbackRegistry.empty(), OpReporter.noOp());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link Decorators}.
     */
    public static final class Builder {
        private CallbackRegistry registry = CallbackRegistry.empty();
        private OpReporter reporter = OpReporter.noOp();

        private Builder() {}

        public Builder registry(CallbackRegistry registry) {
            this.registry = Objects.requireNonNull(registry, "registry must not be null");
            return this;
        }

        public Builder reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        public Decorators build() {
            return new Decorators(registry, reporter);
        }
    }

    /**
     * Runs a success callback after every Ok outcome.
     *
     * @param onOk the success callback (required)
     * @throws CompositionException if the reference is null or cannot be resolved
     */
    public <T> Decorator<T> onOk(CallbackRef onOk) {
        if (onOk == null) {
            throw new CompositionException("Missing callback");
        }
        Callback callback = registry.resolve(onOk);
        return operation -> OutcomeDispatcher.onOk(operation, callback);
    }

    /**
     * Runs the matching optional callback after every outcome.
     *
     * @throws CompositionException if a present reference cannot be resolved
     */
    public <T> Decorator<T> onResult(DispatchConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        Callback onOk = registry.resolveOptional(config.onOk());
        Callback onErr = registry.resolveOptional(config.onErr());
        return operation -> OutcomeDispatcher.onResult(operation, onOk, onErr);
    }

    public <T> Decorator<T> retry(RetryConfig config) {
        return retry(DEFAULT_OPERATION, config);
    }

    /**
     * Re-invokes failed operations with a fixed delay.
     *
     * @param operation the operation name used when reporting retries
     * @param config the retry configuration
     */
    public <T> Decorator<T> retry(String operation, RetryConfig config) {
        Objects.requireNonNull(operation, "operation must not be null");
        Retrier retrier = Retrier.builder().config(config).reporter(reporter).build();
        return work -> retrier.wrap(operation, work);
    }

    public <T> Decorator<T> timeout(TimeoutConfig config) {
        return timeout(DEFAULT_OPERATION, config);
    }

    /**
     * Races operations against a deadline on a worker thread.
     *
     * @param operation the operation name used in synthesized failures
     * @param config the deadline configuration
     */
    public <T> Decorator<T> timeout(String operation, TimeoutConfig config) {
        Objects.requireNonNull(operation, "operation must not be null");
        Deadline deadline = Deadline.builder().config(config).reporter(reporter).build();
        return work -> deadline.wrap(operation, work);
    }

    /**
     * Runs optional callbacks before and after operations.
     *
     * @throws CompositionException if a present reference cannot be resolved
     */
    public <T> Decorator<T> hook(HookConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        Callback pre = registry.resolveOptional(config.pre());
        Callback post = registry.resolveOptional(config.post());
        return operation -> HookController.wrap(operation, pre, post);
    }
}
