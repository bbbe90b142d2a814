package org.javai.decorator.async;

import org.javai.decorator.CompositionException;
import org.javai.decorator.callback.CallbackRef;
import org.javai.decorator.callback.CallbackRegistry;
import org.javai.decorator.dispatch.DispatchConfig;
import org.javai.decorator.hook.HookConfig;
import org.javai.decorator.ops.OpReporter;
import org.javai.decorator.retry.RetryConfig;
import org.javai.decorator.timeout.TimeoutConfig;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Produces wrappers for {@link AsyncOperation}s from their configuration.
 * Mirrors {@link org.javai.decorator.Decorators}: the same configuration yields the
 * same externally observable behavior, without blocking the calling thread.
 */
public final class AsyncDecorators {

    private static final String DEFAULT_OPERATION = "operation";

    private final CallbackRegistry registry;
    private final OpReporter reporter;
    private final Executor executor;

    private AsyncDecorators(CallbackRegistry registry, OpReporter reporter, Executor executor) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    public static AsyncDecorators standard() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link AsyncDecorators}.
     */
    public static final class Builder {
        private CallbackRegistry registry = CallbackRegistry.empty();
        private OpReporter reporter = OpReporter.noOp();
        private Executor executor = ForkJoinPool.commonPool();

        private Builder() {}

        public Builder registry(CallbackRegistry registry) {
            this.registry = Objects.requireNonNull(registry, "registry must not be null");
            return this;
        }

        public Builder reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets the executor used to start raced operations and to resume after retry delays.
         */
        public Builder executor(Executor executor) {
            this.executor = Objects.requireNonNull(executor, "executor must not be null");
            return this;
        }

        public AsyncDecorators build() {
            return new AsyncDecorators(registry, reporter, executor);
        }
    }

    /**
     * @throws CompositionException if the reference is null or cannot be resolved
     */
    public <T> AsyncDecorator<T> onOk(CallbackRef onOk) {
        if (onOk == null) {
            throw new CompositionException("Missing callback");
        }
        AsyncCallback callback = AsyncCallback.of(registry.resolve(onOk));
        return operation -> AsyncOutcomeDispatcher.onOk(operation, callback);
    }

    /**
     * @throws CompositionException if a present reference cannot be resolved
     */
    public <T> AsyncDecorator<T> onResult(DispatchConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        AsyncCallback onOk = resolve(config.onOk());
        AsyncCallback onErr = resolve(config.onErr());
        return operation -> AsyncOutcomeDispatcher.onResult(operation, onOk, onErr);
    }

    public <T> AsyncDecorator<T> retry(RetryConfig config) {
        return retry(DEFAULT_OPERATION, config);
    }

    public <T> AsyncDecorator<T> retry(String operation, RetryConfig config) {
        Objects.requireNonNull(operation, "operation must not be null");
        AsyncRetrier retrier = AsyncRetrier.builder()
                .config(config)
                .reporter(reporter)
                .executor(executor)
                .build();
        return work -> retrier.wrap(operation, work);
    }

    public <T> AsyncDecorator<T> timeout(TimeoutConfig config) {
        return timeout(DEFAULT_OPERATION, config);
    }

    public <T> AsyncDecorator<T> timeout(String operation, TimeoutConfig config) {
        Objects.requireNonNull(operation, "operation must not be null");
        AsyncDeadline deadline = AsyncDeadline.builder()
                .config(config)
                .reporter(reporter)
                .executor(executor)
                .build();
        return work -> deadline.wrap(operation, work);
    }

    /**
     * @throws CompositionException if a present reference cannot be resolved
     */
    public <T> AsyncDecorator<T> hook(HookConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        AsyncCallback pre = resolve(config.pre());
        AsyncCallback post = resolve(config.post());
        return operation -> AsyncHookController.wrap(operation, pre, post);
    }

    private AsyncCallback resolve(Optional<CallbackRef> ref) {
        return ref.map(registry::resolve).map(AsyncCallback::of).orElse(null);
    }
}
