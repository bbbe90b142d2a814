package org.javai.decorator.async;

import org.javai.decorator.Outcome;
import org.javai.decorator.ops.OpReporter;
import org.javai.decorator.retry.RetryConfig;
import org.javai.decorator.retry.RetryContext;
import org.javai.decorator.retry.RetryDecision;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative form of {@link org.javai.decorator.retry.Retrier}.
 *
 * <p>Same attempt accounting and reporting; the delay between attempts is a timer
 * hop rather than a sleeping thread. Every attempt after the first is started as a
 * new task on the executor, even with a zero delay, so long retry runs do not grow
 * the stack. A direct executor ({@code Runnable::run}) gives that up.</p>
 *
 * <pre>{@code
 * AsyncRetrier retrier = AsyncRetrier.builder()
 *     .config(RetryConfig.ofMillis(3, 10))
 *     .build();
 *
 * CompletionStage<Outcome<Quote>> quote = retrier.execute("PricingApi.quote", () -> pricing.quoteAsync(sku));
 * }</pre>
 */
public final class AsyncRetrier {

    private final RetryConfig config;
    private final OpReporter reporter;
    private final Executor executor;

    private AsyncRetrier(RetryConfig config, OpReporter reporter, Executor executor) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static AsyncRetrier of(RetryConfig config) {
        return builder().config(config).build();
    }

    /**
     * Builder for configuring an AsyncRetrier instance.
     */
    public static final class Builder {
        private RetryConfig config = RetryConfig.none();
        private OpReporter reporter = OpReporter.noOp();
        private Executor executor = ForkJoinPool.commonPool();

        private Builder() {}

        public Builder config(RetryConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets the executor that starts every attempt after the first (optional, defaults to the common pool).
         */
        public Builder executor(Executor executor) {
            this.executor = Objects.requireNonNull(executor, "executor must not be null");
            return this;
        }

        public AsyncRetrier build() {
            return new AsyncRetrier(config, reporter, executor);
        }
    }

    /**
     * @param operation The operation name for reporting
     * @param attempt The operation to run on every attempt
     * @return A stage completing with the first Ok outcome, or the last Fail
     */
    public <T> CompletionStage<Outcome<T>> execute(String operation, AsyncOperation<T> attempt) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(attempt, "attempt must not be null");
        CompletableFuture<Outcome<T>> result = new CompletableFuture<>();
        attempt(attempt, RetryContext.first(), result);
        return result;
    }

    public <T> AsyncOperation<T> wrap(String operation, AsyncOperation<T> attempt) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(attempt, "attempt must not be null");
        return () -> execute(operation, attempt);
    }

    private <T> void attempt(AsyncOperation<T> attempt, RetryContext context, CompletableFuture<Outcome<T>> result) {
        AsyncOperation.start(attempt).whenComplete((outcome, error) -> {
            if (error != null) {
                result.completeExceptionally(error);
                return;
            }
            try {
                next(attempt, context, outcome, result);
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
    }

    private <T> void next(
            AsyncOperation<T> attempt,
            RetryContext context,
            Outcome<T> outcome,
            CompletableFuture<Outcome<T>> result
    ) {
        if (!(outcome instanceof Outcome.Fail<T> fail)) {
            result.complete(outcome);
            return;
        }

        RetryDecision decision = config.decide(context);
        if (decision instanceof RetryDecision.GiveUp) {
            reporter.reportRetryExhausted(fail.failure(), context.attemptNumber());
            result.complete(outcome);
            return;
        }

        Duration delay = ((RetryDecision.Retry) decision).delay();
        reporter.reportRetryAttempt(fail.failure(), context.attemptNumber(), delay);
        // Every further attempt starts on a fresh executor task, never on this stack.
        resumeAfter(delay).execute(() -> attempt(attempt, context.next(), result));
    }

    private Executor resumeAfter(Duration delay) {
        if (delay.isZero()) {
            return executor;
        }
        return CompletableFuture.delayedExecutor(TimeUnit.NANOSECONDS.convert(delay), TimeUnit.NANOSECONDS, executor);
    }
}
