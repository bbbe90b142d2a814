package org.javai.decorator.async;

import org.javai.decorator.Failure;
import org.javai.decorator.Outcome;
import org.javai.decorator.ops.OpReporter;
import org.javai.decorator.timeout.TimeoutConfig;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative form of {@link org.javai.decorator.timeout.Deadline}.
 *
 * <p>The operation is started on an executor, so even an operation that blocks inside
 * {@link AsyncOperation#invoke()} cannot hold up the deadline. A timer races it; the
 * first to complete the result wins and the loser is ignored. When the timer wins the
 * running stage is cancelled. Cancellation is best effort: work already under way is
 * not stopped, its result is simply discarded.</p>
 *
 * <p>The timer completes the result on the JDK's delay scheduler thread, so stages
 * chained onto a timed-out result run there unless an async variant is used.</p>
 */
public final class AsyncDeadline {

    private final TimeoutConfig config;
    private final OpReporter reporter;
    private final Executor executor;

    private AsyncDeadline(TimeoutConfig config, OpReporter reporter, Executor executor) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static AsyncDeadline of(TimeoutConfig config) {
        return builder().config(config).build();
    }

    /**
     * Builder for configuring an AsyncDeadline instance.
     */
    public static final class Builder {
        private TimeoutConfig config;
        private OpReporter reporter = OpReporter.noOp();
        private Executor executor = ForkJoinPool.commonPool();

        private Builder() {}

        /**
         * Sets the deadline configuration (required).
         */
        public Builder config(TimeoutConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets the executor that starts the operation (optional, defaults to the common pool).
         */
        public Builder executor(Executor executor) {
            this.executor = Objects.requireNonNull(executor, "executor must not be null");
            return this;
        }

        /**
         * @throws NullPointerException if config has not been set
         */
        public AsyncDeadline build() {
            Objects.requireNonNull(config, "config must be set");
            return new AsyncDeadline(config, reporter, executor);
        }
    }

    /**
     * @param operation The operation name used in synthesized failures
     * @param work The operation to race
     * @return A stage completing with the operation's outcome, or a TIMEOUT or CHANNEL failure
     */
    public <T> CompletionStage<Outcome<T>> execute(String operation, AsyncOperation<T> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");

        Duration duration = config.duration();
        CompletableFuture<Outcome<T>> result = new CompletableFuture<>();

        CompletableFuture<CompletionStage<Outcome<T>>> launched = CompletableFuture.supplyAsync(work::invoke, executor);
        CompletableFuture<Outcome<T>> running = launched.thenCompose(
                stage -> Objects.requireNonNull(stage, "operation returned a null stage"));

        running.whenComplete((outcome, error) -> {
            if (result.isDone() && unwrap(error) instanceof CancellationException) {
                // Cancelled by the timer below.
                return;
            }
            Outcome<T> delivered = outcome != null ? outcome : broken(operation, error);
            if (result.complete(delivered)) {
                if (delivered instanceof Outcome.Fail<T> fail && fail.failure().isChannel()) {
                    reporter.report(fail.failure());
                }
            } else {
                reporter.reportLateCompletion(operation, delivered);
            }
        });

        Executor timer = CompletableFuture.delayedExecutor(TimeUnit.NANOSECONDS.convert(duration), TimeUnit.NANOSECONDS, Runnable::run);
        timer.execute(() -> {
            Failure timeout = Failure.timeout(operation, duration);
            if (result.complete(Outcome.fail(timeout))) {
                reporter.report(timeout);
                running.cancel(true);
                launched.cancel(false);
            }
        });

        return result;
    }

    public <T> AsyncOperation<T> wrap(String operation, AsyncOperation<T> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");
        return () -> execute(operation, work);
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
    }

    private static <T> Outcome<T> broken(String operation, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause == null) {
            return Outcome.fail(Failure.channel(operation, "operation returned no outcome", null));
        }
        return Outcome.fail(Failure.channel(operation, "operation terminated without a result: " + cause, cause));
    }
}
