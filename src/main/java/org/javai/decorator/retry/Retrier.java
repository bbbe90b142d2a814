package org.javai.decorator.retry;

import org.javai.decorator.Operation;
import org.javai.decorator.Outcome;
import org.javai.decorator.ops.OpReporter;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Re-invokes an operation until it succeeds or the configured attempts are used up.
 * Operates entirely over Outcome values and never synthesizes a result: the caller
 * receives the last outcome observed.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Retrier retrier = Retrier.builder()
 *     .config(RetryConfig.ofMillis(3, 100))
 *     .reporter(reporter)
 *     .build();
 *
 * Outcome<Response> result = retrier.execute("FetchUser", () -> userApi.fetch(userId));
 * }</pre>
 */
public final class Retrier {

    private final RetryConfig config;
    private final OpReporter reporter;
    private final Sleeper sleeper;

    private Retrier(RetryConfig config, OpReporter reporter, Sleeper sleeper) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a Retrier with the given configuration and no reporting.
     */
    public static Retrier of(RetryConfig config) {
        return builder().config(config).build();
    }

    /**
     * Builder for configuring a Retrier instance.
     */
    public static final class Builder {
        private RetryConfig config = RetryConfig.none();
        private OpReporter reporter = OpReporter.noOp();
        private Sleeper sleeper = Thread::sleep;

        private Builder() {}

        /**
         * Sets the retry configuration (optional, defaults to no retries).
         */
        public Builder config(RetryConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        /**
         * Sets the reporter for retry events (optional, defaults to no-op).
         */
        public Builder reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets the sleeper for testing (package-private).
         */
        Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        public Retrier build() {
            return new Retrier(config, reporter, sleeper);
        }
    }

    public RetryConfig config() {
        return config;
    }

    /**
     * Executes an operation, retrying failed attempts.
     *
     * @param operation The operation name for reporting
     * @param attempt The operation to run on every attempt
     * @return The first Ok outcome, or the last Fail once attempts are exhausted
     */
    public <T> Outcome<T> execute(String operation, Operation<T> attempt) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(attempt, "attempt must not be null");

        RetryContext context = RetryContext.first();
        Outcome<T> result = invoke(attempt);

        while (result instanceof Outcome.Fail<T> fail) {
            RetryDecision decision = config.decide(context);

            if (decision instanceof RetryDecision.GiveUp) {
                reporter.reportRetryExhausted(fail.failure(), context.attemptNumber());
                return result;
            }

            Duration delay = ((RetryDecision.Retry) decision).delay();
            reporter.reportRetryAttempt(fail.failure(), context.attemptNumber(), delay);
            sleep(delay);
            context = context.next();
            result = invoke(attempt);
        }

        return result;
    }

    /**
     * Wraps an operation so that every invocation runs through this retrier.
     *
     * @param operation The operation name for reporting
     * @param attempt The operation to wrap
     * @return The retrying operation
     */
    public <T> Operation<T> wrap(String operation, Operation<T> attempt) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(attempt, "attempt must not be null");
        return () -> execute(operation, attempt);
    }

    private static <T> Outcome<T> invoke(Operation<T> attempt) {
        return Objects.requireNonNull(attempt.invoke(), "operation returned a null outcome");
    }

    private void sleep(Duration duration) {
        if (duration.isZero()) {
            return;
        }
        try {
            sleeper.sleep(TimeUnit.MILLISECONDS.convert(duration));
        } catch (InterruptedException e) {
            // Remaining delays are cut short; the attempt count is kept.
            Thread.currentThread().interrupt();
        }
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
