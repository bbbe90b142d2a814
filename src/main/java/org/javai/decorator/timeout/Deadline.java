package org.javai.decorator.timeout;

import org.javai.decorator.Failure;
import org.javai.decorator.Operation;
import org.javai.decorator.Outcome;
import org.javai.decorator.ops.OpReporter;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Races an operation against a deadline on a dedicated worker thread.
 *
 * <p>If the operation finishes first its outcome is returned verbatim. If the deadline
 * elapses first the caller receives a {@link org.javai.decorator.FailureType#TIMEOUT}
 * failure immediately and the worker is left to finish on its own: it is detached,
 * not interrupted, so the operation's side effects may still happen. Its late result
 * is passed to {@link OpReporter#reportLateCompletion} and then dropped.</p>
 *
 * <p>If the worker stops without a result (the operation threw, or returned null),
 * the caller receives a {@link org.javai.decorator.FailureType#CHANNEL} failure
 * carrying the cause. An {@link Error} is rethrown on the worker after delivery so
 * that the thread's uncaught exception handler still sees it.</p>
 *
 * <pre>{@code
 * Deadline deadline = Deadline.builder()
 *     .config(TimeoutConfig.ofMillis(500))
 *     .reporter(reporter)
 *     .build();
 *
 * Outcome<Quote> quote = deadline.execute("PricingApi.quote", () -> pricing.quote(sku));
 * }</pre>
 */
public final class Deadline {

    private static final AtomicInteger WORKER_COUNTER = new AtomicInteger(0);

    private final TimeoutConfig config;
    private final OpReporter reporter;
    private final ThreadFactory threadFactory;

    private Deadline(TimeoutConfig config, OpReporter reporter, ThreadFactory threadFactory) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.threadFactory = Objects.requireNonNull(threadFactory, "threadFactory must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a Deadline with the given configuration, daemon workers and no reporting.
     */
    public static Deadline of(TimeoutConfig config) {
        return builder().config(config).build();
    }

    /**
     * Builder for configuring a Deadline instance.
     */
    public static final class Builder {
        private TimeoutConfig config;
        private OpReporter reporter = OpReporter.noOp();
        private ThreadFactory threadFactory = Deadline::daemonWorker;

        private Builder() {}

        /**
         * Sets the deadline configuration (required).
         */
        public Builder config(TimeoutConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        /**
         * Sets the reporter for timeouts and late completions (optional, defaults to no-op).
         */
        public Builder reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets the factory for worker threads (optional, defaults to daemon threads
         * named {@code deadline-N}). One thread is created per invocation.
         */
        public Builder threadFactory(ThreadFactory threadFactory) {
            this.threadFactory = Objects.requireNonNull(threadFactory, "threadFactory must not be null");
            return this;
        }

        /**
         * @throws NullPointerException if config has not been set
         */
        public Deadline build() {
            Objects.requireNonNull(config, "config must be set");
            return new Deadline(config, reporter, threadFactory);
        }
    }

    public TimeoutConfig config() {
        return config;
    }

    /**
     * Runs the operation on a new worker and waits at most the configured duration.
     *
     * @param operation The operation name for reporting
     * @param work The operation to run
     * @return The operation's outcome, or a TIMEOUT or CHANNEL failure
     */
    public <T> Outcome<T> execute(String operation, Operation<T> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");

        Duration duration = config.duration();
        Handoff<T> handoff = new Handoff<>();
        threadFactory.newThread(() -> runWorker(operation, work, handoff)).start();

        try {
            Handoff.Delivery<T> delivery = handoff.receive(duration);
            if (delivery == null) {
                return failWith(Failure.timeout(operation, duration));
            }
            Outcome<T> outcome = delivery.toOutcome(operation);
            if (delivery instanceof Handoff.Broken && outcome instanceof Outcome.Fail<T> fail) {
                reporter.report(fail.failure());
            }
            return outcome;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handoff.abandon();
            return failWith(Failure.channel(operation, "interrupted while waiting for result", e));
        }
    }

    /**
     * Wraps an operation so that every invocation runs against this deadline.
     */
    public <T> Operation<T> wrap(String operation, Operation<T> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");
        return () -> execute(operation, work);
    }

    private <T> Outcome<T> failWith(Failure failure) {
        reporter.report(failure);
        return Outcome.fail(failure);
    }

    private <T> void runWorker(String operation, Operation<T> work, Handoff<T> handoff) {
        Handoff.Delivery<T> delivery;
        Error fatal = null;
        try {
            Outcome<T> outcome = work.invoke();
            delivery = outcome == null
                    ? new Handoff.Broken<>("operation returned no outcome", null)
                    : new Handoff.Delivered<>(outcome);
        } catch (RuntimeException e) {
            delivery = new Handoff.Broken<>("operation terminated without a result: " + e, e);
        } catch (Error e) {
            delivery = new Handoff.Broken<>("operation terminated without a result: " + e, e);
            fatal = e;
        } catch (Throwable t) {
            // Undeclared checked exception.
            delivery = new Handoff.Broken<>("operation terminated without a result: " + t, t);
        }

        if (!handoff.deliver(delivery)) {
            reporter.reportLateCompletion(operation, delivery.toOutcome(operation));
        }
        if (fatal != null) {
            throw fatal;
        }
    }

    private static Thread daemonWorker(Runnable runnable) {
        Thread thread = new Thread(runnable, "deadline-" + WORKER_COUNTER.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    }
}
