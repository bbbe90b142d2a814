package org.javai.decorator.ops;

import org.javai.decorator.Failure;
import org.javai.decorator.Outcome;

import java.time.Duration;

/**
 * Reports wrapper events for observability and operator notification.
 * Implementations might emit metrics, structured logs, or alerts.
 *
 * <p>Reporters observe; they never change the outcome a wrapper returns.
 */
public interface OpReporter {

    /**
     * Reports a failure synthesized or translated by a wrapper
     * (a timeout, a broken handoff, a classified exception).
     */
    void report(Failure failure);

    /**
     * Reports a retry about to happen.
     *
     * @param failure The failure that triggered the retry
     * @param attemptNumber The attempt that just failed (1-based)
     * @param delay The delay before the next attempt
     */
    default void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports that retry attempts have been exhausted.
     *
     * @param failure The final failure, which is also what the caller receives
     * @param totalAttempts The total number of attempts made
     */
    default void reportRetryExhausted(Failure failure, int totalAttempts) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports that an operation abandoned by its deadline finished after the caller had moved on.
     * The outcome is discarded after this call.
     *
     * @param operation The operation name
     * @param outcome The late outcome
     */
    default void reportLateCompletion(String operation, Outcome<?> outcome) {
        // Default: no-op. Implementations may override.
    }

    /**
     * A reporter that does nothing. Useful for testing.
     */
    static OpReporter noOp() {
        return failure -> {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     *
     * @param reporters the reporters to delegate to
     * @return a composite reporter
     */
    static OpReporter composite(OpReporter... reporters) {
        return CompositeOpReporter.of(reporters);
    }
}
