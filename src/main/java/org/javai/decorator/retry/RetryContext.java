package org.javai.decorator.retry;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Bookkeeping for one invocation of a retrying operation.
 * Local to that invocation; never shared between calls.
 *
 * @param attemptNumber The current attempt number (1-based)
 * @param startedAt When the first attempt began
 * @param elapsed Time elapsed since the first attempt, as of the start of this attempt
 */
public record RetryContext(int attemptNumber, Instant startedAt, Duration elapsed) {

    public RetryContext {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be >= 1");
        }
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(elapsed, "elapsed must not be null");
    }

    public static RetryContext first() {
        return new RetryContext(1, Instant.now(), Duration.ZERO);
    }

    public RetryContext next() {
        return new RetryContext(attemptNumber + 1, startedAt, Duration.between(startedAt, Instant.now()));
    }
}
