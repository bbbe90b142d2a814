package org.javai.decorator.timeout;

import java.time.Duration;
import java.util.Objects;

/**
 * Deadline configuration.
 *
 * <p>A zero duration is accepted but races an already-elapsed timer against the
 * operation; neither result is guaranteed.
 *
 * @param duration How long the caller waits for the operation
 */
public record TimeoutConfig(Duration duration) {

    public TimeoutConfig {
        Objects.requireNonNull(duration, "duration must not be null");
        if (duration.isNegative()) {
            throw new IllegalArgumentException("duration must not be negative");
        }
    }

    public static TimeoutConfig of(Duration duration) {
        return new TimeoutConfig(duration);
    }

    public static TimeoutConfig ofMillis(long durationMs) {
        return new TimeoutConfig(Duration.ofMillis(durationMs));
    }
}
