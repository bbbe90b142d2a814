package org.javai.decorator.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Fixed-delay retry configuration.
 *
 * @param times Additional attempts after the first (total attempts = times + 1)
 * @param delay Pause between two attempts; never applied after the last one
 */
public record RetryConfig(int times, Duration delay) {

    private static final RetryConfig NONE = new RetryConfig(0, Duration.ZERO);

    public RetryConfig {
        Objects.requireNonNull(delay, "delay must not be null");
        if (times < 0) {
            throw new IllegalArgumentException("times must be >= 0, was: " + times);
        }
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative");
        }
    }

    /**
     * No retries: exactly one attempt.
     */
    public static RetryConfig none() {
        return NONE;
    }

    public static RetryConfig immediate(int times) {
        return new RetryConfig(times, Duration.ZERO);
    }

    public static RetryConfig of(int times, Duration delay) {
        return new RetryConfig(times, delay);
    }

    public static RetryConfig ofMillis(int times, long delayMs) {
        return new RetryConfig(times, Duration.ofMillis(delayMs));
    }

    public int maxAttempts() {
        return times + 1;
    }

    /**
     * Decides what follows a failed attempt.
     *
     * @param context The context of the attempt that just failed
     * @return Retry after the configured delay, or GiveUp once every attempt is used
     */
    public RetryDecision decide(RetryContext context) {
        if (context.attemptNumber() > times) {
            return RetryDecision.GiveUp.because("attempts exhausted");
        }
        return RetryDecision.Retry.after(delay);
    }
}
