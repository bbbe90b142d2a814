package org.javai.decorator;

import org.javai.decorator.ops.OpReporter;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Collects every reported event. Safe to use from deadline worker threads.
 */
public class RecordingReporter implements OpReporter {

    public record RetryAttempt(Failure failure, int attemptNumber, Duration delay) {}
    public record RetryExhausted(Failure failure, int totalAttempts) {}
    public record LateCompletion(String operation, Outcome<?> outcome) {}

    public final List<Failure> failures = new CopyOnWriteArrayList<>();
    public final List<RetryAttempt> retries = new CopyOnWriteArrayList<>();
    public final List<RetryExhausted> exhausted = new CopyOnWriteArrayList<>();
    public final List<LateCompletion> lateCompletions = new CopyOnWriteArrayList<>();

    @Override
    public void report(Failure failure) {
        failures.add(failure);
    }

    @Override
    public void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay) {
        retries.add(new RetryAttempt(failure, attemptNumber, delay));
    }

    @Override
    public void reportRetryExhausted(Failure failure, int totalAttempts) {
        exhausted.add(new RetryExhausted(failure, totalAttempts));
    }

    @Override
    public void reportLateCompletion(String operation, Outcome<?> outcome) {
        lateCompletions.add(new LateCompletion(operation, outcome));
    }
}
