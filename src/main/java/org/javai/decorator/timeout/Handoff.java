package org.javai.decorator.timeout;

import org.javai.decorator.Failure;
import org.javai.decorator.Outcome;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-producer, single-consumer slot between a deadline worker and its caller.
 *
 * <p>The state leaves {@code WAITING} exactly once: either the worker delivers
 * ({@code DELIVERED}) or the caller gives up ({@code ABANDONED}). Whichever side
 * loses the race knows it lost, so at most one result is ever observed.
 */
final class Handoff<T> {

    private enum State { WAITING, DELIVERED, ABANDONED }

    sealed interface Delivery<T> permits Delivered, Broken {
        Outcome<T> toOutcome(String operation);
    }

    record Delivered<T>(Outcome<T> outcome) implements Delivery<T> {
        @Override
        public Outcome<T> toOutcome(String operation) {
            return outcome;
        }
    }

    record Broken<T>(String detail, Throwable cause) implements Delivery<T> {
        @Override
        public Outcome<T> toOutcome(String operation) {
            return Outcome.fail(Failure.channel(operation, detail, cause));
        }
    }

    private final AtomicReference<State> state = new AtomicReference<>(State.WAITING);
    private final BlockingQueue<Delivery<T>> slot = new ArrayBlockingQueue<>(1);

    /**
     * Hands a result to the caller.
     *
     * @return false if the caller has already given up; the delivery is then dropped
     */
    boolean deliver(Delivery<T> delivery) {
        if (!state.compareAndSet(State.WAITING, State.DELIVERED)) {
            return false;
        }
        slot.add(delivery);
        return true;
    }

    /**
     * Waits for the worker's result.
     *
     * @return the delivery, or null if the timeout elapsed first
     */
    Delivery<T> receive(Duration timeout) throws InterruptedException {
        Delivery<T> delivery = slot.poll(TimeUnit.NANOSECONDS.convert(timeout), TimeUnit.NANOSECONDS);
        if (delivery != null) {
            return delivery;
        }
        if (state.compareAndSet(State.WAITING, State.ABANDONED)) {
            return null;
        }
        // The worker won the race after the poll expired; its add is imminent.
        return slot.take();
    }

    /**
     * Gives up without waiting further.
     *
     * @return false if the worker had already delivered
     */
    boolean abandon() {
        return state.compareAndSet(State.WAITING, State.ABANDONED);
    }
}
