package org.javai.decorator;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * A fully-contextualized failure carried by {@link Outcome.Fail}.
 *
 * <p>This is the error type of every {@link Operation}, so failures synthesized by
 * a wrapper (deadline expiry, a broken handoff) are always representable.
 *
 * @param id The failure identifier (namespace:name)
 * @param message Human-readable description
 * @param type Where the failure came from (OPERATIONAL, TIMEOUT, CHANNEL)
 * @param exception The underlying exception (may be null)
 * @param operation The operation that failed (e.g., "OrdersApi.fetchOrder")
 * @param occurredAt When the failure happened
 * @param tags Additional key-value metadata for observability
 */
public record Failure(
        FailureId id,
        String message,
        FailureType type,
        Throwable exception,
        String operation,
        Instant occurredAt,
        Map<String, String> tags
) {

    public static final FailureId TIMEOUT_ID = FailureId.of("deadline", "timeout");
    public static final FailureId CHANNEL_ID = FailureId.of("deadline", "channel");

    public Failure {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    /**
     * Creates a failure returned by the operation itself.
     */
    public static Failure operational(FailureId id, String message, String operation, Throwable exception) {
        return new Failure(id, message, FailureType.OPERATIONAL, exception, operation, Instant.now(), null);
    }

    /**
     * Creates the failure reported when a deadline elapses before the operation completes.
     *
     * @param operation The operation that timed out
     * @param duration The configured deadline
     */
    public static Failure timeout(String operation, Duration duration) {
        return new Failure(TIMEOUT_ID, "Function timed out after " + TimeUnit.MILLISECONDS.convert(duration) + "ms",
                FailureType.TIMEOUT, null, operation, Instant.now(), null);
    }

    /**
     * Creates the failure reported when the executing unit stops without delivering a result.
     *
     * @param operation The operation whose result was lost
     * @param detail What broke
     * @param exception The underlying exception (may be null)
     */
    public static Failure channel(String operation, String detail, Throwable exception) {
        return new Failure(CHANNEL_ID, "Channel error: " + detail,
                FailureType.CHANNEL, exception, operation, Instant.now(), null);
    }

    /**
     * Returns a new Failure with the given tags added to the existing ones.
     */
    public Failure withTags(Map<String, String> extra) {
        Objects.requireNonNull(extra, "extra must not be null");
        Map<String, String> merged = new HashMap<>(tags);
        merged.putAll(extra);
        return new Failure(id, message, type, exception, operation, occurredAt, merged);
    }

    public boolean isTimeout() {
        return type == FailureType.TIMEOUT;
    }

    public boolean isChannel() {
        return type == FailureType.CHANNEL;
    }
}
