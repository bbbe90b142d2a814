package org.javai.decorator.ops.metrics;

import org.javai.decorator.Failure;
import org.javai.decorator.Outcome;
import org.javai.decorator.ops.OpReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Reports wrapper events as JSON-lines metrics via SLF4J.
 *
 * <p>One JSON object per event, suitable for metrics aggregation. The tracking key is
 * the operation name, optionally prefixed with a namespace.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"retry_attempt","timestamp":"2024-01-20T10:30:00Z","trackingKey":"myapp.Orders.fetch","attemptNumber":"1","delayMs":"100",...}
 * }</pre>
 */
public class MetricsOpReporter implements OpReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.decorator.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;

	private final String namespace;
	private final Logger logger;

	public MetricsOpReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsOpReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	public MetricsOpReporter(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName));
	}

	/**
	 * Package-private for testing.
	 */
	MetricsOpReporter(String namespace, Logger logger) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
	}

	@Override
	public void report(Failure failure) {
		StringBuilder sb = begin("failure", failure.occurredAt(), failure.operation());
		appendField(sb, "id", failure.id().toString());
		appendField(sb, "type", failure.type().name());
		appendField(sb, "message", failure.message());
		appendTags(sb, failure.tags());
		logger.info(end(sb));
	}

	@Override
	public void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay) {
		StringBuilder sb = begin("retry_attempt", Instant.now(), failure.operation());
		appendField(sb, "attemptNumber", String.valueOf(attemptNumber));
		appendField(sb, "delayMs", String.valueOf(TimeUnit.MILLISECONDS.convert(delay)));
		appendField(sb, "id", failure.id().toString());
		logger.info(end(sb));
	}

	@Override
	public void reportRetryExhausted(Failure failure, int totalAttempts) {
		StringBuilder sb = begin("retry_exhausted", Instant.now(), failure.operation());
		appendField(sb, "totalAttempts", String.valueOf(totalAttempts));
		appendField(sb, "id", failure.id().toString());
		logger.info(end(sb));
	}

	@Override
	public void reportLateCompletion(String operation, Outcome<?> outcome) {
		StringBuilder sb = begin("late_completion", Instant.now(), operation);
		appendField(sb, "result", outcome.isOk() ? "ok" : "fail");
		logger.info(end(sb));
	}

	String buildTrackingKey(String operation) {
		if (namespace == null) {
			return operation;
		}
		return namespace + "." + operation;
	}

	private StringBuilder begin(String eventType, Instant timestamp, String operation) {
		StringBuilder sb = new StringBuilder("{");
		sb.append("\"eventType\":\"").append(eventType).append("\"");
		appendField(sb, "timestamp", ISO_FORMATTER.format(timestamp));
		appendField(sb, "trackingKey", buildTrackingKey(operation));
		return sb;
	}

	private static String end(StringBuilder sb) {
		return sb.append("}").toString();
	}

	private static void appendField(StringBuilder sb, String key, String value) {
		sb.append(",\"").append(key).append("\":\"").append(escapeJson(value)).append("\"");
	}

	private static void appendTags(StringBuilder sb, Map<String, String> tags) {
		if (tags.isEmpty()) {
			return;
		}
		sb.append(",\"tags\":{");
		boolean first = true;
		for (Map.Entry<String, String> entry : tags.entrySet()) {
			if (!first) {
				sb.append(",");
			}
			sb.append("\"").append(escapeJson(entry.getKey())).append("\":\"")
			  .append(escapeJson(entry.getValue())).append("\"");
			first = false;
		}
		sb.append("}");
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}

	static String escapeJson(String s) {
		if (s == null) {
			return "";
		}
		return s.replace("\\", "\\\\")
				.replace("\"", "\\\"")
				.replace("\n", "\\n")
				.replace("\r", "\\r")
				.replace("\t", "\\t");
	}
}
