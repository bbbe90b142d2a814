package org.javai.decorator.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.decorator.Failure;
import org.javai.decorator.FailureType;
import org.javai.decorator.Outcome;
import org.javai.decorator.ops.OpReporter;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Reports wrapper events using Log4j2.
 *
 * <p>Failures are logged at a level chosen by their {@link FailureType}:
 * <ul>
 *   <li>{@code CHANNEL} → ERROR (a result was lost)</li>
 *   <li>{@code TIMEOUT} → WARN</li>
 *   <li>{@code OPERATIONAL} → INFO</li>
 * </ul>
 *
 * <p>Each event carries a marker ({@code FAILURE}, {@code RETRY}, {@code RETRY_EXHAUSTED},
 * {@code LATE_COMPLETION}) so appenders can route or filter them.
 */
public class Log4jOpReporter implements OpReporter {

	static final Marker FAILURE_MARKER = MarkerManager.getMarker("FAILURE");
	static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	static final Marker RETRY_EXHAUSTED_MARKER = MarkerManager.getMarker("RETRY_EXHAUSTED");
	static final Marker LATE_COMPLETION_MARKER = MarkerManager.getMarker("LATE_COMPLETION");

	private final Logger logger;

	/**
	 * Creates a Log4jOpReporter using the default logger name.
	 */
	public Log4jOpReporter() {
		this(LogManager.getLogger("org.javai.decorator.OpReporter"));
	}

	public Log4jOpReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	public Log4jOpReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(Failure failure) {
		logger.atLevel(levelFor(failure.type()))
			.withMarker(FAILURE_MARKER)
			.withThrowable(failure.exception())
			.log(formatFailureMessage(failure));
	}

	@Override
	public void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay) {
		logger.atInfo()
			.withMarker(RETRY_MARKER)
			.log("Retry after attempt {} for operation [{}] in {}ms. Id: {}, Message: {}",
				attemptNumber,
				failure.operation(),
				TimeUnit.MILLISECONDS.convert(delay),
				failure.id(),
				failure.message());
	}

	@Override
	public void reportRetryExhausted(Failure failure, int totalAttempts) {
		logger.atWarn()
			.withMarker(RETRY_EXHAUSTED_MARKER)
			.log("Retry exhausted for operation [{}] after {} attempts. Id: {}, Message: {}",
				failure.operation(),
				totalAttempts,
				failure.id(),
				failure.message());
	}

	@Override
	public void reportLateCompletion(String operation, Outcome<?> outcome) {
		logger.atDebug()
			.withMarker(LATE_COMPLETION_MARKER)
			.log("Operation [{}] completed after its deadline with {}; result discarded",
				operation,
				outcome.isOk() ? "Ok" : "Fail");
	}

	private String formatFailureMessage(Failure failure) {
		return """
			Failure in operation [%s]: %s \
			| id=%s, type=%s%s\
			""".formatted(
				failure.operation(),
				failure.message(),
				failure.id(),
				failure.type(),
				formatTags(failure.tags())
			).trim();
	}

	private static String formatTags(Map<String, String> tags) {
		if (tags == null || tags.isEmpty()) {
			return "";
		}
		return ", tags={" + tags.entrySet().stream()
				.map(e -> e.getKey() + "=" + e.getValue())
				.reduce((a, b) -> a + ", " + b)
				.orElse("") + "}";
	}

	private static Level levelFor(FailureType type) {
		return switch (type) {
			case CHANNEL -> Level.ERROR;
			case TIMEOUT -> Level.WARN;
			case OPERATIONAL -> Level.INFO;
		};
	}
}
