package org.javai.decorator.ops.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.decorator.Failure;
import org.javai.decorator.FailureId;
import org.javai.decorator.Outcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Marker;
import org.slf4j.event.Level;
import org.slf4j.helpers.AbstractLogger;
import org.slf4j.helpers.MessageFormatter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class MetricsOpReporterTest {

	private final ObjectMapper mapper = new ObjectMapper();

	private List<String> capturedMessages;
	private CapturingLogger capturingLogger;
	private MetricsOpReporter reporter;

	@BeforeEach
	void setUp() {
		capturedMessages = new ArrayList<>();
		capturingLogger = new CapturingLogger(capturedMessages);
		reporter = new MetricsOpReporter(null, capturingLogger);
	}

	@Test
	void report_emitsFailureEventAsJsonLine() throws Exception {
		reporter.report(Failure.timeout("Pricing.quote", Duration.ofMillis(50)));

		JsonNode json = singleEvent();
		assertThat(json.get("eventType").asText()).isEqualTo("failure");
		assertThat(json.get("trackingKey").asText()).isEqualTo("Pricing.quote");
		assertThat(json.get("id").asText()).isEqualTo("deadline:timeout");
		assertThat(json.get("type").asText()).isEqualTo("TIMEOUT");
		assertThat(json.get("message").asText()).isEqualTo("Function timed out after 50ms");
		assertThat(json.hasNonNull("timestamp")).isTrue();
	}

	@Test
	void report_withNamespace_prependsToTrackingKey() throws Exception {
		new MetricsOpReporter("myapp", capturingLogger).report(failure("order.fetch", "down"));

		assertThat(singleEvent().get("trackingKey").asText()).isEqualTo("myapp.order.fetch");
	}

	@Test
	void report_withBlankNamespace_usesOperationOnly() throws Exception {
		new MetricsOpReporter("  ", capturingLogger).report(failure("order.fetch", "down"));

		assertThat(singleEvent().get("trackingKey").asText()).isEqualTo("order.fetch");
	}

	@Test
	void report_includesTags() throws Exception {
		reporter.report(failure("Op", "down").withTags(Map.of("region", "eu")));

		assertThat(singleEvent().get("tags").get("region").asText()).isEqualTo("eu");
	}

	@Test
	void report_escapesSpecialCharacters() throws Exception {
		reporter.report(failure("Op", "line one\nsaid \"hi\"\\"));

		assertThat(singleEvent().get("message").asText()).isEqualTo("line one\nsaid \"hi\"\\");
	}

	@Test
	void reportRetryAttempt_emitsAttemptAndDelay() throws Exception {
		reporter.reportRetryAttempt(failure("Op", "flaky"), 2, Duration.ofMillis(100));

		JsonNode json = singleEvent();
		assertThat(json.get("eventType").asText()).isEqualTo("retry_attempt");
		assertThat(json.get("attemptNumber").asText()).isEqualTo("2");
		assertThat(json.get("delayMs").asText()).isEqualTo("100");
	}

	@Test
	void reportRetryAttempt_hugeDelay_saturates() throws Exception {
		reporter.reportRetryAttempt(failure("Op", "flaky"), 1, Duration.ofSeconds(Long.MAX_VALUE));

		assertThat(singleEvent().get("delayMs").asText()).isEqualTo(String.valueOf(Long.MAX_VALUE));
	}

	@Test
	void reportRetryExhausted_emitsTotalAttempts() throws Exception {
		reporter.reportRetryExhausted(failure("Op", "flaky"), 4);

		JsonNode json = singleEvent();
		assertThat(json.get("eventType").asText()).isEqualTo("retry_exhausted");
		assertThat(json.get("totalAttempts").asText()).isEqualTo("4");
	}

	@Test
	void reportLateCompletion_emitsResultKind() throws Exception {
		reporter.reportLateCompletion("Op", Outcome.fail("test", "x", "x"));

		JsonNode json = singleEvent();
		assertThat(json.get("eventType").asText()).isEqualTo("late_completion");
		assertThat(json.get("trackingKey").asText()).isEqualTo("Op");
		assertThat(json.get("result").asText()).isEqualTo("fail");
	}

	private JsonNode singleEvent() throws Exception {
		assertThat(capturedMessages).hasSize(1);
		return mapper.readTree(capturedMessages.get(0));
	}

	private static Failure failure(String operation, String message) {
		return Failure.operational(FailureId.of("test", "x"), message, operation, null);
	}

	private static class CapturingLogger extends AbstractLogger {
		private final List<String> messages;

		CapturingLogger(List<String> messages) {
			this.name = "test";
			this.messages = messages;
		}

		@Override
		protected String getFullyQualifiedCallerName() {
			return null;
		}

		@Override
		protected void handleNormalizedLoggingCall(Level level, Marker marker, String messagePattern,
				Object[] arguments, Throwable throwable) {
			messages.add(MessageFormatter.basicArrayFormat(messagePattern, arguments));
		}

		@Override
		public boolean isTraceEnabled() { return false; }

		@Override
		public boolean isTraceEnabled(Marker marker) { return false; }

		@Override
		public boolean isDebugEnabled() { return false; }

		@Override
		public boolean isDebugEnabled(Marker marker) { return false; }

		@Override
		public boolean isInfoEnabled() { return true; }

		@Override
		public boolean isInfoEnabled(Marker marker) { return true; }

		@Override
		public boolean isWarnEnabled() { return true; }

		@Override
		public boolean isWarnEnabled(Marker marker) { return true; }

		@Override
		public boolean isErrorEnabled() { return true; }

		@Override
		public boolean isErrorEnabled(Marker marker) { return true; }
	}
}
