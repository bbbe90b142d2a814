package org.javai.decorator.config;

import org.javai.decorator.Outcome;
import org.javai.decorator.retry.RetryConfig;
import org.javai.decorator.timeout.Deadline;
import org.javai.decorator.timeout.TimeoutConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class DecoratorSettingsTest {

	private Map<String, String> properties;
	private Map<String, String> environment;
	private DecoratorSettings settings;

	@BeforeEach
	void setUp() {
		properties = new HashMap<>();
		environment = new HashMap<>();
		settings = new DecoratorSettings(properties::get, environment::get);
	}

	@Test
	void retry_readsSystemProperties() {
		properties.put("decorator.orders.retry.times", "3");
		properties.put("decorator.orders.retry.delay_ms", "250");

		assertThat(settings.retry("orders")).isEqualTo(RetryConfig.of(3, Duration.ofMillis(250)));
	}

	@Test
	void retry_fallsBackToEnvironment() {
		environment.put("DECORATOR_ORDERS_RETRY_TIMES", "2");

		assertThat(settings.retry("orders")).isEqualTo(RetryConfig.ofMillis(2, 0));
	}

	@Test
	void retry_propertyWinsOverEnvironment() {
		properties.put("decorator.orders.retry.times", "1");
		environment.put("DECORATOR_ORDERS_RETRY_TIMES", "9");

		assertThat(settings.retry("orders").times()).isEqualTo(1);
	}

	@Test
	void retry_defaultsToSingleAttempt() {
		assertThat(settings.retry("orders")).isEqualTo(RetryConfig.none());
	}

	@Test
	void retry_nonNumeric_isRejected() {
		properties.put("decorator.orders.retry.times", "many");

		assertThatThrownBy(() -> settings.retry("orders"))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("decorator.orders.retry.times");
	}

	@Test
	void retry_negative_isRejected() {
		properties.put("decorator.orders.retry.delay_ms", "-5");

		assertThatThrownBy(() -> settings.retry("orders")).isInstanceOf(IllegalStateException.class);
	}

	@Test
	void timeout_dashedNameMapsToEnvironmentKey() {
		environment.put("DECORATOR_PRICING_API_TIMEOUT_DURATION_MS", "1500");

		assertThat(settings.timeout("pricing-api")).isEqualTo(TimeoutConfig.ofMillis(1500));
	}

	@Test
	void timeout_missing_namesBothKeys() {
		assertThatThrownBy(() -> settings.timeout("orders"))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("decorator.orders.timeout.duration_ms")
				.hasMessageContaining("DECORATOR_ORDERS_TIMEOUT_DURATION_MS");
	}

	@Test
	void timeout_largestMillisValue_isUsable() {
		properties.put("decorator.orders.timeout.duration_ms", String.valueOf(Long.MAX_VALUE));

		TimeoutConfig config = settings.timeout("orders");

		assertThat(config.duration()).isEqualTo(Duration.ofMillis(Long.MAX_VALUE));
		assertThat(Deadline.of(config).execute("orders", () -> Outcome.ok("x")).getOrThrow()).isEqualTo("x");
	}

	@Test
	void blankValue_isTreatedAsMissing() {
		properties.put("decorator.orders.timeout.duration_ms", "  ");
		environment.put("DECORATOR_ORDERS_TIMEOUT_DURATION_MS", "40");

		assertThat(settings.timeout("orders").duration()).isEqualTo(Duration.ofMillis(40));
	}

	@Test
	void defaultConstructor_readsSystemProperties() {
		System.setProperty("decorator.settings-test.retry.times", "4");
		try {
			assertThat(new DecoratorSettings().retry("settings-test").times()).isEqualTo(4);
		} finally {
			System.clearProperty("decorator.settings-test.retry.times");
		}
	}
}
