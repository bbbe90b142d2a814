package org.javai.decorator.config;

import org.javai.decorator.retry.RetryConfig;
import org.javai.decorator.timeout.TimeoutConfig;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Resolves wrapper configuration by name from system properties, falling back to
 * environment variables.
 *
 * <p>For a wrapper named {@code orders}:
 * <ul>
 *   <li>{@code decorator.orders.retry.times} / {@code DECORATOR_ORDERS_RETRY_TIMES} (default 0)</li>
 *   <li>{@code decorator.orders.retry.delay_ms} / {@code DECORATOR_ORDERS_RETRY_DELAY_MS} (default 0)</li>
 *   <li>{@code decorator.orders.timeout.duration_ms} / {@code DECORATOR_ORDERS_TIMEOUT_DURATION_MS} (required)</li>
 * </ul>
 */
public final class DecoratorSettings {

	private static final String PREFIX = "decorator.";

	private final UnaryOperator<String> systemProperties;
	private final UnaryOperator<String> environment;

	public DecoratorSettings() {
		this(System::getProperty, System::getenv);
	}

	/**
	 * Package-private for testing.
	 */
	DecoratorSettings(UnaryOperator<String> systemProperties, UnaryOperator<String> environment) {
		this.systemProperties = Objects.requireNonNull(systemProperties, "systemProperties must not be null");
		this.environment = Objects.requireNonNull(environment, "environment must not be null");
	}

	public RetryConfig retry(String name) {
		long times = resolveLong(name, "retry.times", 0L);
		long delayMs = resolveLong(name, "retry.delay_ms", 0L);
		if (times > Integer.MAX_VALUE) {
			throw new IllegalStateException("Retry times out of range for '" + name + "': " + times);
		}
		try {
			return RetryConfig.of((int) times, Duration.ofMillis(delayMs));
		} catch (IllegalArgumentException e) {
			throw new IllegalStateException("Invalid retry configuration for '" + name + "': " + e.getMessage(), e);
		}
	}

	public TimeoutConfig timeout(String name) {
		String sysProp = propertyKey(name, "timeout.duration_ms");
		String envVar = environmentKey(sysProp);
		String value = lookup(sysProp, envVar);
		if (value == null) {
			throw new IllegalStateException(
				"Missing required configuration: set system property '" + sysProp +
				"' or environment variable '" + envVar + "'"
			);
		}
		try {
			return TimeoutConfig.ofMillis(parse(sysProp, value));
		} catch (IllegalArgumentException e) {
			throw new IllegalStateException("Invalid timeout configuration for '" + name + "': " + e.getMessage(), e);
		}
	}

	static String propertyKey(String name, String suffix) {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("name must not be null or empty");
		}
		return PREFIX + name + "." + suffix;
	}

	static String environmentKey(String propertyKey) {
		return propertyKey.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
	}

	private long resolveLong(String name, String suffix, long defaultValue) {
		String sysProp = propertyKey(name, suffix);
		String value = lookup(sysProp, environmentKey(sysProp));
		return value == null ? defaultValue : parse(sysProp, value);
	}

	private String lookup(String sysProp, String envVar) {
		String value = systemProperties.apply(sysProp);
		if (value == null || value.isBlank()) {
			value = environment.apply(envVar);
		}
		if (value == null || value.isBlank()) {
			return null;
		}
		return value.trim();
	}

	private static long parse(String key, String value) {
		try {
			return Long.parseLong(value);
		} catch (NumberFormatException e) {
			throw new IllegalStateException("Configuration '" + key + "' is not a number: " + value, e);
		}
	}
}
