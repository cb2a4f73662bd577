package org.javai.resilience;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Resolves configuration from system properties, falling back to environment variables.
 *
 * <p>A blank value counts as absent. Malformed numbers are reported with the key that
 * held them.
 */
public final class ConfigResolver {

	private static final ConfigResolver SYSTEM = new ConfigResolver(System::getProperty, System::getenv);

	private final Function<String, String> properties;
	private final Function<String, String> environment;

	/**
	 * Creates a resolver over explicit lookups.
	 *
	 * @param properties system property lookup
	 * @param environment environment variable lookup
	 */
	public ConfigResolver(Function<String, String> properties, Function<String, String> environment) {
		this.properties = Objects.requireNonNull(properties, "properties must not be null");
		this.environment = Objects.requireNonNull(environment, "environment must not be null");
	}

	/**
	 * The resolver backed by {@link System#getProperty(String)} and {@link System#getenv(String)}.
	 */
	public static ConfigResolver system() {
		return SYSTEM;
	}

	public Optional<String> resolve(String sysProp, String envVar) {
		String value = properties.apply(sysProp);
		if (value == null || value.isBlank()) {
			value = environment.apply(envVar);
		}
		if (value == null || value.isBlank()) {
			return Optional.empty();
		}
		return Optional.of(value.trim());
	}

	/**
	 * Resolves a required value.
	 *
	 * @throws IllegalStateException if neither source is set
	 */
	public String resolveRequired(String sysProp, String envVar) {
		return resolve(sysProp, envVar).orElseThrow(() -> new IllegalStateException(
				"Missing required configuration: set system property '" + sysProp +
				"' or environment variable '" + envVar + "'"));
	}

	public String resolveString(String sysProp, String envVar, String defaultValue) {
		return resolve(sysProp, envVar).orElse(defaultValue);
	}

	public int resolveInt(String sysProp, String envVar, int defaultValue) {
		return resolve(sysProp, envVar).map(v -> parse(sysProp, v, Integer::parseInt)).orElse(defaultValue);
	}

	public long resolveLong(String sysProp, String envVar, long defaultValue) {
		return resolve(sysProp, envVar).map(v -> parse(sysProp, v, Long::parseLong)).orElse(defaultValue);
	}

	public double resolveDouble(String sysProp, String envVar, double defaultValue) {
		return resolve(sysProp, envVar).map(v -> parse(sysProp, v, Double::parseDouble)).orElse(defaultValue);
	}

	private static <N> N parse(String key, String value, Function<String, N> parser) {
		try {
			return parser.apply(value);
		} catch (NumberFormatException e) {
			throw new IllegalStateException("Invalid number for '" + key + "': " + value, e);
		}
	}
}
