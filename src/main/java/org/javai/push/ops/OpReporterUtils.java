package org.javai.push.ops;

import java.util.Optional;

/**
 * Configuration helpers shared by reporters.
 */
public final class OpReporterUtils {

	private OpReporterUtils() {
		// Utility class
	}

	/**
	 * Resolves configuration from system property or environment variable.
	 *
	 * @param sysProp the system property name
	 * @param envVar the environment variable name
	 * @return the resolved value
	 * @throws IllegalStateException if neither is set
	 */
	public static String resolveConfig(String sysProp, String envVar) {
		return resolveOptionalConfig(sysProp, envVar).orElseThrow(() -> new IllegalStateException(
				"Missing required configuration: set system property '" + sysProp +
				"' or environment variable '" + envVar + "'"));
	}

	/**
	 * Like {@link #resolveConfig} but returns empty when neither source is set.
	 * The system property wins over the environment variable.
	 */
	public static Optional<String> resolveOptionalConfig(String sysProp, String envVar) {
		String value = System.getProperty(sysProp);
		if (value == null || value.isBlank()) {
			value = System.getenv(envVar);
		}
		if (value == null || value.isBlank()) {
			return Optional.empty();
		}
		return Optional.of(value.trim());
	}
}
