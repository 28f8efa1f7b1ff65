package org.javai.runtimeapi;

import java.util.Locale;
import java.util.Set;

/**
 * Resolves the ambient toggle that gates stack trace capture.
 *
 * <p>The system property {@value #PROPERTY} is consulted first, then the environment
 * variable {@value #ENV_VAR}. Capture is enabled only for {@code 1}, {@code true} or
 * {@code full}. The toggle is re-read on every call.
 */
public final class BacktraceSettings {

	public static final String PROPERTY = "runtime.api.backtrace";
	public static final String ENV_VAR = "RUNTIME_API_BACKTRACE";

	private static final Set<String> ENABLED_VALUES = Set.of("1", "true", "full");

	private BacktraceSettings() {
		// Utility class
	}

	public static boolean captureEnabled() {
		return isEnabledValue(resolve(PROPERTY, ENV_VAR));
	}

	static boolean isEnabledValue(String value) {
		if (value == null || value.isBlank()) {
			return false;
		}
		return ENABLED_VALUES.contains(value.trim().toLowerCase(Locale.ROOT));
	}

	private static String resolve(String sysProp, String envVar) {
		String value = System.getProperty(sysProp);
		if (value == null || value.isBlank()) {
			value = System.getenv(envVar);
		}
		return value;
	}
}
