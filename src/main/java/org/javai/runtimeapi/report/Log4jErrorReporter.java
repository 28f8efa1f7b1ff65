package org.javai.runtimeapi.report;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.runtimeapi.ApiError;
import org.javai.runtimeapi.ErrorEnvelope;

/**
 * Reports errors using Log4j2, writing each envelope in its wire format.
 *
 * <ul>
 *   <li>init errors → ERROR</li>
 *   <li>invocation errors → WARN</li>
 *   <li>retry attempts → INFO</li>
 *   <li>retry exhausted → WARN</li>
 * </ul>
 */
public class Log4jErrorReporter implements ErrorReporter {

	public static final Marker INIT_ERROR_MARKER = MarkerManager.getMarker("INIT_ERROR");
	public static final Marker INVOCATION_ERROR_MARKER = MarkerManager.getMarker("INVOCATION_ERROR");
	public static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	public static final Marker RETRY_EXHAUSTED_MARKER = MarkerManager.getMarker("RETRY_EXHAUSTED");

	private final Logger logger;
	private final ErrorEnvelopeJson json;

	public Log4jErrorReporter() {
		this(LogManager.getLogger("org.javai.runtimeapi.ErrorReporter"));
	}

	public Log4jErrorReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	public Log4jErrorReporter(Logger logger) {
		this.logger = logger;
		this.json = new ErrorEnvelopeJson();
	}

	@Override
	public void reportInitError(ErrorEnvelope envelope) {
		logger.atError()
			.withMarker(INIT_ERROR_MARKER)
			.log("Initialization failed: {}", json.write(envelope));
	}

	@Override
	public void reportInvocationError(String requestId, ErrorEnvelope envelope) {
		logger.atWarn()
			.withMarker(INVOCATION_ERROR_MARKER)
			.log("Invocation [{}] failed: {}", requestId, json.write(envelope));
	}

	@Override
	public void reportRetryAttempt(ApiError error, int attemptNumber, String policyId) {
		logger.atInfo()
			.withMarker(RETRY_MARKER)
			.log("Retry after attempt {} with policy [{}]: {}", attemptNumber, policyId, error.getMessage());
	}

	@Override
	public void reportRetryExhausted(ApiError error, int totalAttempts, String policyId) {
		logger.atWarn()
			.withMarker(RETRY_EXHAUSTED_MARKER)
			.log("Gave up after {} attempts with policy [{}], recoverable={}: {}",
				totalAttempts, policyId, error.isRecoverable(), error.getMessage());
	}
}
