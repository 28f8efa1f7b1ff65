package org.javai.runtimeapi.report;

import org.javai.runtimeapi.ApiError;
import org.javai.runtimeapi.ErrorEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;

/**
 * An {@link ErrorReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every call. A reporter that throws is logged
 * and skipped, so the remaining reporters still run.
 */
public final class CompositeErrorReporter implements ErrorReporter {

	private static final Logger logger = LoggerFactory.getLogger(CompositeErrorReporter.class);

	private final List<ErrorReporter> reporters;

	private CompositeErrorReporter(List<ErrorReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	public static CompositeErrorReporter of(ErrorReporter... reporters) {
		return new CompositeErrorReporter(Arrays.asList(reporters));
	}

	@Override
	public void reportInitError(ErrorEnvelope envelope) {
		forEach("reportInitError", reporter -> reporter.reportInitError(envelope));
	}

	@Override
	public void reportInvocationError(String requestId, ErrorEnvelope envelope) {
		forEach("reportInvocationError", reporter -> reporter.reportInvocationError(requestId, envelope));
	}

	@Override
	public void reportRetryAttempt(ApiError error, int attemptNumber, String policyId) {
		forEach("reportRetryAttempt", reporter -> reporter.reportRetryAttempt(error, attemptNumber, policyId));
	}

	@Override
	public void reportRetryExhausted(ApiError error, int totalAttempts, String policyId) {
		forEach("reportRetryExhausted", reporter -> reporter.reportRetryExhausted(error, totalAttempts, policyId));
	}

	public int size() {
		return reporters.size();
	}

	private void forEach(String method, Consumer<ErrorReporter> call) {
		for (ErrorReporter reporter : reporters) {
			try {
				call.accept(reporter);
			} catch (RuntimeException e) {
				logger.warn("ErrorReporter.{} failed for {}", method, reporter.getClass().getName(), e);
			}
		}
	}
}
