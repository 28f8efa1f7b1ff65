package org.javai.runtimeapi.report;

import org.javai.runtimeapi.ApiError;
import org.javai.runtimeapi.ErrorEnvelope;

/**
 * Receives the errors that end a unit of work, and optionally retry events.
 * Implementations send envelopes to the runtime API, write them to logs, or both.
 */
public interface ErrorReporter {

    /**
     * Reports that initialization failed for good. The runtime stops after this call.
     */
    void reportInitError(ErrorEnvelope envelope);

    /**
     * Reports that handling one invocation failed.
     *
     * @param requestId The id of the failed invocation
     * @param envelope The error to report
     */
    void reportInvocationError(String requestId, ErrorEnvelope envelope);

    /**
     * Reports a retry attempt.
     *
     * @param error The error that triggered the retry
     * @param attemptNumber The attempt that failed (1-based)
     * @param policyId The retry policy being applied
     */
    default void reportRetryAttempt(ApiError error, int attemptNumber, String policyId) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports that the retry policy gave up.
     *
     * @param error The final error
     * @param totalAttempts The total number of attempts made
     * @param policyId The retry policy that gave up
     */
    default void reportRetryExhausted(ApiError error, int totalAttempts, String policyId) {
        // Default: no-op. Implementations may override.
    }

    /**
     * A reporter that does nothing. Useful for testing.
     */
    static ErrorReporter noOp() {
        return new ErrorReporter() {
            @Override
            public void reportInitError(ErrorEnvelope envelope) {
            }

            @Override
            public void reportInvocationError(String requestId, ErrorEnvelope envelope) {
            }
        };
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     */
    static ErrorReporter composite(ErrorReporter... reporters) {
        return CompositeErrorReporter.of(reporters);
    }
}
