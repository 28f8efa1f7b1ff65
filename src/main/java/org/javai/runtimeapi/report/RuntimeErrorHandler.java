package org.javai.runtimeapi.report;

import org.javai.runtimeapi.ApiError;
import org.javai.runtimeapi.ErrorContext;
import org.javai.runtimeapi.ErrorEnvelope;
import org.javai.runtimeapi.ErrorKind;
import org.javai.runtimeapi.boundary.ThrowingSupplier;
import org.javai.runtimeapi.retry.Retrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Turns final errors into reported envelopes.
 *
 * <p>Recoverable errors are retried by the {@link Retrier} and never reported while a
 * later attempt can still succeed. Only the error that ends the unit of work becomes an
 * {@link ErrorEnvelope}. A failure of the reporter itself is logged, never rethrown.
 *
 * <pre>{@code
 * RuntimeErrorHandler errors = new RuntimeErrorHandler(retrier, new Log4jErrorReporter());
 * Handler handler = errors.initialize("Runtime.loadHandler", () -> loadHandler());
 * }</pre>
 */
public final class RuntimeErrorHandler {

    private static final Logger logger = LoggerFactory.getLogger(RuntimeErrorHandler.class);

    private final Retrier retrier;
    private final ErrorReporter reporter;

    public RuntimeErrorHandler(Retrier retrier, ErrorReporter reporter) {
        this.retrier = Objects.requireNonNull(retrier, "retrier must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    /**
     * Runs an initialization step. If it fails for good, the error is reported as an
     * init error and the runtime is told to stop. An unchecked exception is reported with
     * its own type tag and is never retried.
     *
     * @param operation The step name
     * @param work The step
     * @return The result of the step
     * @throws FatalInitializationException after the failure has been reported
     */
    public <T> T initialize(String operation, ThrowingSupplier<T, ApiError> work) {
        try {
            return retrier.execute(operation, work);
        } catch (ApiError error) {
            throw failInit(operation, ErrorEnvelope.from(error), error);
        } catch (RuntimeException e) {
            // Defects are never retried; the runtime still has to report them before stopping.
            ApiError error = new ApiError(ErrorContext.of(
                    ErrorKind.unrecoverable(operation + " failed: " + e), e));
            throw failInit(operation, ErrorEnvelope.fromThrowable(e), error);
        }
    }

    private FatalInitializationException failInit(String operation, ErrorEnvelope envelope, ApiError error) {
        logger.error("Initialization step [{}] failed: {}", operation, envelope.errorMessage());
        try {
            reporter.reportInitError(envelope);
        } catch (RuntimeException e) {
            logger.warn("Could not report init error for [{}]", operation, e);
        }
        return new FatalInitializationException(envelope, error);
    }

    /**
     * Reports the failure of one invocation. The runtime keeps serving invocations.
     *
     * @param requestId The id of the failed invocation
     * @param failure Whatever the handler threw
     * @return The envelope that was reported
     */
    public ErrorEnvelope reportInvocation(String requestId, Throwable failure) {
        Objects.requireNonNull(requestId, "requestId must not be null");
        ErrorEnvelope envelope = ErrorEnvelope.fromThrowable(failure);
        logger.debug("Invocation [{}] failed with {}", requestId, envelope.errorType());
        try {
            reporter.reportInvocationError(requestId, envelope);
        } catch (RuntimeException e) {
            logger.warn("Could not report invocation error for [{}]", requestId, e);
        }
        return envelope;
    }
}
