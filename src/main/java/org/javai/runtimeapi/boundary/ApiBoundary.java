package org.javai.runtimeapi.boundary;

import org.javai.runtimeapi.ApiError;
import org.javai.runtimeapi.ErrorContext;
import org.javai.runtimeapi.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * The point where checked exceptions from the transport become classified
 * {@link ApiError}s.
 *
 * <p>An {@code ApiError} thrown by the work passes through untouched: it was classified
 * where it was raised. RuntimeExceptions are defects, not API failures, and propagate
 * unchanged.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ApiBoundary boundary = ApiBoundary.of(new TransportErrorClassifier());
 *
 * Invocation next = boundary.call(
 *     "RuntimeApi.nextInvocation",
 *     () -> client.nextInvocation()
 * );
 * }</pre>
 */
public final class ApiBoundary {

    private static final Logger logger = LoggerFactory.getLogger(ApiBoundary.class);

    private final ErrorClassifier classifier;

    public ApiBoundary(ErrorClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    public static ApiBoundary of(ErrorClassifier classifier) {
        return new ApiBoundary(classifier);
    }

    /**
     * Executes work that may throw checked exceptions, classifying any failure once.
     *
     * @param operation The operation name, used in messages and classification
     * @param work The work to execute
     * @return The result of the work
     * @throws ApiError if the work failed
     */
    public <T> T call(String operation, ThrowingSupplier<T, ? extends Exception> work) throws ApiError {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");

        try {
            return work.get();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            if (e instanceof ApiError apiError) {
                throw apiError;
            }
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw classify(operation, e);
        }
    }

    private ApiError classify(String operation, Exception e) {
        ErrorKind kind = Objects.requireNonNull(classifier.classify(operation, e),
                "classifier returned no kind for " + e.getClass().getName());
        logger.debug("Classified failure of [{}] as {}", operation, kind.variant());
        return new ApiError(ErrorContext.of(kind, e));
    }
}
