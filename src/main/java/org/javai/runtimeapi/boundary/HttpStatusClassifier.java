package org.javai.runtimeapi.boundary;

import org.javai.runtimeapi.ApiError;
import org.javai.runtimeapi.ErrorKind;

/**
 * Classifies non-success HTTP responses from the runtime API.
 *
 * <p>Server errors (5xx) and throttling (429) are recoverable. Every other
 * non-success status means the request itself is wrong and is unrecoverable.
 */
public final class HttpStatusClassifier {

    private static final int TOO_MANY_REQUESTS = 429;

    private HttpStatusClassifier() {
        // Utility class
    }

    /**
     * Classifies a non-success status.
     *
     * @param operation The request that received the status
     * @param status The HTTP status code
     * @return The kind of the failure
     * @throws IllegalArgumentException if the status is a success status
     */
    public static ErrorKind classify(String operation, int status) {
        if (isSuccess(status)) {
            throw new IllegalArgumentException("status " + status + " is not an error");
        }
        String message = operation + " returned HTTP " + status;
        if (status >= 500 || status == TOO_MANY_REQUESTS) {
            return ErrorKind.recoverable(message);
        }
        return ErrorKind.unrecoverable(message);
    }

    /**
     * Throws a classified {@link ApiError} unless the status is 2xx.
     */
    public static void requireSuccess(String operation, int status) throws ApiError {
        if (!isSuccess(status)) {
            throw new ApiError(classify(operation, status));
        }
    }

    private static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }
}
