package org.javai.runtimeapi.boundary;

import org.javai.runtimeapi.ErrorKind;

/**
 * Decides whether a lower-level failure is recoverable.
 * This is the only place a failure gets its {@link ErrorKind}; there is no fallback
 * classification, so every boundary must be given one explicitly.
 */
@FunctionalInterface
public interface ErrorClassifier {

    /**
     * Classifies an exception into an ErrorKind.
     *
     * @param operation The operation that was being performed
     * @param throwable The exception that occurred
     * @return The kind, never null
     */
    ErrorKind classify(String operation, Throwable throwable);
}
