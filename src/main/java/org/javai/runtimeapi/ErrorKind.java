package org.javai.runtimeapi;

import java.io.Serializable;
import java.util.Objects;

/**
 * Classifies an API failure as safe to retry or terminal.
 * The kind is fixed when the error is first recognized and never changes afterwards.
 *
 * @param variant Whether the failed operation may be retried
 * @param message Human-readable description of the cause
 */
public record ErrorKind(Variant variant, String message) implements Serializable {

    /**
     * The closed set of classifications. Adding a constant breaks every exhaustive
     * {@code switch} over it, which is where recoverability must be decided.
     */
    public enum Variant {
        /**
         * The operation failed but is safe to retry.
         */
        RECOVERABLE("Recoverable"),

        /**
         * The operation must not be retried. The caller reports a fatal failure
         * and stops the current invocation or initialization cycle.
         */
        UNRECOVERABLE("Unrecoverable");

        private final String label;

        Variant(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public ErrorKind {
        Objects.requireNonNull(variant, "variant must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static ErrorKind recoverable(String message) {
        return new ErrorKind(Variant.RECOVERABLE, message);
    }

    public static ErrorKind unrecoverable(String message) {
        return new ErrorKind(Variant.UNRECOVERABLE, message);
    }

    /**
     * Renders the kind as {@code "<Label> API error: <message>"}.
     */
    @Override
    public String toString() {
        return variant.label() + " API error: " + message;
    }
}
