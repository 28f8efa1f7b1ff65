package org.javai.runtimeapi;

import java.util.Objects;
import java.util.Optional;

/**
 * A classified failure of a call to the runtime API.
 *
 * <p>Callers branch on {@link #isRecoverable()}: recoverable errors are retried,
 * unrecoverable ones end the current invocation or initialization cycle with a fatal
 * report. The kind is fixed at construction; upper layers inspect it but never
 * reclassify.
 *
 * <p>Every {@code ApiError} reports the type tag {@value #ERROR_TYPE}, whatever its
 * kind and whatever tag its cause carries.
 */
public class ApiError extends Exception implements ReportableError {

    private static final long serialVersionUID = 1L;

    public static final String ERROR_TYPE = "RuntimeApiError";

    private final ErrorContext context;

    /**
     * Creates an error with a fresh chain for the given kind.
     */
    public ApiError(ErrorKind kind) {
        this(ErrorContext.of(kind));
    }

    /**
     * Creates an error that keeps the cause and backtrace already recorded in the context.
     */
    public ApiError(ErrorContext context) {
        super(Objects.requireNonNull(context, "context must not be null").toString(),
                context.cause().orElse(null));
        this.context = context;
    }

    public static ApiError recoverable(String message) {
        return new ApiError(ErrorKind.recoverable(message));
    }

    public static ApiError unrecoverable(String message) {
        return new ApiError(ErrorKind.unrecoverable(message));
    }

    public ErrorKind kind() {
        return context.kind();
    }

    public ErrorContext context() {
        return context;
    }

    /**
     * Returns {@code true} if the failed operation is safe to retry.
     */
    public boolean isRecoverable() {
        return switch (context.kind().variant()) {
            case RECOVERABLE -> true;
            case UNRECOVERABLE -> false;
        };
    }

    @Override
    public String errorMessage() {
        return getMessage();
    }

    @Override
    public String errorType() {
        return ERROR_TYPE;
    }

    @Override
    public Optional<Backtrace> backtrace() {
        return context.backtrace();
    }
}
