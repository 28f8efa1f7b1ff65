package org.javai.runtimeapi;

import java.io.Serializable;
import java.util.Objects;
import java.util.Optional;

/**
 * An {@link ErrorKind} together with the chain of custody of the failure it classifies:
 * the triggering error, if any, and the backtrace captured when the failure was
 * recognized.
 *
 * <p>A context is created once, where a lower-level failure is detected. Wrapping it in
 * an {@link ApiError} keeps the original cause and backtrace.
 */
public final class ErrorContext implements Serializable {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final Throwable cause;
    private final Backtrace backtrace;

    private ErrorContext(ErrorKind kind, Throwable cause, Backtrace backtrace) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.cause = cause;
        this.backtrace = backtrace;
    }

    /**
     * Starts a fresh chain, capturing the backtrace at the caller.
     */
    public static ErrorContext of(ErrorKind kind) {
        return new ErrorContext(kind, null, Backtrace.capture().orElse(null));
    }

    /**
     * Classifies an existing failure. The backtrace is taken from the cause: its own
     * {@link ReportableError#backtrace()} when it exposes one, its recorded stack otherwise.
     */
    public static ErrorContext of(ErrorKind kind, Throwable cause) {
        Objects.requireNonNull(cause, "cause must not be null");
        Optional<Backtrace> backtrace = cause instanceof ReportableError reportable
                ? reportable.backtrace()
                : Backtrace.of(cause);
        return new ErrorContext(kind, cause, backtrace.orElse(null));
    }

    public ErrorKind kind() {
        return kind;
    }

    public Optional<Throwable> cause() {
        return Optional.ofNullable(cause);
    }

    public Optional<Backtrace> backtrace() {
        return Optional.ofNullable(backtrace);
    }

    @Override
    public String toString() {
        return kind.toString();
    }
}
