package org.javai.runtimeapi;

import java.util.Optional;

/**
 * Reportable view of a plain {@link Throwable}.
 */
final class ThrowableReportableError implements ReportableError {

    private final Throwable throwable;
    private final Backtrace backtrace;

    ThrowableReportableError(Throwable throwable) {
        this.throwable = throwable;
        this.backtrace = Backtrace.of(throwable).orElse(null);
    }

    @Override
    public String errorMessage() {
        String message = throwable.getMessage();
        return message != null ? message : throwable.getClass().getName();
    }

    @Override
    public String errorType() {
        return throwable.getClass().getName();
    }

    @Override
    public Optional<Backtrace> backtrace() {
        return Optional.ofNullable(backtrace);
    }

    @Override
    public String toString() {
        return errorMessage();
    }
}
