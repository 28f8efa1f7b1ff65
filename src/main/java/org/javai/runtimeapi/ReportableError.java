package org.javai.runtimeapi;

import java.util.Objects;
import java.util.Optional;

/**
 * The capability an error needs to be turned into an {@link ErrorEnvelope}:
 * a display string, a stable type tag and an optional backtrace.
 *
 * <p>Application errors implement this directly to control the type tag that remote
 * consumers dispatch on. Any other throwable can be adapted with {@link #of(Throwable)}.
 */
public interface ReportableError {

    /**
     * The rendered display string of the error.
     */
    String errorMessage();

    /**
     * A stable tag identifying the category of the error, independent of recoverability.
     */
    String errorType();

    /**
     * The captured backtrace, empty when capture was disabled or nothing was recorded.
     */
    Optional<Backtrace> backtrace();

    /**
     * Adapts a throwable. Throwables that already implement this interface are returned
     * unchanged; others report their message (or class name when they have none) and
     * their fully-qualified class name as type tag.
     *
     * @param throwable the error to adapt
     * @return a reportable view of the throwable
     */
    static ReportableError of(Throwable throwable) {
        Objects.requireNonNull(throwable, "throwable must not be null");
        if (throwable instanceof ReportableError reportable) {
            return reportable;
        }
        return new ThrowableReportableError(throwable);
    }
}
