package org.javai.runtimeapi;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The error record sent to the runtime API for failed invocations and failed
 * initialization.
 *
 * <p>The wire names and their order are part of the contract: remote consumers
 * dispatch on {@code errorType}.
 *
 * @param errorMessage The display string of the reported error
 * @param errorType Stable tag identifying the error's category
 * @param stackTrace One element per backtrace line, or null when no backtrace was captured
 */
@JsonPropertyOrder({"errorMessage", "errorType", "stackTrace"})
public record ErrorEnvelope(
        @JsonProperty("errorMessage") String errorMessage,
        @JsonProperty("errorType") String errorType,
        @JsonProperty("stackTrace") List<String> stackTrace
) implements Serializable {

    public static final String UNKNOWN_ERROR_TYPE = "UnknownError";

    private static final Logger logger = LoggerFactory.getLogger(ErrorEnvelope.class);

    public ErrorEnvelope {
        Objects.requireNonNull(errorMessage, "errorMessage must not be null");
        Objects.requireNonNull(errorType, "errorType must not be null");
        // an absent trace is null, never an empty list
        stackTrace = stackTrace == null || stackTrace.isEmpty() ? null : List.copyOf(stackTrace);
    }

    /**
     * Builds the envelope for a reportable error. Never fails: a missing type tag becomes
     * {@value #UNKNOWN_ERROR_TYPE}, a missing message becomes the type tag.
     *
     * @param error the error to report
     * @return an envelope with the error's display string, type tag and backtrace lines
     */
    public static ErrorEnvelope from(ReportableError error) {
        Objects.requireNonNull(error, "error must not be null");
        String errorType = Objects.requireNonNullElse(error.errorType(), UNKNOWN_ERROR_TYPE);
        String errorMessage = Objects.requireNonNullElse(error.errorMessage(), errorType);
        Optional<Backtrace> backtrace = error.backtrace();
        List<String> stackTrace = backtrace == null ? null : backtrace
                .map(ErrorEnvelope::collectStackTrace)
                .orElse(null);
        return new ErrorEnvelope(errorMessage, errorType, stackTrace);
    }

    /**
     * Builds the envelope for any throwable, adapting it with {@link ReportableError#of(Throwable)}.
     */
    public static ErrorEnvelope fromThrowable(Throwable throwable) {
        return from(ReportableError.of(throwable));
    }

    private static List<String> collectStackTrace(Backtrace backtrace) {
        logger.trace("Begin backtrace collection");
        List<String> lines = backtrace.toString().lines().collect(Collectors.toList());
        logger.trace("Completed backtrace collection");
        return lines;
    }
}
