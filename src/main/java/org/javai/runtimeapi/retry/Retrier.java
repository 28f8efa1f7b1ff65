package org.javai.runtimeapi.retry;

import org.javai.runtimeapi.ApiError;
import org.javai.runtimeapi.boundary.ApiBoundary;
import org.javai.runtimeapi.boundary.ThrowingSupplier;
import org.javai.runtimeapi.report.ErrorReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Re-runs calls to the runtime API while they fail with recoverable errors.
 *
 * <p>The last {@link ApiError} is rethrown once the policy gives up, either because
 * the error is unrecoverable or because attempts or budget ran out. Retries are
 * reported to the {@link ErrorReporter}; envelopes are never sent from here.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Retrier retrier = Retrier.builder()
 *     .policy(RetryPolicy.exponentialBackoff("runtime-api", 5, Duration.ofMillis(50), Duration.ofSeconds(2)))
 *     .reporter(reporter)
 *     .build();
 *
 * Invocation next = retrier.execute("RuntimeApi.nextInvocation", boundary, () -> client.nextInvocation());
 * }</pre>
 */
public final class Retrier {

    private static final Logger logger = LoggerFactory.getLogger(Retrier.class);

    private final RetryPolicy policy;
    private final ErrorReporter reporter;
    private final Duration budget;
    private final Sleeper sleeper;

    private Retrier(RetryPolicy policy, ErrorReporter reporter, Duration budget, Sleeper sleeper) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.budget = budget;  // null means unlimited
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A retrier that runs each call exactly once.
     */
    public static Retrier noRetry() {
        return builder().policy(RetryPolicy.noRetry()).build();
    }

    public static final class Builder {
        private RetryPolicy policy;
        private ErrorReporter reporter = ErrorReporter.noOp();
        private Duration budget;
        private Sleeper sleeper = Thread::sleep;

        private Builder() {}

        /**
         * Sets the retry policy (required).
         */
        public Builder policy(RetryPolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy must not be null");
            return this;
        }

        /**
         * Sets the reporter for retry events (optional, defaults to no-op).
         */
        public Builder reporter(ErrorReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets a time budget for all attempts of one call (optional, defaults to unlimited).
         */
        public Builder budget(Duration budget) {
            this.budget = Objects.requireNonNull(budget, "budget must not be null");
            return this;
        }

        // Tests replace the sleeper to avoid real delays.
        Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        /**
         * @throws NullPointerException if policy has not been set
         */
        public Retrier build() {
            Objects.requireNonNull(policy, "policy must be set");
            return new Retrier(policy, reporter, budget, sleeper);
        }
    }

    /**
     * Executes a call, retrying it according to the configured policy.
     *
     * @param operation The operation name for reporting
     * @param work The call to execute
     * @return The result of the first successful attempt
     * @throws ApiError the error of the last attempt once the policy gives up
     */
    public <T> T execute(String operation, ThrowingSupplier<T, ApiError> work) throws ApiError {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");

        RetryContext context = RetryContext.start(budget);
        while (true) {
            try {
                return work.get();
            } catch (ApiError error) {
                RetryDecision decision = policy.decide(context, error);

                if (decision instanceof RetryDecision.Retry retry) {
                    logger.debug("Attempt {} of [{}] failed, retrying in {}: {}",
                            context.attemptNumber(), operation, retry.delay(), error.getMessage());
                    reporter.reportRetryAttempt(error, context.attemptNumber(), policy.id());
                    if (!sleep(retry.delay())) {
                        logger.debug("Interrupted while waiting to retry [{}]", operation);
                        throw error;
                    }
                    context = context.nextAttempt(Instant.now());
                } else {
                    RetryDecision.GiveUp giveUp = (RetryDecision.GiveUp) decision;
                    logger.debug("Giving up on [{}] after {} attempts: {}",
                            operation, context.attemptNumber(), giveUp.reason());
                    reporter.reportRetryExhausted(error, context.attemptNumber(), policy.id());
                    throw error;
                }
            }
        }
    }

    /**
     * Wraps a throwing call with a boundary before retrying, so transport exceptions
     * are classified on every attempt.
     */
    public <T> T execute(
            String operation,
            ApiBoundary boundary,
            ThrowingSupplier<T, ? extends Exception> work
    ) throws ApiError {
        Objects.requireNonNull(boundary, "boundary must not be null");
        return execute(operation, () -> boundary.call(operation, work));
    }

    private boolean sleep(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return true;
        }
        try {
            sleeper.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
