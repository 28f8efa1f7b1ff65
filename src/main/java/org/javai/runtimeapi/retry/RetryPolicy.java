package org.javai.runtimeapi.retry;

import org.javai.runtimeapi.ApiError;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;

/**
 * Decides whether and when to retry after an {@link ApiError}.
 * Unrecoverable errors are never retried, whatever the policy.
 */
public interface RetryPolicy {

    /**
     * A unique identifier for this policy, used in reporting.
     */
    String id();

    /**
     * Evaluates an error and decides whether to retry.
     *
     * @param context The current retry context
     * @param error The error raised by the last attempt
     * @return Retry with a delay, or GiveUp
     */
    RetryDecision decide(RetryContext context, ApiError error);

    /**
     * Creates a policy that never retries.
     */
    static RetryPolicy noRetry() {
        return new RetryPolicy() {
            @Override
            public String id() {
                return "no-retry";
            }

            @Override
            public RetryDecision decide(RetryContext context, ApiError error) {
                return RetryDecision.giveUp("no-retry policy");
            }
        };
    }

    /**
     * Creates a policy with a fixed delay between attempts.
     */
    static RetryPolicy fixed(String id, int maxAttempts, Duration delay) {
        Objects.requireNonNull(delay, "delay must not be null");
        return bounded(id, maxAttempts, context -> delay);
    }

    /**
     * Creates a policy whose delay doubles after each attempt, capped at {@code maxDelay}.
     */
    static RetryPolicy exponentialBackoff(String id, int maxAttempts, Duration initialDelay, Duration maxDelay) {
        Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        return bounded(id, maxAttempts, context -> {
            // initialDelay * 2^(attempt-1), shift capped to stay clear of overflow
            int shift = Math.min(context.attemptNumber() - 1, 30);
            Duration delay = initialDelay.multipliedBy(1L << shift);
            return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
        });
    }

    private static RetryPolicy bounded(String id, int maxAttempts, Function<RetryContext, Duration> delays) {
        Objects.requireNonNull(id, "id must not be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }

        return new RetryPolicy() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public RetryDecision decide(RetryContext context, ApiError error) {
                if (!error.isRecoverable()) {
                    return RetryDecision.giveUp("error is not recoverable");
                }
                if (context.attemptNumber() >= maxAttempts) {
                    return RetryDecision.giveUp("max attempts reached");
                }
                if (!context.withinBudget()) {
                    return RetryDecision.giveUp("budget exhausted");
                }
                return RetryDecision.retryAfter(delays.apply(context));
            }
        };
    }
}
