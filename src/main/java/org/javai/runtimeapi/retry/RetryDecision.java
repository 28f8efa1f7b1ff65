package org.javai.runtimeapi.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * What a {@link RetryPolicy} wants done with a failed attempt.
 */
public sealed interface RetryDecision permits RetryDecision.Retry, RetryDecision.GiveUp {

    static RetryDecision retryAfter(Duration delay) {
        return new Retry(delay);
    }

    static RetryDecision giveUp(String reason) {
        return new GiveUp(reason);
    }

    /**
     * Run the call again once {@code delay} has passed.
     */
    record Retry(Duration delay) implements RetryDecision {
        public Retry {
            if (Objects.requireNonNull(delay, "delay must not be null").isNegative()) {
                throw new IllegalArgumentException("delay must not be negative, was: " + delay);
            }
        }
    }

    /**
     * Stop; the last error is final.
     */
    record GiveUp(String reason) implements RetryDecision {
    }
}
