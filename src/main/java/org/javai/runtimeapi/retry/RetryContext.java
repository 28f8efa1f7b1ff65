package org.javai.runtimeapi.retry;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Where a retried call stands when its policy is consulted.
 *
 * @param attemptNumber The attempt that just failed (1-based)
 * @param startedAt When the first attempt began
 * @param elapsed Time spent since {@code startedAt}, measured before the attempt
 * @param budget Total time allowed for all attempts, null when unlimited
 */
public record RetryContext(int attemptNumber, Instant startedAt, Duration elapsed, Duration budget) {

    public RetryContext {
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(elapsed, "elapsed must not be null");
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be >= 1, was: " + attemptNumber);
        }
    }

    /**
     * The context of the first attempt of a call.
     *
     * @param budget total time allowed, or null for no limit
     */
    public static RetryContext start(Duration budget) {
        return new RetryContext(1, Instant.now(), Duration.ZERO, budget);
    }

    public RetryContext nextAttempt(Instant now) {
        return new RetryContext(attemptNumber + 1, startedAt, Duration.between(startedAt, now), budget);
    }

    public boolean withinBudget() {
        return budget == null || elapsed.compareTo(budget) < 0;
    }
}
