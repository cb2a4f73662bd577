package org.javai.resilience.retry;

import java.time.Duration;
import java.util.Objects;
import org.javai.resilience.MonotonicClock;

/**
 * Context provided to retry policies for making decisions.
 *
 * @param attemptNumber The current attempt number (1-based)
 * @param startedAtNanos Monotonic reading taken when the first attempt began
 * @param elapsed Time elapsed since the first attempt
 */
public record RetryContext(
        int attemptNumber,
        long startedAtNanos,
        Duration elapsed
) {
    public RetryContext {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be >= 1");
        }
        Objects.requireNonNull(elapsed, "elapsed must not be null");
    }

    public static RetryContext first(MonotonicClock clock) {
        return new RetryContext(1, clock.nanoTime(), Duration.ZERO);
    }

    public RetryContext next(MonotonicClock clock) {
        Duration newElapsed = Duration.ofNanos(clock.nanoTime() - startedAtNanos);
        int nextAttempt = attemptNumber == Integer.MAX_VALUE ? attemptNumber : attemptNumber + 1;
        return new RetryContext(nextAttempt, startedAtNanos, newElapsed);
    }
}
