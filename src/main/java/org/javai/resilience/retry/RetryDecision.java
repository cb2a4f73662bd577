package org.javai.resilience.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * What a {@link RetryPolicy} wants done with a fault: wait and run again, or stop.
 */
public sealed interface RetryDecision permits RetryDecision.Retry, RetryDecision.GiveUp {

    /**
     * Why a policy stopped retrying.
     */
    enum Reason {
        /** The fault is outside the policy's matched kinds; it propagates as raised. */
        UNMATCHED,
        /** Every allowed attempt failed; the fallback or last fault applies. */
        EXHAUSTED
    }

    /**
     * @param delay how long to sleep before the next attempt
     */
    record Retry(Duration delay) implements RetryDecision {
        public Retry {
            Objects.requireNonNull(delay, "delay must not be null");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must not be negative, was: " + delay);
            }
        }

        public static Retry after(Duration delay) {
            return new Retry(delay);
        }
    }

    record GiveUp(Reason reason) implements RetryDecision {
        public GiveUp {
            Objects.requireNonNull(reason, "reason must not be null");
        }

        public static GiveUp unmatched() {
            return new GiveUp(Reason.UNMATCHED);
        }

        public static GiveUp exhausted() {
            return new GiveUp(Reason.EXHAUSTED);
        }
    }
}
