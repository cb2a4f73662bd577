package org.javai.resilience.retry;

import java.time.Duration;
import java.util.Objects;
import org.javai.resilience.Fallback;
import org.javai.resilience.FaultFilter;

/**
 * Decides whether and when to retry after a fault.
 *
 * <p>The delay before retry {@code n} (1-based) is
 * {@code initialDelay * backoffFactor^(n-1)}, capped at {@code maxDelay} when one is set.
 * A {@code maxAttempts} below 1 retries forever.
 *
 * @param id Identifier used in log messages
 * @param maxAttempts Total attempts including the first; values below 1 mean unlimited
 * @param initialDelay Delay before the first retry
 * @param backoffFactor Multiplier applied to the delay after every retry, at least 1.0
 * @param maxDelay Upper bound on a single delay (null means unbounded)
 * @param matchedFaults The fault kinds that trigger a retry
 * @param fallback Returned once attempts are exhausted instead of rethrowing
 */
public record RetryPolicy(
        String id,
        int maxAttempts,
        Duration initialDelay,
        double backoffFactor,
        Duration maxDelay,
        FaultFilter matchedFaults,
        Fallback fallback
) {

    private static final Duration LONGEST_DELAY = Duration.ofNanos(Long.MAX_VALUE);

    public RetryPolicy {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        Objects.requireNonNull(matchedFaults, "matchedFaults must not be null");
        Objects.requireNonNull(fallback, "fallback must not be null");
        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must not be negative");
        }
        if (Double.isNaN(backoffFactor) || backoffFactor < 1.0d) {
            throw new IllegalArgumentException("backoffFactor must be >= 1.0, was: " + backoffFactor);
        }
        if (maxDelay != null && maxDelay.isNegative()) {
            throw new IllegalArgumentException("maxDelay must not be negative");
        }
    }

    /**
     * Creates a builder starting from one attempt, no delay and no fallback.
     */
    public static Builder builder(String id) {
        return new Builder(id);
    }

    /**
     * Creates a policy with fixed delay and max attempts.
     */
    public static RetryPolicy fixed(String id, int maxAttempts, Duration delay) {
        return builder(id).maxAttempts(maxAttempts).initialDelay(delay).build();
    }

    /**
     * Creates a policy that doubles its delay after every retry, up to {@code maxDelay}.
     */
    public static RetryPolicy exponentialBackoff(String id, int maxAttempts, Duration initialDelay, Duration maxDelay) {
        return builder(id)
                .maxAttempts(maxAttempts)
                .initialDelay(initialDelay)
                .backoffFactor(2.0d)
                .maxDelay(Objects.requireNonNull(maxDelay, "maxDelay must not be null"))
                .build();
    }

    /**
     * Creates a policy that retries until the work succeeds or raises an unmatched fault.
     */
    public static RetryPolicy forever(String id, Duration delay) {
        return builder(id).maxAttempts(0).initialDelay(delay).build();
    }

    public boolean isUnlimited() {
        return maxAttempts < 1;
    }

    public boolean matches(Throwable fault) {
        return matchedFaults.matches(fault);
    }

    /**
     * Evaluates a fault and decides whether to retry.
     *
     * @param context The current retry context
     * @param fault The fault raised by the latest attempt
     * @return Retry with a delay, or GiveUp with the reason retrying stopped
     */
    public RetryDecision decide(RetryContext context, Throwable fault) {
        if (!matches(fault)) {
            return RetryDecision.GiveUp.unmatched();
        }
        if (!isUnlimited() && context.attemptNumber() >= maxAttempts) {
            return RetryDecision.GiveUp.exhausted();
        }
        return RetryDecision.Retry.after(delayBefore(context.attemptNumber() + 1));
    }

    /**
     * The delay waited before {@code attemptNumber}. The first attempt never waits.
     */
    public Duration delayBefore(int attemptNumber) {
        if (attemptNumber <= 1) {
            return Duration.ZERO;
        }
        double nanos = initialDelay.toNanos() * Math.pow(backoffFactor, attemptNumber - 2);
        Duration delay = nanos >= Long.MAX_VALUE ? LONGEST_DELAY : Duration.ofNanos((long) nanos);
        if (maxDelay != null && delay.compareTo(maxDelay) > 0) {
            delay = maxDelay;
        }
        return delay;
    }

    public static final class Builder {
        private final String id;
        private int maxAttempts = 1;
        private Duration initialDelay = Duration.ZERO;
        private double backoffFactor = 1.0d;
        private Duration maxDelay;
        private FaultFilter matchedFaults = FaultFilter.all();
        private Fallback fallback = Fallback.none();

        private Builder(String id) {
            this.id = Objects.requireNonNull(id, "id must not be null");
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder initialDelay(Duration initialDelay) {
            this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay must not be null");
            return this;
        }

        public Builder backoffFactor(double backoffFactor) {
            this.backoffFactor = backoffFactor;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder matchedFaults(FaultFilter matchedFaults) {
            this.matchedFaults = Objects.requireNonNull(matchedFaults, "matchedFaults must not be null");
            return this;
        }

        @SafeVarargs
        public final Builder retryOn(Class<? extends Throwable>... kinds) {
            return matchedFaults(FaultFilter.of(kinds));
        }

        public Builder fallback(Object value) {
            this.fallback = Fallback.of(value);
            return this;
        }

        public Builder fallback(Fallback fallback) {
            this.fallback = Objects.requireNonNull(fallback, "fallback must not be null");
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(id, maxAttempts, initialDelay, backoffFactor, maxDelay, matchedFaults, fallback);
        }
    }
}
