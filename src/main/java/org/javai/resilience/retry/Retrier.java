package org.javai.resilience.retry;

import java.time.Duration;
import java.util.Objects;
import org.javai.resilience.MonotonicClock;
import org.javai.resilience.Recovery;
import org.javai.resilience.ThrowingSupplier;
import org.javai.resilience.log.LogSink;

/**
 * Executes work with retry logic based on a {@link RetryPolicy}.
 *
 * <p>Each attempt either succeeds, ending the run, or raises a fault. A fault the policy
 * does not match propagates at once without consuming an attempt. A matched fault is
 * logged and, while attempts remain, followed by a sleep and another attempt. Once
 * attempts are exhausted the policy's fallback is returned, or the last fault is
 * rethrown unchanged.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Retrier retrier = Retrier.builder()
 *     .policy(RetryPolicy.exponentialBackoff("user-api", 3, Duration.ofMillis(100), Duration.ofSeconds(5)))
 *     .sink(sink)
 *     .build();
 *
 * User user = retrier.call("UserApi.fetch", () -> userApi.fetch(userId));
 * }</pre>
 */
public final class Retrier {

    private final RetryPolicy policy;
    private final LogSink sink;
    private final Sleeper sleeper;
    private final MonotonicClock clock;

    private Retrier(RetryPolicy policy, LogSink sink, Sleeper sleeper, MonotonicClock clock) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Creates a builder for configuring a Retrier instance.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    public static Retrier of(RetryPolicy policy) {
        return builder().policy(policy).build();
    }

    /**
     * Builder for configuring a Retrier instance.
     */
    public static final class Builder {
        private RetryPolicy policy;
        private LogSink sink = LogSink.slf4j(Retrier.class);
        private Sleeper sleeper = Thread::sleep;
        private MonotonicClock clock = MonotonicClock.system();

        private Builder() {}

        /**
         * Sets the retry policy (required).
         *
         * @param policy the retry policy to use
         * @return this builder
         */
        public Builder policy(RetryPolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy must not be null");
            return this;
        }

        /**
         * Sets the sink for retry events (optional, defaults to SLF4J).
         *
         * @param sink the sink for retry events
         * @return this builder
         */
        public Builder sink(LogSink sink) {
            this.sink = Objects.requireNonNull(sink, "sink must not be null");
            return this;
        }

        /**
         * Sets the sleeper used between attempts (optional, defaults to {@link Thread#sleep(long)}).
         */
        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        public Builder clock(MonotonicClock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        /**
         * Builds the Retrier instance.
         *
         * @return a configured Retrier
         * @throws NullPointerException if policy has not been set
         */
        public Retrier build() {
            Objects.requireNonNull(policy, "policy must be set");
            return new Retrier(policy, sink, sleeper, clock);
        }
    }

    public RetryPolicy policy() {
        return policy;
    }

    /**
     * Runs the work under the policy and returns the value, the fallback, or rethrows.
     *
     * @param operation The operation name for logging
     * @param work The work to execute
     * @return the work's value, or the fallback once attempts are exhausted
     * @throws E the last matched fault when no fallback is set, or any unmatched fault
     */
    public <T, E extends Exception> T call(String operation, ThrowingSupplier<T, E> work) throws E {
        return Recovery.<T, E>unwrap(attempt(operation, work));
    }

    public <T, E extends Exception> T call(ThrowingSupplier<T, E> work) throws E {
        return call(policy.id(), work);
    }

    /**
     * Runs the work under the policy and reports the result as a tagged value.
     *
     * @param operation The operation name for logging
     * @param work The work to execute
     * @return Recovered with the value or fallback, or Propagated with the fault to rethrow
     */
    public <T> Recovery<T> attempt(String operation, ThrowingSupplier<T, ? extends Exception> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");

        RetryContext context = RetryContext.first(clock);
        while (true) {
            Exception fault;
            try {
                return Recovery.recovered(work.get());
            } catch (Exception e) {
                fault = e;
            }

            RetryDecision decision = policy.decide(context, fault);
            if (decision instanceof RetryDecision.GiveUp giveUp) {
                return switch (giveUp.reason()) {
                    case UNMATCHED -> Recovery.propagated(fault);
                    case EXHAUSTED -> exhausted(operation, context, fault);
                };
            }
            RetryDecision.Retry retry = (RetryDecision.Retry) decision;
            sink.warn(String.format("%s attempt %s failed: %s; retrying in %d ms (fallback: %s)",
                    operation, attemptLabel(context), describe(fault), retry.delay().toMillis(), fallbackLabel()));
            if (!sleep(retry.delay())) {
                sink.warn(operation + " interrupted while waiting to retry");
                return exhausted(operation, context, fault);
            }
            context = context.next(clock);
        }
    }

    private <T> Recovery<T> exhausted(String operation, RetryContext context, Exception fault) {
        sink.debug(String.format("%s gave up; last attempt started %d ms after the first",
                operation, context.elapsed().toMillis()));
        sink.error(String.format("%s failed after %d attempt(s): %s (fallback: %s)",
                operation, context.attemptNumber(), describe(fault), fallbackLabel()));
        if (policy.fallback().isPresent()) {
            return Recovery.fallback(policy.fallback().valueAs());
        }
        return Recovery.propagated(fault);
    }

    private String attemptLabel(RetryContext context) {
        return policy.isUnlimited()
                ? String.valueOf(context.attemptNumber())
                : context.attemptNumber() + "/" + policy.maxAttempts();
    }

    private String fallbackLabel() {
        return policy.fallback().isPresent() ? String.valueOf(policy.fallback().value()) : "none";
    }

    private static String describe(Exception fault) {
        return fault.getClass().getSimpleName() + ": " + fault.getMessage();
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

    /**
     * Blocks the calling thread between attempts.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
