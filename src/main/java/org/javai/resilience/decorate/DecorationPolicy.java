package org.javai.resilience.decorate;

import java.time.Duration;
import java.util.Objects;
import org.javai.resilience.ConfigResolver;
import org.javai.resilience.Fallback;
import org.javai.resilience.FaultFilter;
import org.javai.resilience.log.LogLevel;

/**
 * How {@link AutoDecorator} wraps each capability.
 *
 * <p>With {@code retryAttempts > 1} every capability is retried; otherwise a matched
 * fault is logged at {@code logLevel} and replaced by the fallback without retrying.
 * An optional {@code timeout} bounds each call, and {@code timed} logs call durations.
 *
 * @param retryAttempts Total attempts per call; 1 or less disables retry
 * @param retryDelay Delay before the first retry
 * @param backoffFactor Delay multiplier applied after each retry
 * @param matchedFaults Fault kinds that are retried or replaced by the fallback
 * @param fallback Value returned instead of a matched fault, or on timeout
 * @param logLevel Level at which single-shot handling logs a fault
 * @param timeout Longest wait per call (null for none)
 * @param timed Whether call durations are logged
 */
public record DecorationPolicy(
        int retryAttempts,
        Duration retryDelay,
        double backoffFactor,
        FaultFilter matchedFaults,
        Fallback fallback,
        LogLevel logLevel,
        Duration timeout,
        boolean timed
) {

    public static final String ATTEMPTS_PROPERTY = "resilience.retry.attempts";
    public static final String ATTEMPTS_ENV = "RESILIENCE_RETRY_ATTEMPTS";
    public static final String DELAY_PROPERTY = "resilience.retry.delay-ms";
    public static final String DELAY_ENV = "RESILIENCE_RETRY_DELAY_MS";
    public static final String BACKOFF_PROPERTY = "resilience.retry.backoff";
    public static final String BACKOFF_ENV = "RESILIENCE_RETRY_BACKOFF";
    public static final String TIMEOUT_PROPERTY = "resilience.timeout-ms";
    public static final String TIMEOUT_ENV = "RESILIENCE_TIMEOUT_MS";
    public static final String LOG_LEVEL_PROPERTY = "resilience.log-level";
    public static final String LOG_LEVEL_ENV = "RESILIENCE_LOG_LEVEL";

    public DecorationPolicy {
        Objects.requireNonNull(retryDelay, "retryDelay must not be null");
        Objects.requireNonNull(matchedFaults, "matchedFaults must not be null");
        Objects.requireNonNull(fallback, "fallback must not be null");
        Objects.requireNonNull(logLevel, "logLevel must not be null");
        if (retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must not be negative");
        }
        if (Double.isNaN(backoffFactor) || backoffFactor < 1.0d) {
            throw new IllegalArgumentException("backoffFactor must be >= 1.0, was: " + backoffFactor);
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive, was: " + timeout);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Catch every exception, log it at error level and return null.
     */
    public static DecorationPolicy defaults() {
        return builder().build();
    }

    /**
     * Builds a policy from system properties or environment variables.
     */
    public static DecorationPolicy fromConfig() {
        return fromConfig(ConfigResolver.system());
    }

    public static DecorationPolicy fromConfig(ConfigResolver config) {
        Builder builder = builder()
                .retryAttempts(config.resolveInt(ATTEMPTS_PROPERTY, ATTEMPTS_ENV, Builder.DEFAULT_ATTEMPTS))
                .retryDelay(Duration.ofMillis(config.resolveLong(DELAY_PROPERTY, DELAY_ENV,
                        Builder.DEFAULT_DELAY.toMillis())))
                .backoffFactor(config.resolveDouble(BACKOFF_PROPERTY, BACKOFF_ENV, 1.0d))
                .logLevel(LogLevel.parse(config.resolveString(LOG_LEVEL_PROPERTY, LOG_LEVEL_ENV, "error")));
        long timeoutMillis = config.resolveLong(TIMEOUT_PROPERTY, TIMEOUT_ENV, 0L);
        if (timeoutMillis > 0) {
            builder.timeout(Duration.ofMillis(timeoutMillis));
        }
        return builder.build();
    }

    public boolean retries() {
        return retryAttempts > 1;
    }

    public static final class Builder {
        static final int DEFAULT_ATTEMPTS = 1;
        static final Duration DEFAULT_DELAY = Duration.ofSeconds(1);

        private int retryAttempts = DEFAULT_ATTEMPTS;
        private Duration retryDelay = DEFAULT_DELAY;
        private double backoffFactor = 1.0d;
        private FaultFilter matchedFaults = FaultFilter.all();
        private Fallback fallback = Fallback.none();
        private LogLevel logLevel = LogLevel.ERROR;
        private Duration timeout;
        private boolean timed;

        private Builder() {}

        public Builder retryAttempts(int retryAttempts) {
            this.retryAttempts = retryAttempts;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = Objects.requireNonNull(retryDelay, "retryDelay must not be null");
            return this;
        }

        public Builder backoffFactor(double backoffFactor) {
            this.backoffFactor = backoffFactor;
            return this;
        }

        public Builder matchedFaults(FaultFilter matchedFaults) {
            this.matchedFaults = Objects.requireNonNull(matchedFaults, "matchedFaults must not be null");
            return this;
        }

        @SafeVarargs
        public final Builder matching(Class<? extends Throwable>... kinds) {
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

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = Objects.requireNonNull(logLevel, "logLevel must not be null");
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder timed(boolean timed) {
            this.timed = timed;
            return this;
        }

        public DecorationPolicy build() {
            return new DecorationPolicy(retryAttempts, retryDelay, backoffFactor, matchedFaults,
                    fallback, logLevel, timeout, timed);
        }
    }
}
