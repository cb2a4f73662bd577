package org.javai.resilience.handler;

import java.util.Objects;
import org.javai.resilience.Fallback;
import org.javai.resilience.FaultFilter;
import org.javai.resilience.Recovery;
import org.javai.resilience.ThrowingSupplier;
import org.javai.resilience.log.LogLevel;
import org.javai.resilience.log.LogSink;

/**
 * Runs work once and turns a matched fault into a logged fallback.
 *
 * <p>A matched fault is logged once at the configured level and replaced by the
 * fallback ({@code null} when none is configured), or rethrown when {@code reraise} is
 * set. Faults outside {@code matchedFaults} propagate untouched.
 *
 * <pre>{@code
 * ExceptionHandler handler = ExceptionHandler.builder()
 *     .fallback(0)
 *     .message("division failed")
 *     .build();
 *
 * int quotient = handler.call("divide", () -> a / b);
 * }</pre>
 */
public final class ExceptionHandler {

    private final Fallback fallback;
    private final String message;
    private final LogLevel logLevel;
    private final FaultFilter matchedFaults;
    private final boolean reraise;
    private final LogSink sink;

    private ExceptionHandler(Builder builder) {
        this.fallback = builder.fallback;
        this.message = builder.message;
        this.logLevel = builder.logLevel;
        this.matchedFaults = builder.matchedFaults;
        this.reraise = builder.reraise;
        this.sink = builder.sink;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A handler that catches every exception, logs it at error level and returns null.
     */
    public static ExceptionHandler defaults() {
        return builder().build();
    }

    public <T, E extends Exception> T call(String operation, ThrowingSupplier<T, E> work) throws E {
        return Recovery.<T, E>unwrap(attempt(operation, work));
    }

    public <T, E extends Exception> T call(ThrowingSupplier<T, E> work) throws E {
        return call("operation", work);
    }

    public <T> Recovery<T> attempt(String operation, ThrowingSupplier<T, ? extends Exception> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");
        try {
            return Recovery.recovered(work.get());
        } catch (Exception e) {
            if (!matchedFaults.matches(e)) {
                return Recovery.propagated(e);
            }
            sink.log(logLevel, render(operation, e));
            if (reraise) {
                return Recovery.propagated(e);
            }
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return Recovery.fallback(fallback.valueAs());
        }
    }

    private String render(String operation, Exception fault) {
        StringBuilder text = new StringBuilder();
        if (!message.isEmpty()) {
            text.append(message).append(": ");
        }
        text.append(operation).append(" failed - ")
                .append(fault.getClass().getSimpleName()).append(": ").append(fault.getMessage());
        if (!reraise && fallback.isPresent()) {
            text.append(", returning fallback: ").append(fallback.value());
        }
        return text.toString();
    }

    public Fallback fallback() {
        return fallback;
    }

    public FaultFilter matchedFaults() {
        return matchedFaults;
    }

    public static final class Builder {
        private Fallback fallback = Fallback.none();
        private String message = "";
        private LogLevel logLevel = LogLevel.ERROR;
        private FaultFilter matchedFaults = FaultFilter.all();
        private boolean reraise;
        private LogSink sink = LogSink.slf4j(ExceptionHandler.class);

        private Builder() {}

        public Builder fallback(Object value) {
            this.fallback = Fallback.of(value);
            return this;
        }

        public Builder fallback(Fallback fallback) {
            this.fallback = Objects.requireNonNull(fallback, "fallback must not be null");
            return this;
        }

        /**
         * Prefix prepended to every logged fault.
         */
        public Builder message(String message) {
            this.message = message == null ? "" : message;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = Objects.requireNonNull(logLevel, "logLevel must not be null");
            return this;
        }

        public Builder matchedFaults(FaultFilter matchedFaults) {
            this.matchedFaults = Objects.requireNonNull(matchedFaults, "matchedFaults must not be null");
            return this;
        }

        @SafeVarargs
        public final Builder catching(Class<? extends Throwable>... kinds) {
            return matchedFaults(FaultFilter.of(kinds));
        }

        public Builder reraise(boolean reraise) {
            this.reraise = reraise;
            return this;
        }

        public Builder sink(LogSink sink) {
            this.sink = Objects.requireNonNull(sink, "sink must not be null");
            return this;
        }

        public ExceptionHandler build() {
            return new ExceptionHandler(this);
        }
    }
}
