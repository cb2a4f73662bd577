package org.javai.resilience;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.javai.resilience.log.LogSink;

/**
 * The uniform record of running a callable once: whether it succeeded, what it returned
 * or raised, when it ran and for how long, plus caller-supplied metadata.
 *
 * <p>An outcome is created by {@link #execute(ThrowingSupplier)}, which never propagates
 * an {@link Exception}: a raised fault is captured as {@link FaultInfo} and logged once
 * at error level.
 *
 * <p>Equality and {@link #isTruthy() truthiness} delegate to the payload, so an outcome can
 * stand in for its value at call sites:
 * <pre>{@code
 * ExecutionOutcome<String> outcome = ExecutionOutcome.execute("fetch", () -> api.fetch(id));
 * if (outcome.isTruthy()) {
 *     render(outcome.value());
 * } else if (outcome.hasFault()) {
 *     log.warn(outcome.faultMessage());
 * }
 * }</pre>
 *
 * @param <T> The type of the payload
 */
public final class ExecutionOutcome<T> {

    /**
     * The smallest elapsed time ever reported. A zero-duration call stays distinguishable
     * from one that was never measured.
     */
    public static final Duration MIN_ELAPSED = Duration.ofNanos(1_000);

    static final int LOCATOR_SKIP_FRAMES = 0;

    private static final String ANONYMOUS = "anonymous";
    private static final LogSink DEFAULT_SINK = LogSink.slf4j(ExecutionOutcome.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final boolean succeeded;
    private T value;
    private FaultInfo fault;
    private final Instant startedAt;
    private final Instant endedAt;
    private final Duration elapsed;
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private final LogSink sink;

    private ExecutionOutcome(boolean succeeded, T value, FaultInfo fault,
                             Instant startedAt, Instant endedAt, Duration elapsed, LogSink sink) {
        if (succeeded == (fault != null)) {
            throw new IllegalArgumentException("fault must be present exactly when the execution failed");
        }
        this.succeeded = succeeded;
        this.value = value;
        this.fault = fault;
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt must not be null");
        this.endedAt = Objects.requireNonNull(endedAt, "endedAt must not be null");
        this.elapsed = Objects.requireNonNull(elapsed, "elapsed must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
    }

    // === Execution ===

    public static <T> ExecutionOutcome<T> execute(ThrowingSupplier<T, ? extends Exception> callable) {
        return execute(ANONYMOUS, callable, DEFAULT_SINK, MonotonicClock.system());
    }

    public static <T> ExecutionOutcome<T> execute(String operation, ThrowingSupplier<T, ? extends Exception> callable) {
        return execute(operation, callable, DEFAULT_SINK, MonotonicClock.system());
    }

    public static <A, T> ExecutionOutcome<T> execute(ThrowingFunction<A, T, ? extends Exception> callable, A argument) {
        Objects.requireNonNull(callable, "callable must not be null");
        return execute(ANONYMOUS, callable.bind(argument), DEFAULT_SINK, MonotonicClock.system());
    }

    /**
     * Runs {@code callable} once and records what happened.
     *
     * @param operation name used in the failure log entry
     * @param callable the work
     * @param sink where a fault is logged
     * @param clock source of timestamps and elapsed time
     * @return the outcome; never null
     */
    public static <T> ExecutionOutcome<T> execute(String operation,
                                                  ThrowingSupplier<T, ? extends Exception> callable,
                                                  LogSink sink,
                                                  MonotonicClock clock) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(callable, "callable must not be null");
        Objects.requireNonNull(sink, "sink must not be null");
        Objects.requireNonNull(clock, "clock must not be null");

        Instant startedAt = clock.now();
        long start = clock.nanoTime();
        T result = null;
        FaultInfo fault = null;
        try {
            result = callable.get();
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            fault = FaultInfo.fromThrowable(e, LOCATOR_SKIP_FRAMES);
            sink.error("[" + fault.location() + "] Execution of " + operation + " failed\n"
                    + fault.trace().stripTrailing());
        }
        long end = clock.nanoTime();
        Instant endedAt = clock.now();

        Duration elapsed = Duration.ofNanos(end - start);
        if (elapsed.compareTo(MIN_ELAPSED) < 0) {
            elapsed = MIN_ELAPSED;
        }
        return new ExecutionOutcome<>(fault == null, result, fault, startedAt, endedAt, elapsed, sink);
    }

    // === Accessors ===

    public boolean succeeded() {
        return succeeded;
    }

    public T value() {
        return value;
    }

    public FaultInfo fault() {
        return fault;
    }

    public boolean hasFault() {
        return fault != null;
    }

    /**
     * The fault's message, or null when there is none.
     */
    public String faultMessage() {
        return fault != null ? fault.message() : null;
    }

    /**
     * The fault's simple class name, or null when there is none.
     */
    public String faultKind() {
        return fault != null ? fault.kind() : null;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant endedAt() {
        return endedAt;
    }

    public Duration elapsed() {
        return elapsed;
    }

    public T valueOrDefault(T defaultValue) {
        return succeeded ? value : defaultValue;
    }

    /**
     * Returns the value of a successful outcome.
     *
     * @throws ExecutionFailedException if the execution failed
     */
    public T orElseThrow() {
        if (!succeeded) {
            throw new ExecutionFailedException(fault);
        }
        return value;
    }

    // === Metadata ===

    public ExecutionOutcome<T> put(String key, Object metadataValue) {
        Objects.requireNonNull(key, "key must not be null");
        metadata.put(key, metadataValue);
        return this;
    }

    public Object get(String key, Object defaultValue) {
        return metadata.getOrDefault(key, defaultValue);
    }

    public Map<String, Object> metadata() {
        return Collections.unmodifiableMap(metadata);
    }

    /**
     * Drops the value, the fault and all metadata. Success flag and timings are kept.
     */
    public void clear() {
        value = null;
        fault = null;
        metadata.clear();
        sink.debug("Cleared execution outcome payload");
    }

    // === Rendering ===

    /**
     * A summary of this outcome, suitable for structured logging.
     */
    public Map<String, Object> info() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("success", succeeded);
        info.put("elapsedSeconds", elapsed.toNanos() / 1_000_000_000.0d);
        info.put("startedAt", startedAt.toString());
        info.put("endedAt", endedAt.toString());
        info.put("metadata", new LinkedHashMap<>(metadata));
        info.put("error", faultMessage());
        info.put("errorKind", faultKind());
        return info;
    }

    /**
     * {@link #info()} rendered as JSON.
     *
     * @throws UncheckedIOException if the metadata cannot be serialized
     */
    public String toJson() {
        return writeJson(info());
    }

    /**
     * The payload rendered as JSON.
     *
     * @throws UncheckedIOException if the payload cannot be serialized
     */
    public String valueAsJson() {
        return writeJson(value);
    }

    /**
     * Reads the payload as JSON into {@code type}. A string payload is parsed; any other
     * payload is converted.
     *
     * @throws UncheckedIOException if a string payload is not valid JSON for {@code type}
     * @throws IllegalArgumentException if a non-string payload cannot be converted
     */
    public <V> V parseValue(Class<V> type) {
        Objects.requireNonNull(type, "type must not be null");
        if (value == null) {
            return null;
        }
        if (value instanceof String text) {
            try {
                return MAPPER.readValue(text, type);
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException("Payload is not valid JSON for " + type.getSimpleName(), e);
            }
        }
        return MAPPER.convertValue(value, type);
    }

    private static String writeJson(Object payload) {
        try {
            return MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Unable to render outcome as JSON", e);
        }
    }

    // === Payload delegation ===

    /**
     * Whether the payload is "present": null, {@code false}, numeric zero and empty
     * strings, collections, maps, arrays and optionals are not.
     */
    public boolean isTruthy() {
        return Truthiness.of(value);
    }

    /**
     * Compares the payload with a raw value.
     */
    public boolean valueEquals(Object other) {
        return Objects.equals(value, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof ExecutionOutcome<?> other && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        String timing = String.format(Locale.ROOT, "elapsed %.6fs", elapsed.toNanos() / 1_000_000_000.0d);
        if (succeeded) {
            return "ExecutionOutcome[success] - " + timing + ", value: " + value;
        }
        return "ExecutionOutcome[failure] - " + timing + ", error: " + faultMessage();
    }
}
