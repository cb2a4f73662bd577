package org.javai.resilience.handler;

import java.util.Locale;
import java.util.Objects;
import org.javai.resilience.MonotonicClock;
import org.javai.resilience.ThrowingSupplier;
import org.javai.resilience.log.LogSink;

/**
 * Logs how long work takes. Faults propagate unchanged; the elapsed time is logged
 * either way.
 */
public final class Timer {

    private final LogSink sink;
    private final MonotonicClock clock;

    public Timer(LogSink sink, MonotonicClock clock) {
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public Timer(LogSink sink) {
        this(sink, MonotonicClock.system());
    }

    public Timer() {
        this(LogSink.slf4j(Timer.class));
    }

    public <T, E extends Exception> T time(String operation, ThrowingSupplier<T, E> work) throws E {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");
        long start = clock.nanoTime();
        sink.info("Starting [" + operation + "]");
        try {
            return work.get();
        } finally {
            double seconds = (clock.nanoTime() - start) / 1_000_000_000.0d;
            sink.info(String.format(Locale.ROOT, "Finished [%s] in %.2fms (%.4fs)",
                    operation, seconds * 1000.0d, seconds));
        }
    }
}
