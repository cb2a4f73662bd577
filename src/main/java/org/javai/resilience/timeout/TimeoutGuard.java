package org.javai.resilience.timeout;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.javai.resilience.Fallback;
import org.javai.resilience.MonotonicClock;
import org.javai.resilience.Recovery;
import org.javai.resilience.ThrowingSupplier;
import org.javai.resilience.log.LogSink;

/**
 * Bounds how long a caller waits for work.
 *
 * <p>Each call starts the work on a fresh daemon thread and polls for its result in
 * slices of at most {@link #POLL_SLICE}. If the work finishes within the limit its
 * result is returned, or its fault rethrown. An {@link Error} raised in time is always
 * rethrown, whatever the fallback. If the limit passes first, a warning is
 * logged and the fallback returned at once.
 *
 * <p>The worker is never cancelled: it keeps running after the deadline and its result
 * is dropped. {@link #attempt} exposes such work as an {@link OrphanedTask} so callers
 * can still wait for it. Under sustained timeouts abandoned threads accumulate, so the
 * limit should comfortably exceed the work's usual latency.
 *
 * <pre>{@code
 * TimeoutGuard guard = TimeoutGuard.builder()
 *     .limit(Duration.ofSeconds(2))
 *     .fallback(Quote.UNAVAILABLE)
 *     .build();
 *
 * Quote quote = guard.run("QuoteApi.fetch", () -> quoteApi.fetch(symbol));
 * }</pre>
 */
public final class TimeoutGuard {

    /**
     * The longest single wait between deadline checks.
     */
    public static final Duration POLL_SLICE = Duration.ofMillis(500);

    private static final AtomicInteger WORKER_COUNTER = new AtomicInteger(0);

    private final Duration limit;
    private final Fallback fallback;
    private final boolean fallbackOnFault;
    private final LogSink sink;
    private final MonotonicClock clock;
    private final ThreadFactory threadFactory;

    private TimeoutGuard(Builder builder) {
        this.limit = builder.limit;
        this.fallback = builder.fallback;
        this.fallbackOnFault = builder.fallbackOnFault;
        this.sink = builder.sink;
        this.clock = builder.clock;
        this.threadFactory = builder.threadFactory;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static TimeoutGuard of(Duration limit) {
        return builder().limit(limit).build();
    }

    public Duration limit() {
        return limit;
    }

    public Fallback fallback() {
        return fallback;
    }

    public <T, E extends Exception> T run(String operation, ThrowingSupplier<T, E> work) throws E {
        return attempt(operation, work).value();
    }

    public <T, E extends Exception> T run(ThrowingSupplier<T, E> work) throws E {
        return run("operation", work);
    }

    /**
     * Runs the work and reports whether the deadline passed.
     *
     * @return the result, or the fallback plus the still-running task when the limit elapsed
     * @throws E the work's fault, when it finished in time by raising and no fallback applies
     * @throws Error an error raised by the work in time, rethrown unchanged and never replaced
     */
    public <T, E extends Exception> TimedResult<T> attempt(String operation, ThrowingSupplier<T, E> work) throws E {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");

        OrphanedTask<T> task = start(operation, work);
        long start = clock.nanoTime();
        long limitNanos = limit.toNanos();
        boolean finished = false;
        try {
            while (!finished) {
                long remaining = limitNanos - (clock.nanoTime() - start);
                if (remaining <= 0) {
                    break;
                }
                finished = task.awaitNanos(Math.min(remaining, POLL_SLICE.toNanos()));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            sink.warn(operation + " interrupted while waiting for its result");
        }

        if (!finished) {
            sink.warn(String.format("%s timed out after %d ms (fallback: %s)",
                    operation, limit.toMillis(), fallback.isPresent() ? fallback.value() : "none"));
            return TimedResult.timedOut(fallback.valueAs(), task);
        }

        if (task.error().isPresent()) {
            throw task.error().get();
        }
        Recovery<T> result = task.result().orElseThrow();
        if (result instanceof Recovery.Propagated<T> propagated && fallbackOnFault && fallback.isPresent()) {
            sink.warn(operation + " failed: " + propagated.fault() + "; returning fallback: " + fallback.value());
            return TimedResult.completed(fallback.valueAs());
        }
        return TimedResult.completed(Recovery.<T, E>unwrap(result));
    }

    private <T> OrphanedTask<T> start(String operation, ThrowingSupplier<T, ? extends Exception> work) {
        OrphanedTask<T> task = new OrphanedTask<>();
        Thread worker = threadFactory.newThread(() -> {
            try {
                task.complete(runWork(operation, work));
            } catch (Error e) {
                task.fail(e);
                sink.debug(operation + " worker died with " + e);
            }
        });
        worker.setDaemon(true);
        task.attach(worker);
        worker.start();
        return task;
    }

    private <T> Recovery<T> runWork(String operation, ThrowingSupplier<T, ? extends Exception> work) {
        try {
            return Recovery.recovered(work.get());
        } catch (Exception e) {
            sink.debug(operation + " worker raised " + e);
            return Recovery.propagated(e);
        }
    }

    private static ThreadFactory defaultThreadFactory() {
        return runnable -> {
            Thread thread = new Thread(runnable, "timeout-guard-" + WORKER_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public static final class Builder {
        private Duration limit;
        private Fallback fallback = Fallback.none();
        private boolean fallbackOnFault = true;
        private LogSink sink = LogSink.slf4j(TimeoutGuard.class);
        private MonotonicClock clock = MonotonicClock.system();
        private ThreadFactory threadFactory = defaultThreadFactory();

        private Builder() {}

        /**
         * Sets the longest time a caller waits (required, positive).
         */
        public Builder limit(Duration limit) {
            Objects.requireNonNull(limit, "limit must not be null");
            if (limit.isNegative() || limit.isZero()) {
                throw new IllegalArgumentException("limit must be positive, was: " + limit);
            }
            this.limit = limit;
            return this;
        }

        public Builder fallback(Object value) {
            this.fallback = Fallback.of(value);
            return this;
        }

        public Builder fallback(Fallback fallback) {
            this.fallback = Objects.requireNonNull(fallback, "fallback must not be null");
            return this;
        }

        /**
         * Whether a fault raised in time is replaced by the fallback (default true).
         * When false, such faults always propagate and the fallback only covers timeouts.
         */
        public Builder fallbackOnFault(boolean fallbackOnFault) {
            this.fallbackOnFault = fallbackOnFault;
            return this;
        }

        public Builder sink(LogSink sink) {
            this.sink = Objects.requireNonNull(sink, "sink must not be null");
            return this;
        }

        public Builder clock(MonotonicClock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        /**
         * Sets the factory for worker threads. Created threads are always marked daemon.
         */
        public Builder threadFactory(ThreadFactory threadFactory) {
            this.threadFactory = Objects.requireNonNull(threadFactory, "threadFactory must not be null");
            return this;
        }

        public TimeoutGuard build() {
            Objects.requireNonNull(limit, "limit must be set");
            return new TimeoutGuard(this);
        }
    }
}
