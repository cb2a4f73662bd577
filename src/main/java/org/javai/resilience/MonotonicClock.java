package org.javai.resilience;

import java.time.Instant;

/**
 * The clock capability used for timing measurements and deadlines.
 *
 * <p>{@link #now()} supplies wall-clock instants for reporting; {@link #nanoTime()}
 * supplies a monotonic reading for elapsed-time arithmetic.
 */
public interface MonotonicClock {

    Instant now();

    long nanoTime();

    /**
     * The clock backed by {@link Instant#now()} and {@link System#nanoTime()}.
     */
    static MonotonicClock system() {
        return SystemClock.INSTANCE;
    }

    enum SystemClock implements MonotonicClock {
        INSTANCE;

        @Override
        public Instant now() {
            return Instant.now();
        }

        @Override
        public long nanoTime() {
            return System.nanoTime();
        }
    }
}
