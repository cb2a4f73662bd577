package org.javai.resilience;

import java.util.Objects;

/**
 * The result of running work under a recovering decorator: either the work (or a
 * fallback) produced a value, or a fault must propagate to the caller.
 *
 * <p>Decorators produce a {@code Recovery} internally and surface it as plain
 * return-or-throw; callers that prefer a value-level result can use it directly.
 *
 * @param <T> The type of the recovered value
 */
public sealed interface Recovery<T> permits Recovery.Recovered, Recovery.Propagated {

    /**
     * A value was obtained.
     *
     * @param value the value, or the fallback that replaced a fault
     * @param fromFallback whether {@code value} is a fallback
     */
    record Recovered<T>(T value, boolean fromFallback) implements Recovery<T> {

        public Recovered(T value) {
            this(value, false);
        }

        @Override
        public boolean isRecovered() {
            return true;
        }

        @Override
        public T getOrThrow() {
            return value;
        }
    }

    /**
     * A fault must reach the caller unchanged.
     *
     * @param fault the fault, exactly as raised by the work
     */
    record Propagated<T>(Exception fault) implements Recovery<T> {

        public Propagated {
            Objects.requireNonNull(fault, "fault must not be null");
        }

        @Override
        public boolean isRecovered() {
            return false;
        }

        @Override
        public T getOrThrow() throws Exception {
            throw fault;
        }
    }

    boolean isRecovered();

    /**
     * Returns the value, or throws the propagated fault.
     */
    T getOrThrow() throws Exception;

    static <T> Recovery<T> recovered(T value) {
        return new Recovered<>(value);
    }

    static <T> Recovery<T> fallback(T value) {
        return new Recovered<>(value, true);
    }

    static <T> Recovery<T> propagated(Exception fault) {
        return new Propagated<>(fault);
    }

    /**
     * Returns the value, or rethrows the propagated fault as the work's declared type.
     *
     * <p>The work that produced a {@link Propagated} could only have thrown {@code E} or an
     * unchecked exception, so the cast does not change what the caller observes.
     */
    static <T, E extends Exception> T unwrap(Recovery<T> recovery) throws E {
        if (recovery instanceof Propagated<T> propagated) {
            throw Recovery.<E>asDeclared(propagated.fault());
        }
        return ((Recovered<T>) recovery).value();
    }

    @SuppressWarnings("unchecked")
    private static <E extends Exception> E asDeclared(Exception fault) {
        return (E) fault;
    }
}
