package org.javai.resilience;

import java.util.Objects;

/**
 * The value returned in place of a propagated fault or of a result that did not
 * arrive in time.
 *
 * <p>A fallback is either absent ({@link #none()}) or present with a value, which may
 * itself be {@code null}. This distinguishes "return null" from "no fallback configured".
 */
public final class Fallback {

    private static final Fallback NONE = new Fallback(false, null);

    private final boolean present;
    private final Object value;

    private Fallback(boolean present, Object value) {
        this.present = present;
        this.value = value;
    }

    public static Fallback none() {
        return NONE;
    }

    public static Fallback of(Object value) {
        return new Fallback(true, value);
    }

    public boolean isPresent() {
        return present;
    }

    /**
     * Returns the fallback value, or {@code null} when none is configured.
     */
    public Object value() {
        return value;
    }

    /**
     * Returns the fallback value cast to the caller's result type.
     * The caller is responsible for configuring a type-compatible value.
     */
    @SuppressWarnings("unchecked")
    public <T> T valueAs() {
        return (T) value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Fallback other)) {
            return false;
        }
        return present == other.present && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(present, value);
    }

    @Override
    public String toString() {
        return present ? "Fallback[" + value + "]" : "Fallback[none]";
    }
}
