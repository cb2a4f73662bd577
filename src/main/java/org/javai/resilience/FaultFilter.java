package org.javai.resilience;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The set of fault kinds a policy acts on. A fault is matched when it is an instance
 * of any listed type; everything else propagates untouched.
 */
public final class FaultFilter {

    private static final FaultFilter ALL = new FaultFilter(List.of(Exception.class));

    private final List<Class<? extends Throwable>> kinds;

    private FaultFilter(List<Class<? extends Throwable>> kinds) {
        if (kinds.isEmpty()) {
            throw new IllegalArgumentException("at least one fault kind is required");
        }
        this.kinds = List.copyOf(kinds);
    }

    /**
     * Matches every {@link Exception}.
     */
    public static FaultFilter all() {
        return ALL;
    }

    @SafeVarargs
    public static FaultFilter of(Class<? extends Throwable>... kinds) {
        Objects.requireNonNull(kinds, "kinds must not be null");
        return new FaultFilter(Arrays.asList(kinds));
    }

    public static FaultFilter of(Collection<Class<? extends Throwable>> kinds) {
        Objects.requireNonNull(kinds, "kinds must not be null");
        return new FaultFilter(List.copyOf(kinds));
    }

    public boolean matches(Throwable fault) {
        if (fault == null) {
            return false;
        }
        for (Class<? extends Throwable> kind : kinds) {
            if (kind.isInstance(fault)) {
                return true;
            }
        }
        return false;
    }

    public List<Class<? extends Throwable>> kinds() {
        return kinds;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FaultFilter other && kinds.equals(other.kinds);
    }

    @Override
    public int hashCode() {
        return kinds.hashCode();
    }

    @Override
    public String toString() {
        return kinds.stream().map(Class::getSimpleName).collect(Collectors.joining(", ", "FaultFilter[", "]"));
    }
}
