package org.javai.resilience;

/**
 * A supplier that may throw a checked exception.
 * Every decorator accepts work in this shape so that checked faults keep their type.
 *
 * @param <T> The type of value supplied
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingSupplier<T, E extends Exception> {

    T get() throws E;
}
