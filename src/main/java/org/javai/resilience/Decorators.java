package org.javai.resilience;

import java.time.Duration;
import java.util.function.Supplier;
import org.javai.resilience.decorate.AutoDecorator;
import org.javai.resilience.decorate.DecorationPolicy;
import org.javai.resilience.handler.ExceptionHandler;
import org.javai.resilience.handler.Timer;
import org.javai.resilience.retry.Retrier;
import org.javai.resilience.retry.RetryPolicy;
import org.javai.resilience.sync.MutualExclusion;
import org.javai.resilience.sync.SingletonRegistry;
import org.javai.resilience.timeout.TimeoutGuard;

/**
 * One-line entry points to each decorator with default logging.
 *
 * <pre>{@code
 * String body = Decorators.retry("fetch", 3, Duration.ofMillis(250), () -> client.fetch(url));
 * Integer parsed = Decorators.catching("parse", 0, () -> Integer.parseInt(text));
 * }</pre>
 *
 * <p>Use the builders on each decorator for anything beyond these defaults.
 */
public final class Decorators {

    private Decorators() {}

    /**
     * Runs work with up to {@code maxAttempts} attempts and a fixed delay between them,
     * rethrowing the last fault when they are exhausted.
     */
    public static <T, E extends Exception> T retry(String operation, int maxAttempts, Duration delay,
            ThrowingSupplier<T, E> work) throws E {
        return Retrier.of(RetryPolicy.fixed(operation, maxAttempts, delay)).call(operation, work);
    }

    /**
     * Runs work under a retry policy.
     */
    public static <T, E extends Exception> T retry(RetryPolicy policy, ThrowingSupplier<T, E> work) throws E {
        return Retrier.of(policy).call(work);
    }

    /**
     * Runs work once, logging any exception and returning {@code fallback} in its place.
     */
    public static <T, E extends Exception> T catching(String operation, T fallback, ThrowingSupplier<T, E> work)
            throws E {
        return ExceptionHandler.builder().fallback(fallback).build().call(operation, work);
    }

    /**
     * Waits at most {@code limit} for work, returning {@code fallback} if it takes longer.
     */
    public static <T, E extends Exception> T timeout(String operation, Duration limit, T fallback,
            ThrowingSupplier<T, E> work) throws E {
        return TimeoutGuard.builder().limit(limit).fallback(fallback).build().run(operation, work);
    }

    public static <T, E extends Exception> T timed(String operation, ThrowingSupplier<T, E> work) throws E {
        return new Timer().time(operation, work);
    }

    /**
     * Runs work under the process-wide lock.
     */
    public static <T, E extends Exception> T synchronize(ThrowingSupplier<T, E> work) throws E {
        return MutualExclusion.global().synchronize(work);
    }

    /**
     * Returns the process-wide instance of {@code type}, creating it on first use.
     */
    public static <T> T singleton(Class<T> type, Supplier<? extends T> factory) {
        return SingletonRegistry.global().singleton(type, factory);
    }

    /**
     * Decorates every capability of {@code target} with the policy read from configuration.
     */
    public static <T> T decorate(Class<T> capabilityType, T target) {
        return decorate(capabilityType, target, DecorationPolicy.fromConfig());
    }

    public static <T> T decorate(Class<T> capabilityType, T target, DecorationPolicy policy) {
        return AutoDecorator.create().decorate(capabilityType, target, policy);
    }
}
