package org.javai.resilience.decorate;

import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import org.javai.resilience.MonotonicClock;
import org.javai.resilience.handler.ExceptionHandler;
import org.javai.resilience.handler.Timer;
import org.javai.resilience.log.LogSink;
import org.javai.resilience.retry.Retrier;
import org.javai.resilience.retry.RetryPolicy;
import org.javai.resilience.timeout.TimeoutGuard;

/**
 * Applies a {@link DecorationPolicy} to every capability of a target.
 *
 * <p>Each capability is wrapped with a {@link Retrier} when the policy retries, or with a
 * single-shot {@link ExceptionHandler} otherwise; a {@link TimeoutGuard} and a
 * {@link Timer} are layered outside when the policy asks for them.
 *
 * <p>Targets declare their capabilities in one of two ways:
 * <ul>
 *   <li>an {@link OperationTable}, which {@link #wrap} rebinds in place. A capability that
 *       cannot be rebound is logged and skipped; the rest are still wrapped.</li>
 *   <li>a Java interface, for which {@link #decorate} returns a proxy. A capability whose
 *       return type cannot hold the fallback is logged and left undecorated.</li>
 * </ul>
 *
 * <p>Decorating is idempotent in shape: decorating an already-decorated target replaces the
 * previous decoration of the original operations and never nests a second layer.
 *
 * <pre>{@code
 * AutoDecorator decorator = AutoDecorator.create();
 * InventoryService service = decorator.decorate(InventoryService.class, new JdbcInventoryService(ds),
 *         DecorationPolicy.builder().retryAttempts(3).retryDelay(Duration.ofMillis(200)).build());
 * }</pre>
 */
public final class AutoDecorator {

    private final LogSink sink;
    private final MonotonicClock clock;
    private final Retrier.Sleeper sleeper;

    private AutoDecorator(Builder builder) {
        this.sink = builder.sink;
        this.clock = builder.clock;
        this.sleeper = builder.sleeper;
    }

    public static AutoDecorator create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // === In-place wrapping of explicit tables ===

    /**
     * Rebinds every capability of {@code table} to its decorated form.
     *
     * @return the number of capabilities decorated
     */
    public int wrap(OperationTable table, DecorationPolicy policy) {
        return wrap(table, policy, CapabilityFilter.all());
    }

    public int wrap(OperationTable table, DecorationPolicy policy, CapabilityFilter filter) {
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(policy, "policy must not be null");
        Objects.requireNonNull(filter, "filter must not be null");

        int decorated = 0;
        for (CapabilityDescriptor capability : CapabilityEnumerator.list(table)) {
            if (!filter.accept(capability)) {
                continue;
            }
            String name = table.name() + "." + capability.name();
            Operation original = originalOf(capability.operation());
            if (original != capability.operation()) {
                sink.debug("Replacing existing decoration of " + name);
            }
            try {
                table.rebind(capability.name(),
                        new DecoratedOperation(name, original, policy, compose(name, original, policy)));
                decorated++;
            } catch (RuntimeException e) {
                sink.warn("Could not decorate " + name + ": " + e.getMessage());
            }
        }
        sink.debug("Decorated " + decorated + " capabilities of " + table.name());
        return decorated;
    }

    // === Proxies over capability interfaces ===

    /**
     * Returns a proxy of {@code capabilityType} whose capabilities are decorated and whose
     * other methods pass straight through to {@code target}.
     *
     * @throws IllegalArgumentException if {@code capabilityType} is not an interface
     */
    public <T> T decorate(Class<T> capabilityType, T target, DecorationPolicy policy) {
        return decorate(capabilityType, target, policy, CapabilityFilter.all());
    }

    public <T> T decorate(Class<T> capabilityType, T target, DecorationPolicy policy, CapabilityFilter filter) {
        Objects.requireNonNull(capabilityType, "capabilityType must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(policy, "policy must not be null");
        Objects.requireNonNull(filter, "filter must not be null");

        T original = undecorated(target);
        if (original != target) {
            sink.debug("Replacing existing decoration of " + capabilityType.getSimpleName());
        }

        Map<Method, Operation> capabilities = new HashMap<>();
        for (CapabilityDescriptor capability : CapabilityEnumerator.list(capabilityType, original)) {
            if (!filter.accept(capability)) {
                continue;
            }
            Method method = capability.method().orElseThrow();
            String name = capabilityType.getSimpleName() + "." + capability.name();
            if (!DecoratingInvocationHandler.accepts(method.getReturnType(), policy.fallback().value())) {
                sink.warn("Could not decorate " + name + ": fallback " + policy.fallback().value()
                        + " is not a " + method.getReturnType().getName());
                continue;
            }
            capabilities.put(method, compose(name, capability.operation(), policy));
        }

        Object proxy = Proxy.newProxyInstance(
                capabilityType.getClassLoader(),
                new Class<?>[]{capabilityType},
                new DecoratingInvocationHandler(capabilityType, original, capabilities));
        return capabilityType.cast(proxy);
    }

    // === Introspection ===

    /**
     * Whether {@code candidate} is a proxy or operation produced by this class.
     */
    public static boolean isDecorated(Object candidate) {
        return candidate instanceof DecoratedOperation || handlerOf(candidate) != null;
    }

    /**
     * Returns the target behind a decorated proxy, or {@code candidate} itself.
     */
    @SuppressWarnings("unchecked")
    public static <T> T undecorated(T candidate) {
        DecoratingInvocationHandler handler = handlerOf(candidate);
        return handler == null ? candidate : (T) handler.target();
    }

    /**
     * Whether {@code method} is decorated on {@code proxy}.
     */
    public static boolean isDecorated(Object proxy, Method method) {
        DecoratingInvocationHandler handler = handlerOf(proxy);
        return handler != null && handler.decorates(method);
    }

    private static DecoratingInvocationHandler handlerOf(Object candidate) {
        if (candidate == null || !Proxy.isProxyClass(candidate.getClass())) {
            return null;
        }
        return Proxy.getInvocationHandler(candidate) instanceof DecoratingInvocationHandler handler ? handler : null;
    }

    private static Operation originalOf(Operation operation) {
        return operation instanceof DecoratedOperation decorated ? decorated.original() : operation;
    }

    // === Composition ===

    Operation compose(String name, Operation original, DecorationPolicy policy) {
        Operation guarded;
        if (policy.retries()) {
            Retrier retrier = Retrier.builder()
                    .policy(retryPolicyFor(name, policy))
                    .sink(sink)
                    .sleeper(sleeper)
                    .clock(clock)
                    .build();
            guarded = args -> retrier.call(name, () -> original.invoke(args));
        } else {
            ExceptionHandler handler = ExceptionHandler.builder()
                    .fallback(policy.fallback())
                    .matchedFaults(policy.matchedFaults())
                    .logLevel(policy.logLevel())
                    .sink(sink)
                    .build();
            guarded = args -> handler.call(name, () -> original.invoke(args));
        }

        if (policy.timeout() != null) {
            TimeoutGuard guard = TimeoutGuard.builder()
                    .limit(policy.timeout())
                    .fallback(policy.fallback())
                    .fallbackOnFault(false)
                    .sink(sink)
                    .clock(clock)
                    .build();
            Operation bounded = guarded;
            guarded = args -> guard.run(name, () -> bounded.invoke(args));
        }

        if (policy.timed()) {
            Timer timer = new Timer(sink, clock);
            Operation measured = guarded;
            guarded = args -> timer.time(name, () -> measured.invoke(args));
        }
        return guarded;
    }

    private static RetryPolicy retryPolicyFor(String name, DecorationPolicy policy) {
        return RetryPolicy.builder(name)
                .maxAttempts(policy.retryAttempts())
                .initialDelay(policy.retryDelay())
                .backoffFactor(policy.backoffFactor())
                .matchedFaults(policy.matchedFaults())
                .fallback(policy.fallback())
                .build();
    }

    public static final class Builder {
        private LogSink sink = LogSink.slf4j(AutoDecorator.class);
        private MonotonicClock clock = MonotonicClock.system();
        private Retrier.Sleeper sleeper = Thread::sleep;

        private Builder() {}

        public Builder sink(LogSink sink) {
            this.sink = Objects.requireNonNull(sink, "sink must not be null");
            return this;
        }

        public Builder clock(MonotonicClock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        /**
         * Sets the sleeper used between retries (optional, defaults to {@link Thread#sleep(long)}).
         */
        public Builder sleeper(Retrier.Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        public AutoDecorator build() {
            return new AutoDecorator(this);
        }
    }
}
