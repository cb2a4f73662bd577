package org.javai.resilience.sync;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.javai.resilience.log.LogSink;

/**
 * Hands out at most one instance per type.
 *
 * <p>The first call for a type constructs the instance under the registry's lock; every
 * later call, from any thread, returns that same instance and ignores its factory. If
 * construction throws, nothing is registered and the next call tries again.
 *
 * <pre>{@code
 * ConnectionPool pool = SingletonRegistry.global().singleton(ConnectionPool.class, ConnectionPool::new);
 * }</pre>
 */
public final class SingletonRegistry {

    private final ReentrantLock lock;
    private final LogSink sink;
    private final Map<Class<?>, Object> instances = new HashMap<>();

    public SingletonRegistry() {
        this(new ReentrantLock());
    }

    public SingletonRegistry(ReentrantLock lock) {
        this(lock, LogSink.slf4j(SingletonRegistry.class));
    }

    public SingletonRegistry(ReentrantLock lock, LogSink sink) {
        this.lock = Objects.requireNonNull(lock, "lock must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
    }

    /**
     * The process-wide registry, guarded by {@link ProcessLock#shared()}.
     */
    public static SingletonRegistry global() {
        return Holder.GLOBAL;
    }

    public <T> T singleton(Class<T> type, Supplier<? extends T> factory) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(factory, "factory must not be null");
        lock.lock();
        try {
            Object existing = instances.get(type);
            if (existing != null) {
                return type.cast(existing);
            }
            T created = Objects.requireNonNull(factory.get(), "factory returned null for " + type.getName());
            instances.put(type, created);
            sink.debug("Registered singleton " + type.getName());
            return created;
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(Class<?> type) {
        lock.lock();
        try {
            return instances.containsKey(type);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return instances.size();
        } finally {
            lock.unlock();
        }
    }

    private static final class Holder {
        static final SingletonRegistry GLOBAL = new SingletonRegistry(ProcessLock.shared());
    }
}
