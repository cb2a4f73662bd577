package org.javai.resilience.sync;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import org.javai.resilience.ThrowingSupplier;
import org.javai.resilience.decorate.Operation;

/**
 * Serializes work behind one reentrant lock.
 *
 * <p>At most one thread runs work through a given instance at a time. The lock is
 * released when the work returns or throws, and faults propagate unchanged.
 */
public final class MutualExclusion {

    private final ReentrantLock lock;

    public MutualExclusion() {
        this(new ReentrantLock());
    }

    public MutualExclusion(ReentrantLock lock) {
        this.lock = Objects.requireNonNull(lock, "lock must not be null");
    }

    /**
     * The process-wide instance, guarded by {@link ProcessLock#shared()}.
     */
    public static MutualExclusion global() {
        return Holder.GLOBAL;
    }

    public <T, E extends Exception> T synchronize(ThrowingSupplier<T, E> work) throws E {
        Objects.requireNonNull(work, "work must not be null");
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns an operation that runs {@code operation} under this lock.
     */
    public Operation synchronize(Operation operation) {
        Objects.requireNonNull(operation, "operation must not be null");
        return args -> synchronize(() -> operation.invoke(args));
    }

    public void run(Runnable work) {
        Objects.requireNonNull(work, "work must not be null");
        lock.lock();
        try {
            work.run();
        } finally {
            lock.unlock();
        }
    }

    public ReentrantLock lock() {
        return lock;
    }

    private static final class Holder {
        static final MutualExclusion GLOBAL = new MutualExclusion(ProcessLock.shared());
    }
}
