package org.javai.resilience.sync;

import java.util.concurrent.locks.ReentrantLock;

/**
 * The process-wide reentrant lock shared by {@link SingletonRegistry#global()} and
 * {@link MutualExclusion#global()}.
 *
 * <p>Holding it while constructing a singleton lets that construction call synchronized
 * work, and the other way round, without deadlocking the calling thread.
 */
public final class ProcessLock {

    private static final ReentrantLock SHARED = new ReentrantLock();

    private ProcessLock() {}

    public static ReentrantLock shared() {
        return SHARED;
    }
}
