package org.javai.resilience.timeout;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.javai.resilience.Recovery;

/**
 * Work that kept running after its {@link TimeoutGuard} deadline passed.
 *
 * <p>The guard never cancels its worker. A caller that abandoned the wait can use this
 * handle to check on the work later, or ignore it.
 *
 * @param <T> The type of the work's result
 */
public final class OrphanedTask<T> {

    private final CountDownLatch done = new CountDownLatch(1);
    private volatile Thread thread;
    private volatile Recovery<T> result;
    private volatile Error error;

    OrphanedTask() {
    }

    void attach(Thread worker) {
        this.thread = worker;
    }

    void complete(Recovery<T> result) {
        this.result = result;
        done.countDown();
    }

    void fail(Error error) {
        this.error = error;
        done.countDown();
    }

    boolean awaitNanos(long nanos) throws InterruptedException {
        return done.await(nanos, TimeUnit.NANOSECONDS);
    }

    public boolean isDone() {
        return done.getCount() == 0;
    }

    /**
     * Waits up to {@code timeout} for the work to finish.
     *
     * @return true if the work finished
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return done.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * What the work produced, once it has finished. Empty while it runs or when it died
     * with an {@link Error}.
     */
    public Optional<Recovery<T>> result() {
        return Optional.ofNullable(result);
    }

    /**
     * The {@link Error} that ended the work, if any.
     */
    public Optional<Error> error() {
        return Optional.ofNullable(error);
    }

    public Thread thread() {
        return thread;
    }
}
