package org.javai.resilience.sync;

import org.javai.resilience.decorate.Operation;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class MutualExclusionTest {

    private int counter;

    @Test
    void synchronize_serializesConcurrentWork() throws Exception {
        MutualExclusion exclusion = new MutualExclusion();
        int threads = 8;
        int increments = 2_000;
        CountDownLatch done = new CountDownLatch(threads);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            for (int t = 0; t < threads; t++) {
                executor.execute(() -> {
                    for (int i = 0; i < increments; i++) {
                        exclusion.run(() -> counter = counter + 1);
                    }
                    done.countDown();
                });
            }

            assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
            assertThat(counter).isEqualTo(threads * increments);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void synchronize_faultPropagatesAndReleasesLock() {
        MutualExclusion exclusion = new MutualExclusion();
        IOException fault = new IOException("write failed");

        Throwable thrown = catchThrowable(() -> exclusion.synchronize(() -> {
            throw fault;
        }));

        assertThat(thrown).isSameAs(fault);
        assertThat(exclusion.lock().isLocked()).isFalse();
    }

    @Test
    void synchronize_isReentrant() {
        MutualExclusion exclusion = new MutualExclusion();

        String result = exclusion.synchronize(() -> exclusion.synchronize(() -> "nested"));

        assertThat(result).isEqualTo("nested");
    }

    @Test
    void synchronize_operationRunsUnderLock() throws Exception {
        MutualExclusion exclusion = new MutualExclusion();

        Operation guarded = exclusion.synchronize(args -> exclusion.lock().isHeldByCurrentThread() + ":" + args[0]);

        assertThat(guarded.invoke("x")).isEqualTo("true:x");
        assertThat(exclusion.lock().isLocked()).isFalse();
    }
}
