package org.javai.resilience.timeout;

import org.javai.resilience.RecordingLogSink;
import org.javai.resilience.Recovery;
import org.javai.resilience.log.LogLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

class TimeoutGuardTest {

    private RecordingLogSink sink;

    @BeforeEach
    void setUp() {
        sink = new RecordingLogSink();
    }

    private TimeoutGuard.Builder guard(Duration limit) {
        return TimeoutGuard.builder().limit(limit).sink(sink);
    }

    @Test
    void run_fastWork_returnsResult() throws Exception {
        TimeoutGuard guard = guard(Duration.ofSeconds(2)).fallback("late").build();

        String result = guard.run("quote", () -> "fresh");

        assertThat(result).isEqualTo("fresh");
        assertThat(sink.entries()).isEmpty();
    }

    @Test
    void run_slowWork_returnsFallbackAtDeadline() throws Exception {
        TimeoutGuard guard = guard(Duration.ofMillis(200)).fallback("late").build();

        long start = System.nanoTime();
        String result = guard.run("quote", () -> {
            Thread.sleep(1_000);
            return "fresh";
        });
        Duration waited = Duration.ofNanos(System.nanoTime() - start);

        assertThat(result).isEqualTo("late");
        assertThat(waited).isBetween(Duration.ofMillis(150), Duration.ofMillis(800));
        assertThat(sink.messagesAt(LogLevel.WARN)).containsExactly("quote timed out after 200 ms (fallback: late)");
    }

    @Test
    void run_slowWorkWithoutFallback_returnsNull() throws Exception {
        TimeoutGuard guard = guard(Duration.ofMillis(50)).build();

        Integer result = guard.run("count", () -> {
            Thread.sleep(1_000);
            return 1;
        });

        assertThat(result).isNull();
        assertThat(sink.messagesAt(LogLevel.WARN)).containsExactly("count timed out after 50 ms (fallback: none)");
    }

    @Test
    void run_limitLongerThanPollSlice_stillReturnsResult() throws Exception {
        TimeoutGuard guard = guard(Duration.ofSeconds(3)).build();

        String result = guard.run("slow", () -> {
            Thread.sleep(700);
            return "done";
        });

        assertThat(result).isEqualTo("done");
    }

    @Test
    void run_faultWithFallback_returnsFallback() throws Exception {
        TimeoutGuard guard = guard(Duration.ofSeconds(1)).fallback("cached").build();

        String result = guard.run("quote", () -> {
            throw new IOException("refused");
        });

        assertThat(result).isEqualTo("cached");
        assertThat(sink.messagesAt(LogLevel.WARN)).hasSize(1);
    }

    @Test
    void run_faultWithoutFallback_rethrowsSameInstance() {
        TimeoutGuard guard = guard(Duration.ofSeconds(1)).build();
        IOException fault = new IOException("refused");

        Throwable thrown = catchThrowable(() -> guard.run("quote", () -> {
            throw fault;
        }));

        assertThat(thrown).isSameAs(fault);
    }

    @Test
    void run_fallbackOnFaultDisabled_rethrows() {
        TimeoutGuard guard = guard(Duration.ofSeconds(1)).fallback("cached").fallbackOnFault(false).build();
        IOException fault = new IOException("refused");

        Throwable thrown = catchThrowable(() -> guard.run("quote", () -> {
            throw fault;
        }));

        assertThat(thrown).isSameAs(fault);
    }

    @Test
    void attempt_errorInTime_rethrownPromptlyDespiteFallback() {
        TimeoutGuard guard = guard(Duration.ofSeconds(2)).fallback("fb").build();
        AssertionError error = new AssertionError("boom");

        long start = System.nanoTime();
        Throwable thrown = catchThrowable(() -> guard.attempt("op", () -> {
            throw error;
        }));
        Duration waited = Duration.ofNanos(System.nanoTime() - start);

        assertThat(thrown).isSameAs(error);
        assertThat(waited).isLessThan(Duration.ofMillis(1_500));
        assertThat(sink.messagesAt(LogLevel.WARN)).isEmpty();
    }

    @Test
    void attempt_errorAfterDeadline_recordedOnOrphan() throws Exception {
        TimeoutGuard guard = guard(Duration.ofMillis(50)).fallback("fb").build();
        CountDownLatch release = new CountDownLatch(1);
        StackOverflowError error = new StackOverflowError("deep");

        TimedResult<String> result = guard.attempt("op", () -> {
            release.await(5, TimeUnit.SECONDS);
            throw error;
        });
        release.countDown();
        OrphanedTask<String> orphan = result.orphan().orElseThrow();

        assertThat(result.value()).isEqualTo("fb");
        assertThat(orphan.await(Duration.ofSeconds(5))).isTrue();
        assertThat(orphan.error()).containsSame(error);
        assertThat(orphan.result()).isEmpty();
    }

    @Test
    void run_workerThreadIsNamedDaemon() throws Exception {
        TimeoutGuard guard = guard(Duration.ofSeconds(1)).build();

        Thread worker = guard.run("whoami", Thread::currentThread);

        assertThat(worker).isNotSameAs(Thread.currentThread());
        assertThat(worker.getName()).startsWith("timeout-guard-");
        assertThat(worker.isDaemon()).isTrue();
    }

    @Test
    void attempt_timedOut_exposesOrphanedTask() throws Exception {
        TimeoutGuard guard = guard(Duration.ofMillis(50)).fallback(-1).build();
        CountDownLatch release = new CountDownLatch(1);

        TimedResult<Integer> result = guard.attempt("compute", () -> {
            release.await(5, TimeUnit.SECONDS);
            return 42;
        });

        assertThat(result.timedOut()).isTrue();
        assertThat(result.value()).isEqualTo(-1);
        OrphanedTask<Integer> orphan = result.orphan().orElseThrow();
        assertThat(orphan.isDone()).isFalse();
        assertThat(orphan.thread().isAlive()).isTrue();

        release.countDown();

        assertThat(orphan.await(Duration.ofSeconds(5))).isTrue();
        assertThat(orphan.result()).contains(Recovery.recovered(42));
    }

    @Test
    void attempt_completed_hasNoOrphan() throws Exception {
        TimeoutGuard guard = guard(Duration.ofSeconds(1)).build();

        TimedResult<String> result = guard.attempt("fast", () -> "ok");

        assertThat(result.timedOut()).isFalse();
        assertThat(result.value()).isEqualTo("ok");
        assertThat(result.orphan()).isEmpty();
    }

    @Test
    void run_interruptedCaller_restoresFlagAndReturnsFallback() throws Exception {
        TimeoutGuard guard = guard(Duration.ofSeconds(5)).fallback("gave up").build();
        AtomicReference<String> observed = new AtomicReference<>();
        AtomicReference<Boolean> interrupted = new AtomicReference<>();
        CountDownLatch started = new CountDownLatch(1);

        Thread caller = new Thread(() -> {
            started.countDown();
            try {
                observed.set(guard.run("blocked", () -> {
                    Thread.sleep(10_000);
                    return "never";
                }));
            } catch (InterruptedException e) {
                observed.set("worker interrupted");
            }
            interrupted.set(Thread.currentThread().isInterrupted());
        });
        caller.start();
        started.await();
        caller.interrupt();
        caller.join(5_000);

        assertThat(observed.get()).isEqualTo("gave up");
        assertThat(interrupted.get()).isTrue();
    }

    @Test
    void builder_rejectsNonPositiveLimit() {
        assertThatThrownBy(() -> TimeoutGuard.builder().limit(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TimeoutGuard.builder().build())
                .isInstanceOf(NullPointerException.class);
    }
}
