package org.javai.resilience.handler;

import org.javai.resilience.RecordingLogSink;
import org.javai.resilience.Recovery;
import org.javai.resilience.log.LogLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class ExceptionHandlerTest {

    private RecordingLogSink sink;

    @BeforeEach
    void setUp() {
        sink = new RecordingLogSink();
    }

    @Test
    void call_success_returnsValue() {
        ExceptionHandler handler = ExceptionHandler.builder().fallback(0).sink(sink).build();

        int result = handler.call("divide", () -> 10 / 2);

        assertThat(result).isEqualTo(5);
        assertThat(sink.entries()).isEmpty();
    }

    @Test
    void call_matchedFault_logsOnceAndReturnsFallback() {
        ExceptionHandler handler = ExceptionHandler.builder()
                .fallback(0)
                .message("division failed")
                .sink(sink)
                .build();
        int divisor = 0;

        int result = handler.call("divide", () -> 10 / divisor);

        assertThat(result).isZero();
        assertThat(sink.messagesAt(LogLevel.ERROR)).containsExactly(
                "division failed: divide failed - ArithmeticException: / by zero, returning fallback: 0");
    }

    @Test
    void call_withoutFallback_returnsNull() {
        ExceptionHandler handler = ExceptionHandler.builder().sink(sink).build();

        String result = handler.call("load", () -> {
            throw new IllegalStateException("closed");
        });

        assertThat(result).isNull();
        assertThat(sink.messagesAt(LogLevel.ERROR)).containsExactly(
                "load failed - IllegalStateException: closed");
    }

    @Test
    void call_logsAtConfiguredLevel() {
        ExceptionHandler handler = ExceptionHandler.builder()
                .logLevel(LogLevel.WARN)
                .fallback("none")
                .sink(sink)
                .build();

        handler.call("lookup", () -> {
            throw new IllegalStateException("miss");
        });

        assertThat(sink.at(LogLevel.WARN)).hasSize(1);
        assertThat(sink.at(LogLevel.ERROR)).isEmpty();
    }

    @Test
    void call_unmatchedFault_propagatesUnchanged() {
        ExceptionHandler handler = ExceptionHandler.builder()
                .catching(IOException.class)
                .fallback("fallback")
                .sink(sink)
                .build();
        IllegalArgumentException fault = new IllegalArgumentException("bad");

        Throwable thrown = catchThrowable(() -> handler.call("parse", () -> {
            throw fault;
        }));

        assertThat(thrown).isSameAs(fault);
        assertThat(sink.entries()).isEmpty();
    }

    @Test
    void call_matchesSubclasses() throws IOException {
        ExceptionHandler handler = ExceptionHandler.builder()
                .catching(IOException.class)
                .fallback("missing")
                .sink(sink)
                .build();

        String result = handler.call("read", () -> {
            throw new FileNotFoundException("a.txt");
        });

        assertThat(result).isEqualTo("missing");
    }

    @Test
    void call_reraise_logsThenRethrowsCheckedFault() {
        ExceptionHandler handler = ExceptionHandler.builder()
                .reraise(true)
                .fallback("ignored")
                .sink(sink)
                .build();
        IOException fault = new IOException("disk");
        AtomicInteger calls = new AtomicInteger();

        Throwable thrown = catchThrowable(() -> handler.call("write", () -> {
            calls.incrementAndGet();
            throw fault;
        }));

        assertThat(thrown).isSameAs(fault);
        assertThat(calls.get()).isEqualTo(1);
        assertThat(sink.messagesAt(LogLevel.ERROR)).containsExactly("write failed - IOException: disk");
    }

    @Test
    void attempt_reportsFallbackAsRecovered() {
        ExceptionHandler handler = ExceptionHandler.builder().fallback(-1).sink(sink).build();

        Recovery<Integer> recovery = handler.attempt("parse", () -> Integer.parseInt("x"));

        assertThat(recovery).isEqualTo(new Recovery.Recovered<>(-1, true));
    }

    @Test
    void defaults_catchEverythingAndReturnNull() {
        ExceptionHandler handler = ExceptionHandler.defaults();

        assertThat(handler.fallback().isPresent()).isFalse();
        assertThat(handler.matchedFaults().matches(new Exception())).isTrue();
    }
}
