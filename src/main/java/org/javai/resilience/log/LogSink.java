package org.javai.resilience.log;

/**
 * The logging capability consumed by every decorator.
 *
 * <p>Implementations are called synchronously on the thread that observed the event
 * and must never throw.
 */
@FunctionalInterface
public interface LogSink {

    /**
     * Writes one entry.
     *
     * @param level the severity
     * @param message the rendered message
     */
    void log(LogLevel level, String message);

    default void debug(String message) {
        log(LogLevel.DEBUG, message);
    }

    default void info(String message) {
        log(LogLevel.INFO, message);
    }

    default void warn(String message) {
        log(LogLevel.WARN, message);
    }

    default void error(String message) {
        log(LogLevel.ERROR, message);
    }

    /**
     * A sink that discards everything. Useful for testing.
     */
    static LogSink noOp() {
        return (level, message) -> {};
    }

    /**
     * An SLF4J-backed sink logging under the given class's name.
     */
    static LogSink slf4j(Class<?> owner) {
        return new Slf4jLogSink(owner);
    }

    /**
     * Creates a composite sink that fans out to all given sinks.
     *
     * @param sinks the sinks to delegate to
     * @return a composite sink
     */
    static LogSink composite(LogSink... sinks) {
        return CompositeLogSink.of(sinks);
    }
}
