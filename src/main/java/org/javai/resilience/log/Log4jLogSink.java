package org.javai.resilience.log;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;

/**
 * Writes entries through the Log4j2 API.
 *
 * <p>Every entry carries the {@code RESILIENCE} marker so that appenders can route
 * decorator output separately from application logs.
 */
public class Log4jLogSink implements LogSink {

	static final Marker RESILIENCE_MARKER = MarkerManager.getMarker("RESILIENCE");

	private final Logger logger;

	/**
	 * Creates a Log4jLogSink using the default logger name.
	 */
	public Log4jLogSink() {
		this(LogManager.getLogger("org.javai.resilience"));
	}

	/**
	 * Creates a Log4jLogSink with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jLogSink(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Creates a Log4jLogSink with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jLogSink(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void log(LogLevel level, String message) {
		try {
			logger.atLevel(levelFor(level))
				.withMarker(RESILIENCE_MARKER)
				.log(message);
		} catch (RuntimeException e) {
			System.err.println("Log4jLogSink failed for " + logger.getName() + ": " + e.getMessage());
		}
	}

	static Level levelFor(LogLevel level) {
		return switch (level) {
			case DEBUG -> Level.DEBUG;
			case INFO -> Level.INFO;
			case WARN -> Level.WARN;
			case ERROR -> Level.ERROR;
		};
	}
}
