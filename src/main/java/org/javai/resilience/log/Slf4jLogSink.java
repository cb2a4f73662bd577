package org.javai.resilience.log;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes entries through SLF4J. This is the default sink of every decorator.
 */
public class Slf4jLogSink implements LogSink {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.resilience";

	private final Logger logger;

	/**
	 * Creates a sink using the default logger name.
	 */
	public Slf4jLogSink() {
		this(LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * Creates a sink logging under the given class's name.
	 *
	 * @param owner the class whose name becomes the logger name
	 */
	public Slf4jLogSink(Class<?> owner) {
		this(LoggerFactory.getLogger(owner));
	}

	/**
	 * Creates a sink with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Slf4jLogSink(String loggerName) {
		this(LoggerFactory.getLogger(loggerName));
	}

	Slf4jLogSink(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void log(LogLevel level, String message) {
		try {
			switch (level) {
				case DEBUG -> logger.debug(message);
				case INFO -> logger.info(message);
				case WARN -> logger.warn(message);
				case ERROR -> logger.error(message);
			}
		} catch (RuntimeException e) {
			System.err.println("Slf4jLogSink failed for " + logger.getName() + ": " + e.getMessage());
		}
	}
}
