package org.javai.resilience.log;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * A {@link LogSink} that delegates to multiple sinks.
 *
 * <p>All configured sinks receive every entry. If a sink throws, the error is written
 * to stderr and the remaining sinks still run.
 *
 * <pre>{@code
 * LogSink sink = CompositeLogSink.builder()
 *     .add(new Slf4jLogSink())
 *     .addIf(auditEnabled, auditSink)
 *     .build();
 * }</pre>
 */
public final class CompositeLogSink implements LogSink {

	private final List<LogSink> sinks;

	private CompositeLogSink(List<LogSink> sinks) {
		this.sinks = List.copyOf(sinks);
	}

	/**
	 * Creates a composite sink from the given sinks.
	 *
	 * @param sinks the sinks to delegate to
	 * @return a composite that fans out to all given sinks
	 */
	public static CompositeLogSink of(LogSink... sinks) {
		return new CompositeLogSink(Arrays.asList(sinks));
	}

	/**
	 * Creates a composite sink from a collection of sinks.
	 */
	public static CompositeLogSink of(Collection<? extends LogSink> sinks) {
		return new CompositeLogSink(new ArrayList<>(sinks));
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void log(LogLevel level, String message) {
		for (LogSink sink : sinks) {
			try {
				sink.log(level, message);
			} catch (RuntimeException e) {
				System.err.println("LogSink.log failed for " +
					sink.getClass().getName() + ": " + e.getMessage());
			}
		}
	}

	/**
	 * Returns the number of sinks in this composite.
	 */
	public int size() {
		return sinks.size();
	}

	/**
	 * Builder for creating a {@link CompositeLogSink}.
	 */
	public static final class Builder {
		private final List<LogSink> sinks = new ArrayList<>();

		private Builder() {}

		public Builder add(LogSink sink) {
			if (sink != null) {
				sinks.add(sink);
			}
			return this;
		}

		/**
		 * Conditionally adds a sink based on a flag.
		 *
		 * @param condition if true, the sink is added
		 * @param sink the sink to add
		 * @return this builder
		 */
		public Builder addIf(boolean condition, LogSink sink) {
			if (condition) {
				add(sink);
			}
			return this;
		}

		public CompositeLogSink build() {
			return new CompositeLogSink(sinks);
		}
	}
}
