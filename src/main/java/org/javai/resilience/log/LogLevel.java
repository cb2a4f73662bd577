package org.javai.resilience.log;

import java.util.Locale;
import java.util.Objects;

/**
 * Severity of an entry written to a {@link LogSink}.
 */
public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR;

    /**
     * Parses a level name, case-insensitively.
     *
     * <p>Accepts the aliases {@code warning} (for {@link #WARN}) and {@code exception}
     * (for {@link #ERROR}). A null or blank name yields {@link #ERROR}.
     *
     * @param name the level name
     * @return the matching level
     * @throws IllegalArgumentException if the name is not recognised
     */
    public static LogLevel parse(String name) {
        if (name == null || name.isBlank()) {
            return ERROR;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "EXCEPTION" -> ERROR;
            case "WARNING" -> WARN;
            default -> {
                try {
                    yield valueOf(normalized);
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Unknown log level: " + Objects.toString(name), e);
                }
            }
        };
    }
}
