package org.javai.resilience;

import java.util.Objects;

/**
 * Where a fault originated, plus its full rendered trace.
 *
 * @param location {@code "File.java:42 in com.acme.Service.fetch"}, or {@link ExceptionLocator#UNKNOWN_LOCATION}
 * @param trace the complete stack trace text, cause chain included
 */
public record FaultLocation(String location, String trace) {

    public FaultLocation {
        Objects.requireNonNull(location, "location must not be null");
        Objects.requireNonNull(trace, "trace must not be null");
    }

    public boolean isKnown() {
        return !ExceptionLocator.UNKNOWN_LOCATION.equals(location);
    }
}
