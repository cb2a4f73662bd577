package org.javai.resilience;

import java.util.Objects;

/**
 * A rendered description of a fault captured by {@link ExecutionOutcome}.
 *
 * @param kind The fault's simple class name (e.g., "IOException")
 * @param qualifiedKind The fault's fully qualified class name
 * @param message The fault's message; the class name when the fault has none
 * @param location The originating frame, as produced by {@link ExceptionLocator}
 * @param trace The full stack trace text
 */
public record FaultInfo(String kind, String qualifiedKind, String message, String location, String trace) {

    public FaultInfo {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(qualifiedKind, "qualifiedKind must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(location, "location must not be null");
        Objects.requireNonNull(trace, "trace must not be null");
    }

    public static FaultInfo fromThrowable(Throwable fault, int skipFrames) {
        Objects.requireNonNull(fault, "fault must not be null");
        FaultLocation located = ExceptionLocator.locate(fault, skipFrames);
        String message = fault.getMessage() != null ? fault.getMessage() : fault.getClass().getName();
        return new FaultInfo(
                fault.getClass().getSimpleName(),
                fault.getClass().getName(),
                message,
                located.location(),
                located.trace()
        );
    }

    @Override
    public String toString() {
        return kind + ": " + message + " [" + location + "]";
    }
}
