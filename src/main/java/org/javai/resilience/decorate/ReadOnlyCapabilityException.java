package org.javai.resilience.decorate;

/**
 * Thrown when a read-only capability of an {@link OperationTable} is rebound.
 */
public class ReadOnlyCapabilityException extends RuntimeException {

    private final String capability;

    public ReadOnlyCapabilityException(String capability) {
        super("Capability '" + capability + "' is read-only");
        this.capability = capability;
    }

    public String capability() {
        return capability;
    }
}
