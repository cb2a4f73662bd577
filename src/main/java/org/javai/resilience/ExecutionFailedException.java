package org.javai.resilience;

/**
 * Thrown when {@link ExecutionOutcome#orElseThrow()} is called on a failed outcome.
 * This is an unchecked exception because it indicates misuse of the API:
 * the caller should have checked {@link ExecutionOutcome#succeeded()} first.
 */
public class ExecutionFailedException extends RuntimeException {

    private final transient FaultInfo fault;

    public ExecutionFailedException(FaultInfo fault) {
        super("Execution failed: " + (fault == null ? "no fault recorded" : fault.kind() + ": " + fault.message()));
        this.fault = fault;
    }

    public FaultInfo fault() {
        return fault;
    }
}
