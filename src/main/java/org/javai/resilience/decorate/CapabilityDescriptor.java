package org.javai.resilience.decorate;

import java.lang.reflect.Method;
import java.util.Objects;
import java.util.Optional;

/**
 * One decoratable operation of a target.
 *
 * @param name the capability's name
 * @param method the interface method, for capabilities declared by a Java interface
 * @param operation the bound invocation; rethrows the target's own faults
 */
public record CapabilityDescriptor(String name, Optional<Method> method, Operation operation) {

    public CapabilityDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(method, "method must not be null, use Optional.empty()");
        Objects.requireNonNull(operation, "operation must not be null");
    }

    public Object invoke(Object... args) throws Exception {
        return operation.invoke(args);
    }
}
