package org.javai.resilience.decorate;

import java.util.Set;

/**
 * Narrows which enumerated capabilities get decorated.
 */
@FunctionalInterface
public interface CapabilityFilter {

    boolean accept(CapabilityDescriptor capability);

    static CapabilityFilter all() {
        return capability -> true;
    }

    static CapabilityFilter named(String... names) {
        Set<String> accepted = Set.of(names);
        return capability -> accepted.contains(capability.name());
    }
}
