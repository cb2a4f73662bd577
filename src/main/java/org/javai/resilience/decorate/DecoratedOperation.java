package org.javai.resilience.decorate;

import java.util.Objects;

/**
 * An operation wrapped by {@link AutoDecorator}, remembering the operation it wraps so
 * that decorating again replaces this layer instead of nesting another one.
 */
public final class DecoratedOperation implements Operation {

    private final String name;
    private final Operation original;
    private final DecorationPolicy policy;
    private final Operation decorated;

    DecoratedOperation(String name, Operation original, DecorationPolicy policy, Operation decorated) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.original = Objects.requireNonNull(original, "original must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.decorated = Objects.requireNonNull(decorated, "decorated must not be null");
        if (original instanceof DecoratedOperation) {
            throw new IllegalArgumentException("original must not itself be decorated");
        }
    }

    @Override
    public Object invoke(Object... args) throws Exception {
        return decorated.invoke(args);
    }

    public String name() {
        return name;
    }

    /**
     * The undecorated operation.
     */
    public Operation original() {
        return original;
    }

    public DecorationPolicy policy() {
        return policy;
    }

    @Override
    public String toString() {
        return "DecoratedOperation[" + name + "]";
    }
}
