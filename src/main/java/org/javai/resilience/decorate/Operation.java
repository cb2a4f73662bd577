package org.javai.resilience.decorate;

/**
 * A named capability's callable body, taking positional arguments.
 */
@FunctionalInterface
public interface Operation {

    Object invoke(Object... args) throws Exception;
}
