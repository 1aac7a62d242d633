package io.fullerstack.rosdiscover.model;

import io.fullerstack.rosdiscover.context.NodeContext;

/**
 * Declares the architectural effects of a node type.
 * <p>
 * A behavior stands in for the runtime code of a node: instead of opening connections it
 * calls the effect API of the {@link NodeContext} it is given (publish, subscribe, provide a
 * service, read a parameter, ...). It must have no other side effects.
 */
@FunctionalInterface
public interface Behavior {

    void apply(NodeContext context);
}
