package io.fullerstack.rosdiscover.interpreter;

/**
 * What the interpreter does when a node's type has no registered model.
 */
public enum MissingModelPolicy {

    /**
     * Evaluate a placeholder model; the node's summary is flagged as a placeholder.
     */
    PLACEHOLDER,

    /**
     * Abort the load with a {@link io.fullerstack.rosdiscover.model.ModelNotFoundException}.
     */
    FAIL
}
