package io.fullerstack.rosdiscover.model;

import io.fullerstack.rosdiscover.RosDiscoverException;

/**
 * Exception thrown when a model is registered for a node type that already has one.
 */
public class DuplicateModelException extends RosDiscoverException {

    private final ModelKey key;

    public DuplicateModelException(ModelKey key) {
        super("model [" + key.nodeType() + "] already registered for package [" + key.packageName() + "]");
        this.key = key;
    }

    public ModelKey key() {
        return key;
    }
}
