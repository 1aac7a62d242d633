package io.fullerstack.rosdiscover.model;

import io.fullerstack.rosdiscover.RosDiscoverException;

/**
 * Exception thrown when a node type has no registered model and placeholders are not allowed.
 */
public class ModelNotFoundException extends RosDiscoverException {

    private final ModelKey key;

    public ModelNotFoundException(ModelKey key) {
        super("failed to find model for node type [" + key.nodeType() + "] in package [" + key.packageName() + "]");
        this.key = key;
    }

    public ModelKey key() {
        return key;
    }
}
