package io.fullerstack.rosdiscover.model;

import java.util.Objects;

/**
 * Identifies a node type: the package that provides it and the type name within that package.
 */
public record ModelKey(String packageName, String nodeType) {

    public ModelKey {
        Objects.requireNonNull(packageName, "packageName cannot be null");
        Objects.requireNonNull(nodeType, "nodeType cannot be null");
    }

    @Override
    public String toString() {
        return packageName + "/" + nodeType;
    }
}
