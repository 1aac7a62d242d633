package io.fullerstack.rosdiscover.model;

import io.fullerstack.rosdiscover.context.NodeContext;

import java.util.Objects;

/**
 * Models the architectural interactions of a node type.
 * <p>
 * Immutable pairing of a {@link ModelKey} with the {@link Behavior} that declares the
 * interactions. Placeholder models are produced by {@link #placeholder(ModelKey)} for node
 * types without a registered behavior; they declare nothing except their placeholder status.
 */
public final class Model {

    private final ModelKey key;
    private final Behavior behavior;
    private final boolean placeholder;

    private Model(ModelKey key, Behavior behavior, boolean placeholder) {
        this.key = Objects.requireNonNull(key, "key cannot be null");
        this.behavior = Objects.requireNonNull(behavior, "behavior cannot be null");
        this.placeholder = placeholder;
    }

    public static Model of(String packageName, String nodeType, Behavior behavior) {
        return new Model(new ModelKey(packageName, nodeType), behavior, false);
    }

    /**
     * Creates a fresh placeholder model attributed to the given node type.
     */
    public static Model placeholder(ModelKey key) {
        return new Model(key, NodeContext::markPlaceholder, true);
    }

    public ModelKey key() {
        return key;
    }

    public String packageName() {
        return key.packageName();
    }

    public String nodeType() {
        return key.nodeType();
    }

    public boolean isPlaceholder() {
        return placeholder;
    }

    /**
     * Runs the behavior against a node context.
     */
    public void eval(NodeContext context) {
        behavior.apply(context);
    }

    @Override
    public String toString() {
        return "Model[" + key + (placeholder ? ", placeholder" : "") + "]";
    }
}
