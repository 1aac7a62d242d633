package io.fullerstack.rosdiscover.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Maps node types to the models that describe them.
 * <p>
 * A registry is filled once, during bootstrap, and only read afterwards. Interpreter
 * sessions receive it by reference, so several sessions may share one registry.
 * <p>
 * <b>Lookup:</b> {@link #find(String, String)} never fails. For an unregistered node type it
 * logs a warning and hands out a new placeholder {@link Model} attributed to the queried type;
 * placeholders are never cached or shared between lookups.
 */
public final class ModelRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ModelRegistry.class);

    private final ConcurrentMap<ModelKey, Model> models = new ConcurrentHashMap<>();

    /**
     * Registers a behavior for a node type.
     *
     * @throws DuplicateModelException if the node type already has a model
     */
    public void register(String packageName, String nodeType, Behavior behavior) {
        register(Model.of(packageName, nodeType, behavior));
    }

    /**
     * Registers a model.
     *
     * @throws DuplicateModelException if the model's node type already has a model
     * @throws IllegalArgumentException if the model is a placeholder
     */
    public void register(Model model) {
        Objects.requireNonNull(model, "model cannot be null");
        if (model.isPlaceholder()) {
            throw new IllegalArgumentException("placeholder models cannot be registered: " + model.key());
        }
        Model existing = models.putIfAbsent(model.key(), model);
        if (existing != null) {
            throw new DuplicateModelException(model.key());
        }
        logger.debug("registered model [{}] for package [{}]", model.nodeType(), model.packageName());
    }

    /**
     * Finds the model for a node type, substituting a placeholder when none is registered.
     *
     * @return the registered model, or a fresh placeholder for {@code packageName/nodeType}
     */
    public Model find(String packageName, String nodeType) {
        ModelKey key = new ModelKey(packageName, nodeType);
        Model model = models.get(key);
        if (model != null) {
            return model;
        }
        logger.warn("failed to find model for node type [{}] in package [{}]", nodeType, packageName);
        return Model.placeholder(key);
    }

    /**
     * Looks up a registered model without placeholder substitution.
     */
    public Optional<Model> lookup(String packageName, String nodeType) {
        return Optional.ofNullable(models.get(new ModelKey(packageName, nodeType)));
    }

    public boolean contains(String packageName, String nodeType) {
        return models.containsKey(new ModelKey(packageName, nodeType));
    }

    /**
     * @return registered node types, sorted by package then type
     */
    public List<ModelKey> keys() {
        List<ModelKey> keys = new ArrayList<>(models.keySet());
        keys.sort(Comparator.comparing(ModelKey::packageName).thenComparing(ModelKey::nodeType));
        return Collections.unmodifiableList(keys);
    }

    public int size() {
        return models.size();
    }

    @Override
    public String toString() {
        return "ModelRegistry[size=" + models.size() + "]";
    }
}
