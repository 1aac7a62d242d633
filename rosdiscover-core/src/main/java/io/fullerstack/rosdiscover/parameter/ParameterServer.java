package io.fullerstack.rosdiscover.parameter;

import java.util.*;

/**
 * Simulated ROS parameter server for a single interpreter session.
 * <p>
 * Keys are fully-qualified parameter names and must start with {@code /}. There is no
 * delete operation: once written, a value stays for the lifetime of the session.
 * Reading with a default never stores the default.
 */
public final class ParameterServer {

    private final Map<String, ParameterValue> contents = new HashMap<>();

    /**
     * @param name fully-qualified parameter name
     * @param defaultValue returned when the parameter is absent (may be null)
     * @return the stored value, or {@code defaultValue}
     */
    public ParameterValue get(String name, ParameterValue defaultValue) {
        return contents.getOrDefault(requireQualified(name), defaultValue);
    }

    public Optional<ParameterValue> get(String name) {
        return Optional.ofNullable(contents.get(requireQualified(name)));
    }

    /**
     * Stores or overwrites a value.
     */
    public void set(String name, ParameterValue value) {
        Objects.requireNonNull(value, "value cannot be null");
        contents.put(requireQualified(name), value);
    }

    public boolean contains(String name) {
        return contents.containsKey(requireQualified(name));
    }

    /**
     * @return sorted snapshot of every stored parameter name
     */
    public SortedSet<String> names() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(contents.keySet()));
    }

    public int size() {
        return contents.size();
    }

    private static String requireQualified(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        if (!name.startsWith("/")) {
            throw new IllegalArgumentException("parameter name is not fully qualified: " + name);
        }
        return name;
    }

    @Override
    public String toString() {
        return "ParameterServer[size=" + contents.size() + "]";
    }
}
