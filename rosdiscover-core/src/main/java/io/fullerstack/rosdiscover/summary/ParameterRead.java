package io.fullerstack.rosdiscover.summary;

import java.util.Comparator;
import java.util.Objects;

/**
 * A parameter read declared by a node.
 *
 * @param name    fully-qualified parameter name
 * @param dynamic whether the node re-reads the parameter when it is reconfigured at runtime
 */
public record ParameterRead(String name, boolean dynamic) implements Comparable<ParameterRead> {

    private static final Comparator<ParameterRead> ORDER =
        Comparator.comparing(ParameterRead::name).thenComparing(ParameterRead::dynamic);

    public ParameterRead {
        Objects.requireNonNull(name, "name cannot be null");
    }

    @Override
    public int compareTo(ParameterRead other) {
        return ORDER.compare(this, other);
    }
}
