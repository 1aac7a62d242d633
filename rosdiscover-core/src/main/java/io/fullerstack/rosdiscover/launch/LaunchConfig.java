package io.fullerstack.rosdiscover.launch;

import io.fullerstack.rosdiscover.parameter.ParameterValue;

import java.util.*;

/**
 * The result of reading a launch file: declared parameters and nodes.
 *
 * @param parameters fully-qualified parameter name to value
 * @param nodes      nodes in file order
 */
public record LaunchConfig(Map<String, ParameterValue> parameters, List<NodeDescriptor> nodes) {

    public LaunchConfig {
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        nodes = List.copyOf(nodes);
    }
}
