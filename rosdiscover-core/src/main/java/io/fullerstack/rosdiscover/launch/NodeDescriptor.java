package io.fullerstack.rosdiscover.launch;

import java.util.*;

/**
 * A node declared in a launch file.
 *
 * @param name        node name
 * @param packageName package providing the node type
 * @param type        node type
 * @param namespace   namespace the node is launched into (e.g., "/" or "/robot/")
 * @param args        raw command-line arguments, empty when none are given
 * @param remappings  remappings in declaration order
 */
public record NodeDescriptor(
        String name,
        String packageName,
        String type,
        String namespace,
        String args,
        List<Remapping> remappings
) {
    public NodeDescriptor {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(packageName, "packageName cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(namespace, "namespace cannot be null");
        args = args == null ? "" : args;
        remappings = remappings == null ? List.of() : List.copyOf(remappings);
    }

    /**
     * @return remappings as an old-to-new map; a later remapping of the same name wins
     */
    public Map<String, String> remappingTable() {
        Map<String, String> table = new LinkedHashMap<>();
        for (Remapping remapping : remappings) {
            table.put(remapping.from(), remapping.to());
        }
        return table;
    }
}
