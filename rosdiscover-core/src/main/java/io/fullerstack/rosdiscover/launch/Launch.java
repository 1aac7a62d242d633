package io.fullerstack.rosdiscover.launch;

import java.util.*;

/**
 * A launch file together with the arguments it should be launched with.
 *
 * @param filename  path of the launch file
 * @param arguments launch arguments passed to roslaunch
 */
public record Launch(String filename, Map<String, String> arguments) {

    public Launch {
        Objects.requireNonNull(filename, "filename cannot be null");
        arguments = arguments == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public static Launch of(String filename) {
        return new Launch(filename, Map.of());
    }

    /**
     * @return arguments in roslaunch command-line form, e.g. {@code ["robot:=turtlebot"]}
     */
    public List<String> argv() {
        List<String> argv = new ArrayList<>(arguments.size());
        arguments.forEach((key, value) -> argv.add(key + ":=" + value));
        return argv;
    }

    /**
     * Builds a launch from a configuration mapping with a {@code filename} string and an
     * optional {@code arguments} mapping.
     *
     * @throws IllegalArgumentException if the mapping is malformed
     */
    public static Launch fromMap(Map<String, ?> map) {
        Objects.requireNonNull(map, "map cannot be null");
        if (!map.containsKey("filename")) {
            throw new IllegalArgumentException("'filename' is undefined in configuration");
        }
        if (!(map.get("filename") instanceof String filename)) {
            throw new IllegalArgumentException("expected 'filename' to be a string");
        }

        Map<String, String> arguments = new LinkedHashMap<>();
        if (map.containsKey("arguments")) {
            if (!(map.get("arguments") instanceof Map<?, ?> raw)) {
                throw new IllegalArgumentException("expected 'arguments' to be a mapping");
            }
            raw.forEach((key, value) -> arguments.put(String.valueOf(key), String.valueOf(value)));
        }
        return new Launch(filename, arguments);
    }
}
