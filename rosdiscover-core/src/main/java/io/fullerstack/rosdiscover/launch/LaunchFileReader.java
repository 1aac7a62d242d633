package io.fullerstack.rosdiscover.launch;

import java.util.Map;

/**
 * Reads a launch file into the parameters and nodes it declares.
 */
public interface LaunchFileReader {

    /**
     * @param file      path of the launch file
     * @param arguments launch arguments ({@code name:=value} on the roslaunch command line)
     * @return declared parameters and nodes
     * @throws LaunchFileException if the file is malformed
     */
    LaunchConfig read(String file, Map<String, String> arguments);

    default LaunchConfig read(String file) {
        return read(file, Map.of());
    }
}
