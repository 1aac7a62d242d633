package io.fullerstack.rosdiscover.launch;

import io.fullerstack.rosdiscover.RosDiscoverException;

/**
 * Exception thrown when a launch file cannot be read into a {@link LaunchConfig}.
 */
public class LaunchFileException extends RosDiscoverException {

    public LaunchFileException(String message) {
        super(message);
    }

    public LaunchFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
