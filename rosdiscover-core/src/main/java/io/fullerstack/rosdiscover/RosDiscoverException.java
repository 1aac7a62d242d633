package io.fullerstack.rosdiscover;

/**
 * Base type for every failure raised while discovering a ROS architecture.
 */
public class RosDiscoverException extends RuntimeException {

    public RosDiscoverException(String message) {
        super(message);
    }

    public RosDiscoverException(String message, Throwable cause) {
        super(message, cause);
    }
}
