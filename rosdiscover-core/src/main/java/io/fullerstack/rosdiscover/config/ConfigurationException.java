package io.fullerstack.rosdiscover.config;

import io.fullerstack.rosdiscover.RosDiscoverException;

/**
 * Exception thrown when a configuration key is missing or holds an invalid value.
 */
public class ConfigurationException extends RosDiscoverException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
