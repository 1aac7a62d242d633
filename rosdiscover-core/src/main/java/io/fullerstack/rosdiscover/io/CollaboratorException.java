package io.fullerstack.rosdiscover.io;

import io.fullerstack.rosdiscover.RosDiscoverException;

/**
 * Exception thrown when a file-system or shell collaborator fails.
 * <p>
 * Never retried; the interpreter lets it propagate unchanged.
 */
public class CollaboratorException extends RosDiscoverException {

    public CollaboratorException(String message) {
        super(message);
    }

    public CollaboratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
