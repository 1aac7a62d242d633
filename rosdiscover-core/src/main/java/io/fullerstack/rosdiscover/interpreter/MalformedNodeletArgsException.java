package io.fullerstack.rosdiscover.interpreter;

import io.fullerstack.rosdiscover.RosDiscoverException;

/**
 * Exception thrown when the arguments of a {@code nodelet} node match none of the
 * {@code manager}, {@code standalone <pkg>/<type>} or {@code load <pkg>/<type> <manager>} forms.
 */
public class MalformedNodeletArgsException extends RosDiscoverException {

    public MalformedNodeletArgsException(String args) {
        super("malformed nodelet arguments: [" + args + "]");
    }
}
