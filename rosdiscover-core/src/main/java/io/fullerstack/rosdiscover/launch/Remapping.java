package io.fullerstack.rosdiscover.launch;

import java.util.Objects;

/**
 * A single name remapping, as written in the launch file (names are not yet resolved).
 */
public record Remapping(String from, String to) {

    public Remapping {
        Objects.requireNonNull(from, "from cannot be null");
        Objects.requireNonNull(to, "to cannot be null");
    }
}
