package io.fullerstack.rosdiscover.summary;

import java.util.Comparator;
import java.util.Objects;

/**
 * A fully-qualified name paired with the message, service or action format used on it.
 *
 * @param name   fully-qualified topic, service or action namespace (e.g., "/scan")
 * @param format format name (e.g., "sensor_msgs/LaserScan")
 */
public record TypedName(String name, String format) implements Comparable<TypedName> {

    private static final Comparator<TypedName> ORDER =
        Comparator.comparing(TypedName::name).thenComparing(TypedName::format);

    public TypedName {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(format, "format cannot be null");
    }

    @Override
    public int compareTo(TypedName other) {
        return ORDER.compare(this, other);
    }
}
