package io.fullerstack.rosdiscover.parameter;

import java.util.*;

/**
 * A dynamically-typed parameter server value.
 * <p>
 * Closed union of the value shapes the ROS parameter server can hold: booleans, numbers,
 * strings, ordered lists and string-keyed maps, the latter two recursively. Every variant
 * is a record, so values compare and hash by content.
 */
public sealed interface ParameterValue
    permits ParameterValue.BoolValue,
            ParameterValue.NumberValue,
            ParameterValue.StringValue,
            ParameterValue.ListValue,
            ParameterValue.MapValue {

    record BoolValue(boolean value) implements ParameterValue {
        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    /**
     * Numeric value. Integers and floating point numbers share this variant.
     * <p>
     * Boxed integral types are normalized to {@link Long} and {@link Float} to {@link Double},
     * so {@code 10} compares equal whether it came from {@code of(10)} or a YAML parser. An
     * integral and a floating point value stay distinct: {@code of(10)} is not {@code of(10.0)}.
     */
    record NumberValue(Number value) implements ParameterValue {
        public NumberValue {
            Objects.requireNonNull(value, "value cannot be null");
            if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
                value = value.longValue();
            } else if (value instanceof Float) {
                value = value.doubleValue();
            }
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    record StringValue(String value) implements ParameterValue {
        public StringValue {
            Objects.requireNonNull(value, "value cannot be null");
        }

        @Override
        public String toString() {
            return value;
        }
    }

    record ListValue(List<ParameterValue> values) implements ParameterValue {
        public ListValue {
            values = List.copyOf(values);
        }

        @Override
        public String toString() {
            return values.toString();
        }
    }

    record MapValue(Map<String, ParameterValue> entries) implements ParameterValue {
        public MapValue {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        @Override
        public String toString() {
            return entries.toString();
        }
    }

    static ParameterValue of(boolean value) {
        return new BoolValue(value);
    }

    static ParameterValue of(Number value) {
        return new NumberValue(value);
    }

    static ParameterValue of(String value) {
        return new StringValue(value);
    }

    /**
     * Converts a plain Java value, as produced by a YAML or JSON parser, into a parameter value.
     *
     * @param raw Boolean, Number, CharSequence, List or Map (recursively), or a ParameterValue
     * @return the equivalent parameter value
     * @throws IllegalArgumentException if {@code raw} is null or of an unsupported type
     */
    static ParameterValue of(Object raw) {
        if (raw instanceof ParameterValue value) {
            return value;
        }
        if (raw instanceof Boolean bool) {
            return new BoolValue(bool);
        }
        if (raw instanceof Number number) {
            return new NumberValue(number);
        }
        if (raw instanceof CharSequence text) {
            return new StringValue(text.toString());
        }
        if (raw instanceof List<?> list) {
            List<ParameterValue> values = new ArrayList<>(list.size());
            for (Object element : list) {
                values.add(of(element));
            }
            return new ListValue(values);
        }
        if (raw instanceof Map<?, ?> map) {
            Map<String, ParameterValue> entries = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                entries.put(String.valueOf(entry.getKey()), of(entry.getValue()));
            }
            return new MapValue(entries);
        }
        throw new IllegalArgumentException(
            "unsupported parameter value: " + (raw == null ? "null" : raw.getClass().getName()));
    }

    default boolean asBoolean() {
        if (this instanceof BoolValue bool) {
            return bool.value();
        }
        throw mismatch("boolean");
    }

    /**
     * Lenient boolean read: the parameter server may hold a value of another type, in which
     * case the node keeps its default.
     */
    default boolean booleanOr(boolean defaultValue) {
        return this instanceof BoolValue bool ? bool.value() : defaultValue;
    }

    default List<ParameterValue> listOr(List<ParameterValue> defaultValue) {
        return this instanceof ListValue list ? list.values() : defaultValue;
    }

    default double asDouble() {
        if (this instanceof NumberValue number) {
            return number.value().doubleValue();
        }
        throw mismatch("number");
    }

    default int asInt() {
        if (this instanceof NumberValue number) {
            return number.value().intValue();
        }
        throw mismatch("number");
    }

    default String asString() {
        if (this instanceof StringValue string) {
            return string.value();
        }
        throw mismatch("string");
    }

    default List<ParameterValue> asList() {
        if (this instanceof ListValue list) {
            return list.values();
        }
        throw mismatch("list");
    }

    default Map<String, ParameterValue> asMap() {
        if (this instanceof MapValue map) {
            return map.entries();
        }
        throw mismatch("map");
    }

    private IllegalStateException mismatch(String expected) {
        return new IllegalStateException(
            "expected a " + expected + " parameter but found " + getClass().getSimpleName() + ": " + this);
    }
}
