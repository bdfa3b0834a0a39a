package com.span.tracing;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A span attribute value: one of a small closed set of JSON-compatible scalars,
 * or a list or string-keyed map of such values.
 *
 * <p>Use {@link #of(Object)} to normalize arbitrary Java values; anything outside
 * the supported set is recorded as its {@code String.valueOf} form.</p>
 */
public sealed interface AttributeValue
        permits AttributeValue.StringValue, AttributeValue.LongValue, AttributeValue.DoubleValue,
        AttributeValue.BooleanValue, AttributeValue.ListValue, AttributeValue.MapValue {

    /**
     * Converts this value to plain Java objects ({@code String}, {@code Long},
     * {@code Double}, {@code Boolean}, {@code List}, {@code Map}) for serialization.
     */
    Object toJava();

    record StringValue(String value) implements AttributeValue {
        public StringValue {
            Objects.requireNonNull(value, "value is required");
        }

        @Override
        public Object toJava() {
            return value;
        }
    }

    record LongValue(long value) implements AttributeValue {
        @Override
        public Object toJava() {
            return value;
        }
    }

    record DoubleValue(double value) implements AttributeValue {
        @Override
        public Object toJava() {
            return value;
        }
    }

    record BooleanValue(boolean value) implements AttributeValue {
        @Override
        public Object toJava() {
            return value;
        }
    }

    record ListValue(List<AttributeValue> values) implements AttributeValue {
        public ListValue {
            values = values != null ? List.copyOf(values) : List.of();
        }

        @Override
        public Object toJava() {
            List<Object> out = new ArrayList<>(values.size());
            for (AttributeValue v : values) {
                out.add(v.toJava());
            }
            return out;
        }
    }

    record MapValue(Map<String, AttributeValue> values) implements AttributeValue {
        public MapValue {
            values = values != null ? copyOf(values) : Map.of();
        }

        @Override
        public Object toJava() {
            Map<String, Object> out = new LinkedHashMap<>();
            values.forEach((k, v) -> out.put(k, v.toJava()));
            return out;
        }
    }

    static AttributeValue of(String value) {
        return new StringValue(value);
    }

    static AttributeValue of(long value) {
        return new LongValue(value);
    }

    static AttributeValue of(double value) {
        return new DoubleValue(value);
    }

    static AttributeValue of(boolean value) {
        return new BooleanValue(value);
    }

    /**
     * Normalizes an arbitrary Java value. Returns null for a null input.
     */
    static AttributeValue of(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof AttributeValue attributeValue) {
            return attributeValue;
        }
        if (value instanceof String s) {
            return new StringValue(s);
        }
        if (value instanceof Boolean b) {
            return new BooleanValue(b);
        }
        if (value instanceof Double || value instanceof Float) {
            return new DoubleValue(((Number) value).doubleValue());
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return new LongValue(((Number) value).longValue());
        }
        if (value instanceof Enum<?> e) {
            return new StringValue(e.name());
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, AttributeValue> converted = new LinkedHashMap<>();
            map.forEach((k, v) -> {
                AttributeValue av = of(v);
                if (k != null && av != null) {
                    converted.put(String.valueOf(k), av);
                }
            });
            return new MapValue(converted);
        }
        if (value instanceof Collection<?> collection) {
            List<AttributeValue> converted = new ArrayList<>(collection.size());
            for (Object item : collection) {
                AttributeValue av = of(item);
                if (av != null) {
                    converted.add(av);
                }
            }
            return new ListValue(converted);
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<AttributeValue> converted = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                AttributeValue av = of(Array.get(value, i));
                if (av != null) {
                    converted.add(av);
                }
            }
            return new ListValue(converted);
        }
        return new StringValue(String.valueOf(value));
    }

    /**
     * Normalizes every entry of a map, dropping null keys and values.
     * The result keeps insertion order and is unmodifiable.
     */
    static Map<String, AttributeValue> fromMap(Map<String, ?> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return Map.of();
        }
        Map<String, AttributeValue> converted = new LinkedHashMap<>();
        attributes.forEach((k, v) -> {
            AttributeValue av = of(v);
            if (k != null && av != null) {
                converted.put(k, av);
            }
        });
        return Collections.unmodifiableMap(converted);
    }

    /**
     * Order-preserving unmodifiable copy.
     */
    static Map<String, AttributeValue> copyOf(Map<String, AttributeValue> attributes) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * Converts a map of attribute values to plain Java objects.
     */
    static Map<String, Object> toJava(Map<String, AttributeValue> attributes) {
        Map<String, Object> out = new LinkedHashMap<>();
        attributes.forEach((k, v) -> out.put(k, v.toJava()));
        return out;
    }
}
