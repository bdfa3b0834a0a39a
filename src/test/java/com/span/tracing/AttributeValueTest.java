package com.span.tracing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AttributeValue Tests")
class AttributeValueTest {

    @Test
    @DisplayName("Scalars should be normalized to the closed set of types")
    void normalizesScalars() {
        assertEquals(new AttributeValue.StringValue("x"), AttributeValue.of((Object) "x"));
        assertEquals(new AttributeValue.LongValue(7), AttributeValue.of((Object) 7));
        assertEquals(new AttributeValue.LongValue(7), AttributeValue.of((Object) (short) 7));
        assertEquals(new AttributeValue.DoubleValue(1.5), AttributeValue.of((Object) 1.5f));
        assertEquals(new AttributeValue.BooleanValue(true), AttributeValue.of((Object) Boolean.TRUE));
        assertEquals(new AttributeValue.StringValue("CLIENT"), AttributeValue.of((Object) SpanKind.CLIENT));
        assertNull(AttributeValue.of((Object) null));
    }

    @Test
    @DisplayName("Collections, arrays and maps should be converted recursively")
    void normalizesContainers() {
        AttributeValue list = AttributeValue.of((Object) List.of(1, "a"));
        AttributeValue array = AttributeValue.of((Object) new int[]{1, 2});
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("n", 1);
        nested.put("skip", null);
        AttributeValue map = AttributeValue.of((Object) nested);

        assertEquals(List.of(1L, "a"), list.toJava());
        assertEquals(List.of(1L, 2L), array.toJava());
        assertEquals(Map.of("n", 1L), map.toJava());
    }

    @Test
    @DisplayName("Unsupported values should be recorded as their string form")
    void fallsBackToString() {
        Object value = new StringBuilder("built");
        assertEquals(new AttributeValue.StringValue("built"), AttributeValue.of(value));
    }

    @Test
    @DisplayName("fromMap should keep insertion order and drop null values")
    void fromMapKeepsOrder() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("b", 2);
        raw.put("a", "x");
        raw.put("c", null);

        Map<String, AttributeValue> converted = AttributeValue.fromMap(raw);

        assertEquals(List.of("b", "a"), List.copyOf(converted.keySet()));
        assertThrows(UnsupportedOperationException.class,
                () -> converted.put("d", AttributeValue.of("y")));
        assertTrue(AttributeValue.fromMap(null).isEmpty());
    }

    @Test
    @DisplayName("toJava should convert a map of values to plain objects")
    void toJavaMap() {
        Map<String, AttributeValue> attributes = new LinkedHashMap<>();
        attributes.put("s", AttributeValue.of("v"));
        attributes.put("l", AttributeValue.of((Object) Arrays.asList(true, 2.0)));

        assertEquals(Map.of("s", "v", "l", List.of(true, 2.0)), AttributeValue.toJava(attributes));
    }
}
