package com.span.tracing.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.span.tracing.AttributeValue;
import com.span.tracing.SpanEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serializes span attributes and events to the JSON columns of a span store.
 * Malformed input is logged and replaced by an empty value.
 */
public final class SpanJsonCodec {
    private static final Logger log = LoggerFactory.getLogger(SpanJsonCodec.class);

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<Map<String, Object>>> LIST_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public SpanJsonCodec() {
        this(new ObjectMapper());
    }

    public SpanJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String writeAttributes(Map<String, AttributeValue> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(AttributeValue.toJava(attributes));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize span attributes: {}", e.getMessage());
            return "{}";
        }
    }

    public Map<String, AttributeValue> readAttributes(String json) {
        if (json == null || json.isEmpty() || "{}".equals(json)) {
            return Map.of();
        }
        try {
            return AttributeValue.fromMap(objectMapper.readValue(json, MAP_TYPE));
        } catch (JsonProcessingException e) {
            log.warn("Failed to deserialize span attributes: {}", e.getMessage());
            return Map.of();
        }
    }

    public String writeEvents(List<SpanEvent> events) {
        if (events == null || events.isEmpty()) {
            return "[]";
        }
        List<Map<String, Object>> out = new ArrayList<>(events.size());
        for (SpanEvent event : events) {
            Map<String, Object> json = new LinkedHashMap<>();
            json.put("name", event.name());
            json.put("timestamp", event.timestamp().toString());
            json.put("attributes", AttributeValue.toJava(event.attributes()));
            out.add(json);
        }
        try {
            return objectMapper.writeValueAsString(out);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize span events: {}", e.getMessage());
            return "[]";
        }
    }

    @SuppressWarnings("unchecked")
    public List<SpanEvent> readEvents(String json) {
        if (json == null || json.isEmpty() || "[]".equals(json)) {
            return List.of();
        }
        try {
            List<Map<String, Object>> raw = objectMapper.readValue(json, LIST_TYPE);
            List<SpanEvent> events = new ArrayList<>(raw.size());
            for (Map<String, Object> item : raw) {
                Object attributes = item.get("attributes");
                Object timestamp = item.get("timestamp");
                events.add(new SpanEvent(
                        String.valueOf(item.get("name")),
                        timestamp != null ? Instant.parse(timestamp.toString()) : Instant.EPOCH,
                        attributes instanceof Map<?, ?> ? AttributeValue.fromMap((Map<String, ?>) attributes) : Map.of()));
            }
            return events;
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Failed to deserialize span events: {}", e.getMessage());
            return List.of();
        }
    }
}
