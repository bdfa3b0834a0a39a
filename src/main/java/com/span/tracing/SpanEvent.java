package com.span.tracing;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A timestamped annotation recorded on a span.
 */
public record SpanEvent(String name, Instant timestamp, Map<String, AttributeValue> attributes) {

    public SpanEvent {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        attributes = attributes != null ? AttributeValue.copyOf(attributes) : Map.of();
    }
}
