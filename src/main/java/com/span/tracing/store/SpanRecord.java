package com.span.tracing.store;

import com.span.tracing.AttributeValue;
import com.span.tracing.Span;
import com.span.tracing.SpanEvent;
import com.span.tracing.SpanKind;
import com.span.tracing.StatusCode;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, persisted form of an ended span. One record is stored per span.
 */
public record SpanRecord(
        String id,
        String traceId,
        String parentSpanId,
        String name,
        SpanKind kind,
        Instant startTime,
        Instant endTime,
        long durationMs,
        StatusCode statusCode,
        String statusMessage,
        Map<String, AttributeValue> attributes,
        List<SpanEvent> events,
        String agentId,
        String projectId,
        String classification,
        Instant createdAt
) {
    public SpanRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(traceId, "traceId is required");
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(startTime, "startTime is required");
        kind = kind != null ? kind : SpanKind.INTERNAL;
        statusCode = statusCode != null ? statusCode : StatusCode.UNSET;
        attributes = attributes != null ? AttributeValue.copyOf(attributes) : Map.of();
        events = events != null ? List.copyOf(events) : List.of();
        createdAt = createdAt != null ? createdAt : Instant.now();
    }

    /**
     * Snapshots a span together with the deployment metadata stored next to it.
     */
    public static SpanRecord of(Span span, String agentId, String projectId, String classification) {
        return new SpanRecord(
                span.spanId(),
                span.traceId(),
                span.parentSpanId(),
                span.name(),
                span.kind(),
                span.startTime(),
                span.endTime(),
                span.durationMs(),
                span.statusCode(),
                span.statusMessage(),
                span.attributes(),
                span.events(),
                agentId,
                projectId,
                classification,
                Instant.now());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String traceId;
        private String parentSpanId;
        private String name;
        private SpanKind kind = SpanKind.INTERNAL;
        private Instant startTime = Instant.now();
        private Instant endTime;
        private long durationMs;
        private StatusCode statusCode = StatusCode.UNSET;
        private String statusMessage;
        private Map<String, AttributeValue> attributes;
        private List<SpanEvent> events;
        private String agentId;
        private String projectId;
        private String classification;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder traceId(String traceId) {
            this.traceId = traceId;
            return this;
        }

        public Builder parentSpanId(String parentSpanId) {
            this.parentSpanId = parentSpanId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder kind(SpanKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder durationMs(long durationMs) {
            this.durationMs = durationMs;
            return this;
        }

        public Builder statusCode(StatusCode statusCode) {
            this.statusCode = statusCode;
            return this;
        }

        public Builder statusMessage(String statusMessage) {
            this.statusMessage = statusMessage;
            return this;
        }

        public Builder attributes(Map<String, AttributeValue> attributes) {
            this.attributes = attributes;
            return this;
        }

        public Builder events(List<SpanEvent> events) {
            this.events = events;
            return this;
        }

        public Builder agentId(String agentId) {
            this.agentId = agentId;
            return this;
        }

        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder classification(String classification) {
            this.classification = classification;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public SpanRecord build() {
            return new SpanRecord(id, traceId, parentSpanId, name, kind, startTime, endTime, durationMs,
                    statusCode, statusMessage, attributes, events, agentId, projectId, classification, createdAt);
        }
    }
}
