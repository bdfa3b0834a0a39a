package com.span.tracing;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Span returned by {@link NullTracer}. Carries identifiers so callers can
 * correlate work, but every mutator is a no-op and nothing is ever recorded.
 */
public final class NullSpan implements Span {

    private static final Instant EPOCH = Instant.EPOCH;

    private final String traceId;
    private final String spanId;
    private final String parentSpanId;
    private final String name;
    private final SpanKind kind;

    public NullSpan() {
        this(SpanIds.newTraceId(), SpanIds.newSpanId(), null, "", SpanKind.INTERNAL);
    }

    public NullSpan(String traceId, String spanId) {
        this(traceId, spanId, null, "", SpanKind.INTERNAL);
    }

    NullSpan(String traceId, String spanId, String parentSpanId, String name, SpanKind kind) {
        this.traceId = traceId;
        this.spanId = spanId;
        this.parentSpanId = parentSpanId;
        this.name = name;
        this.kind = kind;
    }

    @Override
    public String spanId() {
        return spanId;
    }

    @Override
    public String traceId() {
        return traceId;
    }

    @Override
    public String parentSpanId() {
        return parentSpanId;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public SpanKind kind() {
        return kind;
    }

    @Override
    public Instant startTime() {
        return EPOCH;
    }

    @Override
    public Instant endTime() {
        return null;
    }

    @Override
    public long durationMs() {
        return 0;
    }

    @Override
    public StatusCode statusCode() {
        return StatusCode.UNSET;
    }

    @Override
    public String statusMessage() {
        return null;
    }

    @Override
    public Map<String, AttributeValue> attributes() {
        return Map.of();
    }

    @Override
    public List<SpanEvent> events() {
        return List.of();
    }

    @Override
    public boolean isEnded() {
        return false;
    }

    @Override
    public Span setAttribute(String key, AttributeValue value) {
        return this;
    }

    @Override
    public Span addEvent(String name, Map<String, ?> attributes) {
        return this;
    }

    @Override
    public Span setStatus(StatusCode code, String message) {
        return this;
    }

    @Override
    public Span recordException(Throwable t) {
        return this;
    }

    @Override
    public void end() {
    }

    @Override
    public void close() {
    }

    @Override
    public String toString() {
        return "NullSpan{traceId=" + traceId + ", spanId=" + spanId + "}";
    }
}
