package com.span.tracing;

import java.util.Map;

/**
 * No-op implementation of {@link Tracer}.
 * Spans get fresh identifiers (or inherit them from an explicit parent) so that
 * callers can still correlate work, but nothing is buffered, persisted or
 * tracked as active.
 */
public class NullTracer implements Tracer {

    @Override
    public Span startSpan(String name, Span parent, SpanKind kind, Map<String, ?> attributes) {
        SpanKind resolvedKind = kind != null ? kind : SpanKind.INTERNAL;
        String spanName = name != null ? name : "";
        if (parent != null) {
            return new NullSpan(parent.traceId(), SpanIds.newSpanId(), parent.spanId(), spanName, resolvedKind);
        }
        return new NullSpan(SpanIds.newTraceId(), SpanIds.newSpanId(), null, spanName, resolvedKind);
    }

    @Override
    public Span getActiveSpan() {
        return null;
    }

    @Override
    public void flush() {
    }

    @Override
    public String toString() {
        return "NullTracer";
    }
}
