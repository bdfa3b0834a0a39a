package com.span.tracing.buffered;

import com.span.tracing.AttributeValue;
import com.span.tracing.Span;
import com.span.tracing.SpanEvent;
import com.span.tracing.SpanKind;
import com.span.tracing.StatusCode;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Span produced by {@link BufferedTracer}. Mutations are guarded by the span's
 * own monitor; once ended the span is immutable and is handed to the tracer's
 * buffer exactly once.
 */
public final class BufferedSpan implements Span {

    private final BufferedTracer tracer;
    private final String traceId;
    private final String spanId;
    private final String parentSpanId;
    private final String name;
    private final SpanKind kind;
    private final Instant startTime;
    private final Map<String, AttributeValue> attributes = new LinkedHashMap<>();
    private final List<SpanEvent> events = new ArrayList<>();

    private Deque<Span> ownerStack;
    private Instant endTime;
    private long durationMs;
    private StatusCode statusCode = StatusCode.UNSET;
    private String statusMessage;
    private volatile boolean ended;

    BufferedSpan(BufferedTracer tracer, String traceId, String spanId, String parentSpanId,
                 String name, SpanKind kind, Instant startTime) {
        this.tracer = tracer;
        this.traceId = traceId;
        this.spanId = spanId;
        this.parentSpanId = parentSpanId;
        this.name = name;
        this.kind = kind;
        this.startTime = startTime;
    }

    synchronized void activateOn(Deque<Span> stack) {
        this.ownerStack = stack;
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
        return startTime;
    }

    @Override
    public synchronized Instant endTime() {
        return endTime;
    }

    @Override
    public synchronized long durationMs() {
        return durationMs;
    }

    @Override
    public synchronized StatusCode statusCode() {
        return statusCode;
    }

    @Override
    public synchronized String statusMessage() {
        return statusMessage;
    }

    @Override
    public synchronized Map<String, AttributeValue> attributes() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    @Override
    public synchronized List<SpanEvent> events() {
        return List.copyOf(events);
    }

    @Override
    public boolean isEnded() {
        return ended;
    }

    @Override
    public synchronized Span setAttribute(String key, AttributeValue value) {
        if (!ended && key != null && value != null) {
            attributes.put(key, value);
        }
        return this;
    }

    @Override
    public synchronized Span addEvent(String name, Map<String, ?> attributes) {
        if (!ended && name != null) {
            events.add(new SpanEvent(name, tracer.now(), AttributeValue.fromMap(attributes)));
        }
        return this;
    }

    @Override
    public synchronized Span setStatus(StatusCode code, String message) {
        if (!ended && code != null) {
            statusCode = code;
            statusMessage = code == StatusCode.ERROR ? message : null;
        }
        return this;
    }

    @Override
    public void end() {
        Deque<Span> owner;
        synchronized (this) {
            if (ended) {
                return;
            }
            endTime = tracer.now();
            durationMs = Math.round(Duration.between(startTime, endTime).toNanos() / 1_000_000.0);
            ended = true;
            owner = ownerStack;
        }
        tracer.onEnd(this, owner);
    }

    @Override
    public String toString() {
        return "BufferedSpan{name=" + name + ", traceId=" + traceId + ", spanId=" + spanId
                + ", parentSpanId=" + parentSpanId + ", ended=" + ended + "}";
    }
}
