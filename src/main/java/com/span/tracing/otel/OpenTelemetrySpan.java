package com.span.tracing.otel;

import com.span.tracing.AttributeValue;
import com.span.tracing.Span;
import com.span.tracing.SpanEvent;
import com.span.tracing.SpanIds;
import com.span.tracing.SpanKind;
import com.span.tracing.StatusCode;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.SpanContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wraps an OpenTelemetry span in the library's {@link Span} interface.
 * Every call is forwarded to the OpenTelemetry span; a local copy of the span's
 * state backs the getters. Exceptions raised by the OpenTelemetry SDK are logged
 * at DEBUG and never reach the caller.
 *
 * <p>Ids come from the OpenTelemetry {@link SpanContext}. When no SDK is installed
 * the context is invalid (all zeros), so the span generates its own ids and
 * inherits the trace id of its parent instead.</p>
 */
public final class OpenTelemetrySpan implements Span {
    private static final Logger log = LoggerFactory.getLogger(OpenTelemetrySpan.class);

    private final OpenTelemetryTracer tracer;
    private final io.opentelemetry.api.trace.Span otelSpan;
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

    OpenTelemetrySpan(OpenTelemetryTracer tracer, io.opentelemetry.api.trace.Span otelSpan, Span parent,
                      String name, SpanKind kind, Instant startTime) {
        this.tracer = tracer;
        this.otelSpan = otelSpan;
        SpanContext context = otelSpan.getSpanContext();
        if (context != null && context.isValid()) {
            this.traceId = context.getTraceId();
            this.spanId = context.getSpanId();
        } else {
            this.traceId = parent != null ? parent.traceId() : SpanIds.newTraceId();
            this.spanId = SpanIds.newSpanId();
        }
        this.parentSpanId = parent != null ? parent.spanId() : null;
        this.name = name;
        this.kind = kind;
        this.startTime = startTime;
    }

    synchronized void activateOn(Deque<Span> stack) {
        this.ownerStack = stack;
    }

    /**
     * @return the wrapped OpenTelemetry span
     */
    public io.opentelemetry.api.trace.Span otelSpan() {
        return otelSpan;
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
        if (ended || key == null || value == null) {
            return this;
        }
        attributes.put(key, value);
        try {
            forwardAttribute(key, value);
        } catch (RuntimeException e) {
            log.debug("OpenTelemetry setAttribute failed for {}: {}", key, e.getMessage());
        }
        return this;
    }

    private void forwardAttribute(String key, AttributeValue value) {
        if (value instanceof AttributeValue.StringValue s) {
            otelSpan.setAttribute(key, s.value());
        } else if (value instanceof AttributeValue.LongValue l) {
            otelSpan.setAttribute(key, l.value());
        } else if (value instanceof AttributeValue.DoubleValue d) {
            otelSpan.setAttribute(key, d.value());
        } else if (value instanceof AttributeValue.BooleanValue b) {
            otelSpan.setAttribute(key, b.value());
        } else {
            otelSpan.setAttribute(key, String.valueOf(value.toJava()));
        }
    }

    @Override
    public synchronized Span addEvent(String name, Map<String, ?> attributes) {
        if (ended || name == null) {
            return this;
        }
        Instant timestamp = tracer.now();
        Map<String, AttributeValue> converted = AttributeValue.fromMap(attributes);
        events.add(new SpanEvent(name, timestamp, converted));
        try {
            otelSpan.addEvent(name, toOtelAttributes(converted), timestamp);
        } catch (RuntimeException e) {
            log.debug("OpenTelemetry addEvent failed for {}: {}", name, e.getMessage());
        }
        return this;
    }

    static Attributes toOtelAttributes(Map<String, AttributeValue> attributes) {
        AttributesBuilder builder = Attributes.builder();
        attributes.forEach((key, value) -> {
            if (value instanceof AttributeValue.StringValue s) {
                builder.put(AttributeKey.stringKey(key), s.value());
            } else if (value instanceof AttributeValue.LongValue l) {
                builder.put(AttributeKey.longKey(key), l.value());
            } else if (value instanceof AttributeValue.DoubleValue d) {
                builder.put(AttributeKey.doubleKey(key), d.value());
            } else if (value instanceof AttributeValue.BooleanValue b) {
                builder.put(AttributeKey.booleanKey(key), b.value());
            } else {
                builder.put(AttributeKey.stringKey(key), String.valueOf(value.toJava()));
            }
        });
        return builder.build();
    }

    @Override
    public synchronized Span setStatus(StatusCode code, String message) {
        if (ended || code == null) {
            return this;
        }
        statusCode = code;
        statusMessage = code == StatusCode.ERROR ? message : null;
        try {
            switch (code) {
                case OK -> otelSpan.setStatus(io.opentelemetry.api.trace.StatusCode.OK);
                case ERROR -> otelSpan.setStatus(io.opentelemetry.api.trace.StatusCode.ERROR,
                        message != null ? message : "");
                default -> otelSpan.setStatus(io.opentelemetry.api.trace.StatusCode.UNSET);
            }
        } catch (RuntimeException e) {
            log.debug("OpenTelemetry setStatus failed: {}", e.getMessage());
        }
        return this;
    }

    @Override
    public void end() {
        Deque<Span> owner;
        Instant end;
        synchronized (this) {
            if (ended) {
                return;
            }
            end = tracer.now();
            endTime = end;
            durationMs = Math.round(Duration.between(startTime, end).toNanos() / 1_000_000.0);
            ended = true;
            owner = ownerStack;
        }
        try {
            otelSpan.end(end);
        } catch (RuntimeException e) {
            log.debug("OpenTelemetry end failed for {}: {}", name, e.getMessage());
        }
        tracer.onEnd(this, owner);
    }

    @Override
    public String toString() {
        return "OpenTelemetrySpan{name=" + name + ", traceId=" + traceId + ", spanId=" + spanId + "}";
    }
}
