package com.span.tracing.otel;

import com.span.tracing.NullTracer;
import com.span.tracing.Span;
import com.span.tracing.SpanKind;
import com.span.tracing.Tracer;
import com.span.tracing.buffered.ActiveSpanStack;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.TraceFlags;
import io.opentelemetry.api.trace.TraceState;
import io.opentelemetry.context.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Deque;
import java.util.Map;

/**
 * OpenTelemetry-based implementation of {@link Tracer}.
 * Requires {@code opentelemetry-api} on the classpath (optional dependency).
 *
 * <p>Spans are created through an OpenTelemetry {@link io.opentelemetry.api.trace.Tracer}
 * and exported by whatever SDK is behind it. Parent linkage is explicit: the
 * parent span is placed in an otherwise empty {@link Context}, so the ambient
 * OpenTelemetry context of the thread does not interfere.</p>
 */
public class OpenTelemetryTracer implements Tracer {
    private static final Logger log = LoggerFactory.getLogger(OpenTelemetryTracer.class);

    private final io.opentelemetry.api.trace.Tracer tracer;
    private final Runnable flushHook;
    private final Runnable closeHook;
    private final Clock clock;
    private final ActiveSpanStack activeSpans = new ActiveSpanStack();

    public OpenTelemetryTracer(io.opentelemetry.api.trace.Tracer tracer) {
        this(tracer, () -> { }, () -> { });
    }

    /**
     * @param flushHook invoked by {@link #flush()}, typically forcing the SDK span processor to export
     * @param closeHook invoked by {@link #close()}, typically shutting the SDK tracer provider down
     */
    public OpenTelemetryTracer(io.opentelemetry.api.trace.Tracer tracer, Runnable flushHook, Runnable closeHook) {
        this(tracer, flushHook, closeHook, Clock.systemUTC());
    }

    OpenTelemetryTracer(io.opentelemetry.api.trace.Tracer tracer, Runnable flushHook, Runnable closeHook,
                        Clock clock) {
        this.tracer = tracer;
        this.flushHook = flushHook;
        this.closeHook = closeHook;
        this.clock = clock;
    }

    @Override
    public Span startSpan(String name, Span parent, SpanKind kind, Map<String, ?> attributes) {
        String spanName = name == null || name.isBlank() ? "unnamed" : name;
        SpanKind resolvedKind = kind != null ? kind : SpanKind.INTERNAL;
        Span effectiveParent = parent != null ? parent : activeSpans.current();
        try {
            Instant start = now();
            SpanBuilder builder = tracer.spanBuilder(spanName)
                    .setSpanKind(io.opentelemetry.api.trace.SpanKind.valueOf(resolvedKind.name()))
                    .setStartTimestamp(start);
            Context parentContext = parentContext(effectiveParent);
            if (parentContext != null) {
                builder.setParent(parentContext);
            } else {
                builder.setNoParent();
            }
            OpenTelemetrySpan span = new OpenTelemetrySpan(this, builder.startSpan(), effectiveParent,
                    spanName, resolvedKind, start);
            span.setAllAttributes(attributes);
            span.activateOn(activeSpans.push(span));
            return span;
        } catch (RuntimeException e) {
            log.debug("OpenTelemetry span creation failed for {}: {}", spanName, e.getMessage());
            return new NullTracer().startSpan(spanName, effectiveParent, resolvedKind, Map.of());
        }
    }

    private static Context parentContext(Span parent) {
        if (parent == null) {
            return null;
        }
        if (parent instanceof OpenTelemetrySpan otel) {
            return Context.root().with(otel.otelSpan());
        }
        SpanContext remote = SpanContext.create(parent.traceId(), parent.spanId(),
                TraceFlags.getSampled(), TraceState.getDefault());
        if (!remote.isValid()) {
            return null;
        }
        return Context.root().with(io.opentelemetry.api.trace.Span.wrap(remote));
    }

    @Override
    public Span getActiveSpan() {
        return activeSpans.current();
    }

    void onEnd(OpenTelemetrySpan span, Deque<Span> owner) {
        activeSpans.remove(span, owner);
    }

    Instant now() {
        return clock.instant();
    }

    @Override
    public void flush() {
        try {
            flushHook.run();
        } catch (RuntimeException e) {
            log.debug("OpenTelemetry flush failed: {}", e.getMessage());
        }
    }

    @Override
    public void close() {
        flush();
        try {
            closeHook.run();
        } catch (RuntimeException e) {
            log.debug("OpenTelemetry shutdown failed: {}", e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "OpenTelemetryTracer";
    }
}
