package com.span.tracing;

import com.span.tracing.store.SpanQuery;
import com.span.tracing.store.SpanRecord;

import java.util.List;
import java.util.Map;

/**
 * Creates spans and hands ended spans to a tracing backend.
 * Implementations can persist spans locally, forward them to OpenTelemetry,
 * or discard them. The default {@link NullTracer} does nothing, so instrumented
 * code costs next to nothing until tracing is enabled.
 *
 * <p>No method of a tracer throws because of a backend failure: span creation
 * always returns a usable span, and storage problems are logged and absorbed.</p>
 */
public interface Tracer extends AutoCloseable {

    /**
     * Starts a span. When {@code parent} is null the span becomes a child of the
     * calling thread's active span, or the root of a new trace if there is none.
     * The new span becomes the active span of the calling thread.
     *
     * @param name       operation name; a blank name is recorded as {@code unnamed}
     * @param parent     explicit parent, or null for implicit inheritance
     * @param kind       span kind, null means {@link SpanKind#INTERNAL}
     * @param attributes initial attributes, may be null
     */
    Span startSpan(String name, Span parent, SpanKind kind, Map<String, ?> attributes);

    default Span startSpan(String name) {
        return startSpan(name, null, SpanKind.INTERNAL, Map.of());
    }

    default Span startSpan(String name, SpanKind kind) {
        return startSpan(name, null, kind, Map.of());
    }

    default Span startSpan(String name, SpanKind kind, Map<String, ?> attributes) {
        return startSpan(name, null, kind, attributes);
    }

    /**
     * @return the span most recently started and not yet ended on the calling
     * thread, or null
     */
    Span getActiveSpan();

    /**
     * Writes buffered spans to durable storage. Never throws.
     */
    void flush();

    /**
     * Reads persisted spans. Backends without storage return an empty list.
     */
    default List<SpanRecord> querySpans(SpanQuery query) {
        return List.of();
    }

    /**
     * Runs {@code body} inside a new span. The span ends with {@link StatusCode#OK}
     * on normal completion, or with {@link StatusCode#ERROR} and an exception event
     * when the body throws; the exception is rethrown unchanged.
     */
    default <T, E extends Throwable> T inSpan(String name, SpanKind kind, TracedCall<T, E> body) throws E {
        Span span = startSpan(name, kind);
        try {
            return body.call();
        } catch (Throwable t) {
            span.recordException(t);
            throw t;
        } finally {
            span.close();
        }
    }

    /**
     * Flushes and releases backend resources.
     */
    @Override
    default void close() {
        flush();
    }
}
