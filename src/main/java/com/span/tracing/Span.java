package com.span.tracing;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Represents a unit of work in a distributed trace.
 * Implements {@link AutoCloseable} so spans can be used in try-with-resources blocks.
 * Closing a span sets its status to {@link StatusCode#OK} if nothing else was
 * recorded, then ends it. {@code close()} cannot see an exception leaving the
 * try block: unless {@link #recordException(Throwable)} was called first, such a
 * span still ends with OK. {@link Tracer#inSpan} records the exception itself and
 * is the simpler choice for scoped use.
 *
 * <p>Example usage:</p>
 * <pre>
 * try (Span span = tracer.startSpan("assess")) {
 *     span.setAttribute("control.family", "AC");
 *     try {
 *         // ... do work ...
 *     } catch (RuntimeException e) {
 *         span.recordException(e);
 *         throw e;
 *     }
 * }
 * </pre>
 *
 * <p>Once {@link #end()} has been called the span is immutable: every mutator
 * becomes a silent no-op and further calls to {@code end()} have no effect.</p>
 */
public interface Span extends AutoCloseable {

    String EXCEPTION_EVENT = "exception";
    String EXCEPTION_TYPE = "exception.type";
    String EXCEPTION_MESSAGE = "exception.message";

    String spanId();

    String traceId();

    /**
     * @return the parent span id, or null for the root span of a trace
     */
    String parentSpanId();

    String name();

    SpanKind kind();

    Instant startTime();

    /**
     * @return the end time, or null while the span is still open
     */
    Instant endTime();

    /**
     * @return the duration in whole milliseconds, 0 while the span is still open
     */
    long durationMs();

    StatusCode statusCode();

    String statusMessage();

    /**
     * @return an insertion-ordered snapshot of the attributes
     */
    Map<String, AttributeValue> attributes();

    /**
     * @return a snapshot of the recorded events in order
     */
    List<SpanEvent> events();

    boolean isEnded();

    Span setAttribute(String key, AttributeValue value);

    default Span setAttribute(String key, String value) {
        return value == null ? this : setAttribute(key, AttributeValue.of(value));
    }

    default Span setAttribute(String key, long value) {
        return setAttribute(key, AttributeValue.of(value));
    }

    default Span setAttribute(String key, double value) {
        return setAttribute(key, AttributeValue.of(value));
    }

    default Span setAttribute(String key, boolean value) {
        return setAttribute(key, AttributeValue.of(value));
    }

    default Span setAllAttributes(Map<String, ?> attributes) {
        AttributeValue.fromMap(attributes).forEach(this::setAttribute);
        return this;
    }

    default Span addEvent(String name) {
        return addEvent(name, Map.of());
    }

    Span addEvent(String name, Map<String, ?> attributes);

    default Span setStatus(StatusCode code) {
        return setStatus(code, null);
    }

    Span setStatus(StatusCode code, String message);

    /**
     * Marks the span as failed with the exception message and appends one
     * {@code exception} event carrying the exception type and message.
     */
    default Span recordException(Throwable t) {
        if (t == null || isEnded()) {
            return this;
        }
        String message = describe(t);
        setStatus(StatusCode.ERROR, message);
        return addEvent(EXCEPTION_EVENT, Map.of(
                EXCEPTION_TYPE, t.getClass().getName(),
                EXCEPTION_MESSAGE, message));
    }

    void end();

    /**
     * Sets {@link StatusCode#OK} if the status is still UNSET, then ends the span.
     * An exception thrown inside a try-with-resources block is not visible here, so
     * call {@link #recordException(Throwable)} before leaving the block or use
     * {@link Tracer#inSpan}.
     */
    @Override
    default void close() {
        if (!isEnded() && statusCode() == StatusCode.UNSET) {
            setStatus(StatusCode.OK);
        }
        end();
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        return message != null ? message : t.getClass().getName();
    }
}
