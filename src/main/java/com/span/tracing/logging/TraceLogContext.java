package com.span.tracing.logging;

import org.slf4j.MDC;

/**
 * Publishes the active span's identifiers to the SLF4J MDC so that log lines
 * written inside a span can be correlated with it.
 *
 * <p>Keys: {@code traceId} and {@code spanId}.</p>
 */
public final class TraceLogContext {

    public static final String TRACE_ID = "traceId";
    public static final String SPAN_ID = "spanId";

    private TraceLogContext() {
        // Utility class
    }

    public static void set(String traceId, String spanId) {
        MDC.put(TRACE_ID, traceId);
        MDC.put(SPAN_ID, spanId);
    }

    /**
     * @return the span id currently in the MDC, or null
     */
    public static String currentSpanId() {
        return MDC.get(SPAN_ID);
    }

    public static void clear() {
        MDC.remove(TRACE_ID);
        MDC.remove(SPAN_ID);
    }
}
