package com.span.tracing;

import com.span.tracing.instrument.Instrumentation;

/**
 * Static entry point backed by {@link TracerRegistry#global()}.
 * Prefer injecting a {@link TracerRegistry} or {@link Tracer} where possible.
 */
public final class Tracing {

    private Tracing() {
        // Utility class
    }

    /**
     * @return the process-wide proxy tracer; it keeps working across backend swaps
     */
    public static Tracer getTracer() {
        return TracerRegistry.global().getTracer();
    }

    /**
     * @return instrumentation bound to {@link #getTracer()}
     */
    public static Instrumentation instrumentation() {
        return TracerRegistry.global().instrumentation();
    }

    public static void configureTracer(Tracer tracer) {
        TracerRegistry.global().configure(tracer);
    }

    public static Tracer enableTracing(String backend) {
        return TracerRegistry.global().enable(backend);
    }
}
