package com.span.tracing;

import com.span.tracing.buffered.BufferedTracer;
import com.span.tracing.config.TracingConfig;
import com.span.tracing.metrics.NoOpTracerMetrics;
import com.span.tracing.metrics.TracerMetrics;
import com.span.tracing.otel.OpenTelemetryBootstrap;
import com.span.tracing.store.InMemorySpanRepository;
import com.span.tracing.store.SpanRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Builds a {@link Tracer} for a {@link TracingConfig}.
 * Never fails: a backend that cannot be built is replaced by a {@link NullTracer}.
 */
public final class TracerFactory {
    private static final Logger log = LoggerFactory.getLogger(TracerFactory.class);

    static final String OTEL_API_CLASS = "io.opentelemetry.api.OpenTelemetry";

    private TracerFactory() {
        // Utility class
    }

    public static Tracer create(TracingConfig config, SpanRepository repository) {
        return create(config, repository, new NoOpTracerMetrics());
    }

    public static Tracer create(TracingConfig config, SpanRepository repository, TracerMetrics metrics) {
        TracingConfig resolved = config != null ? config : TracingConfig.defaults();
        return create(TracingBackend.fromSelector(resolved.backend()), resolved, repository, metrics);
    }

    static Tracer create(TracingBackend backend, TracingConfig config, SpanRepository repository,
                         TracerMetrics metrics) {
        switch (backend) {
            case BUFFERED:
                SpanRepository store = repository;
                if (store == null) {
                    log.warn("Buffered tracing requested without a span store, spans will be kept in memory");
                    store = new InMemorySpanRepository();
                }
                return new BufferedTracer(store, config, metrics, Clock.systemUTC());
            case OPENTELEMETRY:
                if (!isOpenTelemetryAvailable()) {
                    log.warn("OpenTelemetry API not on the classpath, tracing disabled");
                    return new NullTracer();
                }
                try {
                    return OpenTelemetryBootstrap.createTracer(config);
                } catch (RuntimeException | LinkageError e) {
                    log.warn("OpenTelemetry tracer could not be created, tracing disabled: {}", e.getMessage());
                    return new NullTracer();
                }
            case NULL:
            default:
                return new NullTracer();
        }
    }

    static boolean isOpenTelemetryAvailable() {
        try {
            Class.forName(OTEL_API_CLASS, false, TracerFactory.class.getClassLoader());
            return true;
        } catch (ClassNotFoundException e) {
            return false;
        }
    }
}
