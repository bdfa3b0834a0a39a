package com.span.tracing;

import com.span.tracing.config.TracingConfig;
import com.span.tracing.instrument.ContentTagger;
import com.span.tracing.instrument.Instrumentation;
import com.span.tracing.metrics.NoOpTracerMetrics;
import com.span.tracing.metrics.TracerMetrics;
import com.span.tracing.store.SpanRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the {@link ProxyTracer} handed out to instrumented code and the lifecycle
 * of the backend behind it.
 *
 * <p>Components should receive a registry (or its tracer) by injection; the
 * process-wide instance returned by {@link #global()} backs the static
 * {@link Tracing} facade.</p>
 */
public class TracerRegistry {
    private static final Logger log = LoggerFactory.getLogger(TracerRegistry.class);

    private static final TracerRegistry GLOBAL = new TracerRegistry();

    private final ProxyTracer proxy = new ProxyTracer();
    private final Object lifecycleLock = new Object();
    private volatile TracingConfig config = TracingConfig.defaults();
    private volatile SpanRepository repository;
    private volatile TracerMetrics metrics = new NoOpTracerMetrics();
    private volatile Instrumentation instrumentation = new Instrumentation(proxy, ContentTagger.from(config));

    public static TracerRegistry global() {
        return GLOBAL;
    }

    /**
     * @return the proxy tracer; the same instance for the lifetime of the registry
     */
    public ProxyTracer getTracer() {
        return proxy;
    }

    /**
     * @return instrumentation bound to the proxy tracer, with content tagging as
     * configured by the last {@link #init}
     */
    public Instrumentation instrumentation() {
        return instrumentation;
    }

    /**
     * Builds the backend named by {@code config.backend()} and installs it.
     *
     * @param repository span store for the buffered backend, may be null
     */
    public Tracer init(TracingConfig config, SpanRepository repository) {
        return init(config, repository, new NoOpTracerMetrics());
    }

    public Tracer init(TracingConfig config, SpanRepository repository, TracerMetrics metrics) {
        synchronized (lifecycleLock) {
            this.config = config != null ? config : TracingConfig.defaults();
            this.repository = repository;
            this.metrics = metrics != null ? metrics : new NoOpTracerMetrics();
            this.instrumentation = new Instrumentation(proxy, ContentTagger.from(this.config));
            Tracer tracer = TracerFactory.create(this.config, repository, this.metrics);
            replace(tracer);
            log.info("Tracing initialized with backend {}", tracer);
            return tracer;
        }
    }

    /**
     * Installs an already built backend. The previous backend is flushed and closed.
     */
    public void configure(Tracer tracer) {
        synchronized (lifecycleLock) {
            replace(tracer);
        }
    }

    /**
     * Switches to the backend named by {@code selector}, reusing the configuration
     * and span store given to {@link #init}.
     */
    public Tracer enable(String selector) {
        synchronized (lifecycleLock) {
            TracingBackend backend = TracingBackend.fromSelector(selector);
            Tracer tracer = TracerFactory.create(backend, config, repository, metrics);
            replace(tracer);
            log.info("Tracing enabled: {} -> {}", selector, tracer);
            return tracer;
        }
    }

    /**
     * Flushes and closes the current backend and installs a {@link NullTracer}.
     */
    public void teardown() {
        synchronized (lifecycleLock) {
            replace(new NullTracer());
        }
    }

    private void replace(Tracer next) {
        Tracer previous = proxy.setTracer(next);
        if (previous != null && previous != next) {
            closeQuietly(previous);
        }
    }

    private void closeQuietly(Tracer tracer) {
        try {
            tracer.close();
        } catch (Exception e) {
            log.warn("Failed to close tracer {}: {}", tracer, e.getMessage());
        }
    }
}
