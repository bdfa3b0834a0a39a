package com.span.tracing;

import com.span.tracing.store.SpanQuery;
import com.span.tracing.store.SpanRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link Tracer} that delegates to a swappable backend.
 *
 * <p>Code can obtain the proxy once, at construction or start-up, and still see
 * a backend that is enabled later through {@link #setTracer(Tracer)}. The
 * backend defaults to {@link NullTracer}.</p>
 */
public class ProxyTracer implements Tracer {
    private static final Logger log = LoggerFactory.getLogger(ProxyTracer.class);

    private final AtomicReference<Tracer> actual;

    public ProxyTracer() {
        this(new NullTracer());
    }

    public ProxyTracer(Tracer initial) {
        this.actual = new AtomicReference<>(initial != null ? initial : new NullTracer());
    }

    /**
     * Atomically replaces the backend.
     *
     * @param tracer the new backend; null installs a {@link NullTracer}
     * @return the previous backend
     */
    public Tracer setTracer(Tracer tracer) {
        if (tracer == this) {
            throw new IllegalArgumentException("ProxyTracer cannot delegate to itself");
        }
        Tracer next = tracer != null ? tracer : new NullTracer();
        Tracer previous = actual.getAndSet(next);
        log.info("Tracer backend switched: {} -> {}", previous, next);
        return previous;
    }

    /**
     * @return the backend currently receiving calls
     */
    public Tracer getActual() {
        return actual.get();
    }

    @Override
    public Span startSpan(String name, Span parent, SpanKind kind, Map<String, ?> attributes) {
        return actual.get().startSpan(name, parent, kind, attributes);
    }

    @Override
    public Span getActiveSpan() {
        return actual.get().getActiveSpan();
    }

    @Override
    public void flush() {
        actual.get().flush();
    }

    @Override
    public List<SpanRecord> querySpans(SpanQuery query) {
        return actual.get().querySpans(query);
    }

    @Override
    public void close() {
        actual.get().close();
    }

    @Override
    public String toString() {
        return "ProxyTracer{" + actual.get() + "}";
    }
}
