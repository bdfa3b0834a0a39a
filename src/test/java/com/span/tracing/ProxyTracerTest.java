package com.span.tracing;

import com.span.tracing.store.SpanQuery;
import com.span.tracing.store.SpanRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("ProxyTracer Tests")
class ProxyTracerTest {

    @Test
    @DisplayName("Should default to NullTracer")
    void defaultsToNullTracer() {
        ProxyTracer proxy = new ProxyTracer();

        assertInstanceOf(NullTracer.class, proxy.getActual());
        assertInstanceOf(NullSpan.class, proxy.startSpan("op"));
    }

    @Test
    @DisplayName("setTracer should swap the backend and return the previous one")
    void swapsBackend() {
        ProxyTracer proxy = new ProxyTracer();
        Tracer backend = mock(Tracer.class);

        Tracer previous = proxy.setTracer(backend);

        assertInstanceOf(NullTracer.class, previous);
        assertSame(backend, proxy.getActual());
    }

    @Test
    @DisplayName("setTracer(null) should install a NullTracer")
    void nullInstallsNullTracer() {
        ProxyTracer proxy = new ProxyTracer(mock(Tracer.class));

        proxy.setTracer(null);

        assertInstanceOf(NullTracer.class, proxy.getActual());
    }

    @Test
    @DisplayName("setTracer should reject the proxy itself")
    void rejectsSelf() {
        ProxyTracer proxy = new ProxyTracer();
        assertThrows(IllegalArgumentException.class, () -> proxy.setTracer(proxy));
    }

    @Test
    @DisplayName("Every call should be delegated to the current backend")
    void delegates() {
        Tracer backend = mock(Tracer.class);
        Span span = new NullSpan();
        Span parent = new NullSpan();
        SpanQuery query = SpanQuery.all();
        List<SpanRecord> records = List.of();
        when(backend.startSpan(eq("op"), any(), any(), any())).thenReturn(span);
        when(backend.getActiveSpan()).thenReturn(parent);
        when(backend.querySpans(query)).thenReturn(records);

        ProxyTracer proxy = new ProxyTracer();
        proxy.setTracer(backend);

        assertSame(span, proxy.startSpan("op", parent, SpanKind.SERVER, Map.of("k", "v")));
        assertSame(parent, proxy.getActiveSpan());
        assertSame(records, proxy.querySpans(query));
        proxy.flush();
        proxy.close();

        verify(backend).startSpan("op", parent, SpanKind.SERVER, Map.of("k", "v"));
        verify(backend).flush();
        verify(backend).close();
    }

    @Test
    @DisplayName("Holders of the proxy should observe a later swap")
    void holdersSeeSwap() {
        ProxyTracer proxy = new ProxyTracer();
        Tracer heldByComponent = proxy;
        assertInstanceOf(NullSpan.class, heldByComponent.startSpan("before"));

        Tracer backend = mock(Tracer.class);
        Span span = mock(Span.class);
        when(backend.startSpan(any(), any(), any(), any())).thenReturn(span);
        proxy.setTracer(backend);

        assertSame(span, heldByComponent.startSpan("after"));
    }
}
