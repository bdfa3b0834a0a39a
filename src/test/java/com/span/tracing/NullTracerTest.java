package com.span.tracing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NullTracer Tests")
class NullTracerTest {

    private final NullTracer tracer = new NullTracer();

    @Nested
    @DisplayName("NullSpan")
    class NullSpanTests {

        @Test
        @DisplayName("Should carry well-formed identifiers")
        void identifiers() {
            Span span = tracer.startSpan("op");

            assertEquals(SpanIds.TRACE_ID_LENGTH, span.traceId().length());
            assertEquals(SpanIds.SPAN_ID_LENGTH, span.spanId().length());
            assertTrue(span.traceId().matches("[0-9a-f]+"));
            assertTrue(span.spanId().matches("[0-9a-f]+"));
            assertNull(span.parentSpanId());
            assertEquals("op", span.name());
            assertEquals(SpanKind.INTERNAL, span.kind());
        }

        @Test
        @DisplayName("Mutators should be no-ops")
        void mutatorsAreNoOps() {
            Span span = tracer.startSpan("op");

            span.setAttribute("key", "value");
            span.setAttribute("count", 3L);
            span.addEvent("event", Map.of("a", 1));
            span.setStatus(StatusCode.ERROR, "boom");
            span.recordException(new IllegalStateException("boom"));
            span.end();

            assertTrue(span.attributes().isEmpty());
            assertTrue(span.events().isEmpty());
            assertEquals(StatusCode.UNSET, span.statusCode());
            assertNull(span.statusMessage());
            assertNull(span.endTime());
            assertEquals(0, span.durationMs());
        }

        @Test
        @DisplayName("try-with-resources should not throw on error exit")
        void scopedUseWithError() {
            assertThrows(IllegalArgumentException.class, () -> {
                try (Span span = tracer.startSpan("op")) {
                    throw new IllegalArgumentException("deliberate");
                }
            });
        }
    }

    @Test
    @DisplayName("Should inherit trace id and parent span id from an explicit parent")
    void inheritsFromExplicitParent() {
        Span parent = tracer.startSpan("parent");
        Span child = tracer.startSpan("child", parent, SpanKind.CLIENT, Map.of());

        assertEquals(parent.traceId(), child.traceId());
        assertEquals(parent.spanId(), child.parentSpanId());
        assertNotEquals(parent.spanId(), child.spanId());
        assertEquals(SpanKind.CLIENT, child.kind());
    }

    @Test
    @DisplayName("Should not track an active span")
    void noActiveSpan() {
        tracer.startSpan("op");
        assertNull(tracer.getActiveSpan());
    }

    @Test
    @DisplayName("Flush and query should be no-ops")
    void flushAndQuery() {
        assertDoesNotThrow(tracer::flush);
        assertTrue(tracer.querySpans(null).isEmpty());
        assertDoesNotThrow(tracer::close);
    }

    @Test
    @DisplayName("inSpan should return the body's result and rethrow its exception")
    void inSpan() {
        assertEquals(Integer.valueOf(42), tracer.inSpan("op", SpanKind.INTERNAL, () -> 42));

        IllegalStateException thrown = new IllegalStateException("boom");
        IllegalStateException caught = assertThrows(IllegalStateException.class,
                () -> tracer.inSpan("op", SpanKind.INTERNAL, () -> {
                    throw thrown;
                }));
        assertSame(thrown, caught);
    }

    @Test
    @DisplayName("Concurrent span creation from many threads should not interfere")
    void concurrentUse() throws Exception {
        int threads = 12;
        int spansPerThread = 200;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        Set<String> spanIds = ConcurrentHashMap.newKeySet();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < spansPerThread; i++) {
                        try (Span span = tracer.startSpan("op-" + i)) {
                            span.setAttribute("i", i);
                            spanIds.add(span.spanId());
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(threads * spansPerThread, spanIds.size());
    }
}
