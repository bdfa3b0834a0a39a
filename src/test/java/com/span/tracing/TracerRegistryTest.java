package com.span.tracing;

import com.span.tracing.buffered.BufferedTracer;
import com.span.tracing.config.TracingConfig;
import com.span.tracing.instrument.Instrumentation;
import com.span.tracing.otel.OpenTelemetryTracer;
import com.span.tracing.store.InMemorySpanRepository;
import com.span.tracing.store.SpanQuery;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("Tracer registry Tests")
class TracerRegistryTest {

    @Nested
    @DisplayName("TracingBackend")
    class BackendSelectorTests {

        @ParameterizedTest
        @ValueSource(strings = {"null", "none", "off", "NONE", " off "})
        @DisplayName("Null aliases should select NULL")
        void nullAliases(String selector) {
            assertEquals(TracingBackend.NULL, TracingBackend.fromSelector(selector));
        }

        @ParameterizedTest
        @ValueSource(strings = {"buffered", "sqlite", "jdbc", "persistent", "SQLite"})
        @DisplayName("Buffered aliases should select BUFFERED")
        void bufferedAliases(String selector) {
            assertEquals(TracingBackend.BUFFERED, TracingBackend.fromSelector(selector));
        }

        @ParameterizedTest
        @ValueSource(strings = {"otel", "opentelemetry", "OpenTelemetry"})
        @DisplayName("OpenTelemetry aliases should select OPENTELEMETRY")
        void otelAliases(String selector) {
            assertEquals(TracingBackend.OPENTELEMETRY, TracingBackend.fromSelector(selector));
        }

        @Test
        @DisplayName("Unknown and missing selectors should fall back to NULL")
        void unknownSelector() {
            assertEquals(TracingBackend.NULL, TracingBackend.fromSelector("zipkin"));
            assertEquals(TracingBackend.NULL, TracingBackend.fromSelector(null));
            assertEquals(TracingBackend.NULL, TracingBackend.fromSelector(""));
        }
    }

    @Nested
    @DisplayName("TracerFactory")
    class FactoryTests {

        @Test
        @DisplayName("Should build a NullTracer by default")
        void defaultIsNull() {
            assertInstanceOf(NullTracer.class, TracerFactory.create(TracingConfig.defaults(), null));
        }

        @Test
        @DisplayName("Should build a BufferedTracer on the given store")
        void buffered() {
            InMemorySpanRepository repository = new InMemorySpanRepository();
            TracingConfig config = TracingConfig.builder().backend("buffered").bufferSize(1).build();

            Tracer tracer = TracerFactory.create(config, repository);
            tracer.startSpan("op").end();

            assertInstanceOf(BufferedTracer.class, tracer);
            assertEquals(1, repository.count());
        }

        @Test
        @DisplayName("Should fall back to an in-memory store when none is given")
        void bufferedWithoutStore() {
            TracingConfig config = TracingConfig.builder().backend("jdbc").bufferSize(1).build();

            Tracer tracer = TracerFactory.create(config, null);
            Span span = tracer.startSpan("op");
            span.end();

            assertInstanceOf(BufferedTracer.class, tracer);
            assertEquals(1, tracer.querySpans(SpanQuery.byTraceId(span.traceId())).size());
        }

        @Test
        @DisplayName("Should build an OpenTelemetry tracer when the API is available")
        void openTelemetry() {
            TracingConfig config = TracingConfig.builder().backend("otel").build();

            Tracer tracer = TracerFactory.create(config, null);

            assertTrue(TracerFactory.isOpenTelemetryAvailable());
            assertInstanceOf(OpenTelemetryTracer.class, tracer);
            assertDoesNotThrow(() -> tracer.startSpan("op").close());
        }
    }

    @Nested
    @DisplayName("TracerRegistry lifecycle")
    class LifecycleTests {

        private TracerRegistry registry;

        @BeforeEach
        void setUp() {
            registry = new TracerRegistry();
        }

        @AfterEach
        void tearDown() {
            registry.teardown();
        }

        @Test
        @DisplayName("getTracer should return the same proxy across swaps")
        void sameProxy() {
            ProxyTracer before = registry.getTracer();
            registry.enable("buffered");
            assertSame(before, registry.getTracer());
            assertInstanceOf(BufferedTracer.class, registry.getTracer().getActual());
        }

        @Test
        @DisplayName("init should install the configured backend")
        void init() {
            InMemorySpanRepository repository = new InMemorySpanRepository();
            registry.init(TracingConfig.builder().backend("persistent").bufferSize(1).build(), repository);

            registry.getTracer().startSpan("op").end();

            assertEquals(1, repository.count());
        }

        @Test
        @DisplayName("enable should reuse the store given to init")
        void enableReusesStore() {
            InMemorySpanRepository repository = new InMemorySpanRepository();
            registry.init(TracingConfig.builder().bufferSize(1).build(), repository);
            assertInstanceOf(NullTracer.class, registry.getTracer().getActual());

            registry.enable("sqlite");
            registry.getTracer().startSpan("op").end();

            assertEquals(1, repository.count());
        }

        @Test
        @DisplayName("otel without an endpoint or SDK should still hand out distinct, linked ids")
        void openTelemetryWithoutSdk() {
            Tracer tracer = registry.enable("otel");
            assertInstanceOf(OpenTelemetryTracer.class, tracer);

            try (Span parent = registry.getTracer().startSpan("parent");
                 Span child = registry.getTracer().startSpan("child");
                 Span other = registry.getTracer().startSpan("other", null, SpanKind.INTERNAL, Map.of())) {
                String zeroSpanId = "0".repeat(SpanIds.SPAN_ID_LENGTH);
                assertNotEquals(zeroSpanId, parent.spanId());
                assertNotEquals("0".repeat(SpanIds.TRACE_ID_LENGTH), parent.traceId());
                assertNotEquals(parent.spanId(), child.spanId());
                assertNotEquals(child.spanId(), other.spanId());
                assertEquals(parent.spanId(), child.parentSpanId());
                assertEquals(parent.traceId(), child.traceId());
                assertEquals(child.spanId(), other.parentSpanId());
            }
        }

        @Test
        @DisplayName("init should apply the content tracing setting to the registry's instrumentation")
        void contentTracingFromConfig() {
            assertFalse(registry.instrumentation().contentTagger().isContentTracingEnabled());

            registry.init(TracingConfig.builder().backend("buffered").contentTracingEnabled(true).build(),
                    new InMemorySpanRepository());
            Instrumentation instrumentation = registry.instrumentation();
            Span span = registry.getTracer().startSpan("prompt");
            instrumentation.contentTagger().setContentTag(span, "gen_ai.prompt", "Hello world");

            assertSame(registry.getTracer(), instrumentation.tracer());
            assertEquals(AttributeValue.of("Hello world"), span.attributes().get("gen_ai.prompt"));
            assertTrue(span.attributes().containsKey("gen_ai.prompt_hash"));
            span.end();
        }

        @Test
        @DisplayName("configure should close the previous backend")
        void configureClosesPrevious() {
            Tracer first = mock(Tracer.class);
            Tracer second = mock(Tracer.class);

            registry.configure(first);
            registry.configure(second);

            verify(first).close();
            verify(second, never()).close();
            assertSame(second, registry.getTracer().getActual());
        }

        @Test
        @DisplayName("teardown should flush pending spans and reset to NullTracer")
        void teardownFlushes() {
            InMemorySpanRepository repository = new InMemorySpanRepository();
            registry.init(TracingConfig.builder().backend("buffered").bufferSize(100).build(), repository);
            registry.getTracer().startSpan("op").end();
            assertEquals(0, repository.count());

            registry.teardown();

            assertEquals(1, repository.count());
            assertInstanceOf(NullTracer.class, registry.getTracer().getActual());
        }

        @Test
        @DisplayName("A failing close of the previous backend should not break the swap")
        void failingClose() {
            Tracer failing = mock(Tracer.class);
            doThrow(new IllegalStateException("boom")).when(failing).close();
            registry.configure(failing);

            assertDoesNotThrow(() -> registry.enable("null"));
            assertInstanceOf(NullTracer.class, registry.getTracer().getActual());
        }
    }

    @Nested
    @DisplayName("Tracing facade")
    class FacadeTests {

        @AfterEach
        void tearDown() {
            TracerRegistry.global().teardown();
        }

        @Test
        @DisplayName("getTracer should return the global proxy")
        void globalProxy() {
            assertSame(TracerRegistry.global().getTracer(), Tracing.getTracer());
            assertInstanceOf(ProxyTracer.class, Tracing.getTracer());
        }

        @Test
        @DisplayName("enableTracing(\"null\") should install a NullTracer")
        void enableNull() {
            Tracing.enableTracing("null");
            assertInstanceOf(NullTracer.class, TracerRegistry.global().getTracer().getActual());
        }

        @Test
        @DisplayName("configureTracer should install the given backend")
        void configure() {
            BufferedTracer tracer = new BufferedTracer(new InMemorySpanRepository());
            Tracing.configureTracer(tracer);
            assertSame(tracer, TracerRegistry.global().getTracer().getActual());
        }
    }
}
