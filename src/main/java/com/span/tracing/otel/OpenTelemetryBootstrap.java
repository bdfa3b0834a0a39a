package com.span.tracing.otel;

import com.span.tracing.Tracer;
import com.span.tracing.config.TracingConfig;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Creates the OpenTelemetry instance behind {@link OpenTelemetryTracer}.
 *
 * <p>With an OTLP endpoint configured, a dedicated SDK is built that exports
 * through gRPC with a batch span processor. Without one, the globally registered
 * OpenTelemetry is used. If the SDK cannot be built, tracing continues with the
 * no-op OpenTelemetry.</p>
 */
public final class OpenTelemetryBootstrap {
    private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);

    public static final String INSTRUMENTATION_SCOPE = "com.span.tracing";
    static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    private static final long SDK_TIMEOUT_SECONDS = 10;

    private OpenTelemetryBootstrap() {
        // Utility class
    }

    public static OpenTelemetry create(TracingConfig config) {
        String endpoint = config.otlpEndpoint();
        if (endpoint == null || endpoint.isBlank()) {
            log.info("No OTLP endpoint configured, using the global OpenTelemetry instance");
            return GlobalOpenTelemetry.get();
        }
        try {
            Resource resource = Resource.getDefault()
                    .merge(Resource.create(Attributes.of(SERVICE_NAME, config.serviceName())));
            OtlpGrpcSpanExporter exporter = OtlpGrpcSpanExporter.builder()
                    .setEndpoint(endpoint)
                    .build();
            SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                    .addSpanProcessor(BatchSpanProcessor.builder(exporter).build())
                    .setResource(resource)
                    .build();
            OpenTelemetrySdk sdk = OpenTelemetrySdk.builder()
                    .setTracerProvider(tracerProvider)
                    .build();
            log.info("OpenTelemetry SDK initialized: endpoint={}, service={}", endpoint, config.serviceName());
            return sdk;
        } catch (RuntimeException e) {
            log.warn("Failed to initialize OpenTelemetry SDK, spans will not be exported: {}", e.getMessage());
            return OpenTelemetry.noop();
        }
    }

    /**
     * Creates a tracer on top of {@link #create(TracingConfig)}. When the instance is
     * an SDK built here, flushing the tracer forces an export and closing it shuts
     * the SDK down.
     */
    public static Tracer createTracer(TracingConfig config) {
        return createTracer(create(config));
    }

    public static Tracer createTracer(OpenTelemetry openTelemetry) {
        io.opentelemetry.api.trace.Tracer tracer = openTelemetry.getTracer(INSTRUMENTATION_SCOPE);
        if (openTelemetry instanceof OpenTelemetrySdk sdk) {
            SdkTracerProvider provider = sdk.getSdkTracerProvider();
            return new OpenTelemetryTracer(tracer,
                    () -> provider.forceFlush().join(SDK_TIMEOUT_SECONDS, TimeUnit.SECONDS),
                    () -> provider.shutdown().join(SDK_TIMEOUT_SECONDS, TimeUnit.SECONDS));
        }
        return new OpenTelemetryTracer(tracer);
    }
}
