package com.span.tracing.metrics;

import java.time.Duration;

/**
 * Interface for recording the tracer's own health metrics.
 * Implementations can integrate with Micrometer or other metrics systems.
 * The default {@link NoOpTracerMetrics} does nothing, ensuring the library works
 * without any metrics dependencies on the classpath.
 */
public interface TracerMetrics {

    void recordSpanEnded();

    void recordFlush(int persisted, Duration duration);

    void recordSpansDropped(int count);
}
