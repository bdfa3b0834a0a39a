package com.span.tracing.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link TracerMetrics}.
 */
public class NoOpTracerMetrics implements TracerMetrics {

    @Override
    public void recordSpanEnded() {
    }

    @Override
    public void recordFlush(int persisted, Duration duration) {
    }

    @Override
    public void recordSpansDropped(int count) {
    }
}
