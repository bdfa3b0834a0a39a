package com.span.tracing.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer-based implementation of {@link TracerMetrics}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code tracing.spans.ended} - Counter</li>
 *   <li>{@code tracing.spans.persisted} - Counter</li>
 *   <li>{@code tracing.spans.dropped} - Counter</li>
 *   <li>{@code tracing.flush.duration} - Timer</li>
 * </ul>
 */
public class MicrometerTracerMetrics implements TracerMetrics {

    private final Counter endedCounter;
    private final Counter persistedCounter;
    private final Counter droppedCounter;
    private final Timer flushTimer;

    public MicrometerTracerMetrics(MeterRegistry registry) {
        this.endedCounter = Counter.builder("tracing.spans.ended")
                .description("Number of spans ended")
                .register(registry);
        this.persistedCounter = Counter.builder("tracing.spans.persisted")
                .description("Number of spans written to the span store")
                .register(registry);
        this.droppedCounter = Counter.builder("tracing.spans.dropped")
                .description("Number of spans discarded after a failed flush")
                .register(registry);
        this.flushTimer = Timer.builder("tracing.flush.duration")
                .description("Duration of span buffer flushes")
                .register(registry);
    }

    @Override
    public void recordSpanEnded() {
        endedCounter.increment();
    }

    @Override
    public void recordFlush(int persisted, Duration duration) {
        persistedCounter.increment(persisted);
        flushTimer.record(duration);
    }

    @Override
    public void recordSpansDropped(int count) {
        droppedCounter.increment(count);
    }
}
