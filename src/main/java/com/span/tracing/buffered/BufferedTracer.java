package com.span.tracing.buffered;

import com.span.tracing.AttributeValue;
import com.span.tracing.Span;
import com.span.tracing.SpanIds;
import com.span.tracing.SpanKind;
import com.span.tracing.Tracer;
import com.span.tracing.config.TracingConfig;
import com.span.tracing.metrics.NoOpTracerMetrics;
import com.span.tracing.metrics.TracerMetrics;
import com.span.tracing.store.SpanQuery;
import com.span.tracing.store.SpanRecord;
import com.span.tracing.store.SpanRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * {@link Tracer} that buffers ended spans in memory and writes them to a
 * {@link SpanRepository} in batches.
 *
 * <p>Parent resolution for a new span: the explicit parent if given, otherwise the
 * calling thread's active span, otherwise a new trace is started. Every span gets
 * a fresh span id and becomes the thread's active span until it ends.</p>
 *
 * <p>Ended spans are appended to a buffer; when it holds {@code bufferSize} spans
 * a flush is triggered. A flush takes the whole buffer under the lock and writes it
 * after releasing the lock. If the write fails the batch is logged and discarded:
 * it is not re-buffered, retried or reported to the caller.</p>
 */
public class BufferedTracer implements Tracer {
    private static final Logger log = LoggerFactory.getLogger(BufferedTracer.class);

    public static final String AGENT_ID_ATTRIBUTE = "agent.id";
    public static final String PROJECT_ID_ATTRIBUTE = "project.id";

    private final SpanRepository repository;
    private final TracingConfig config;
    private final TracerMetrics metrics;
    private final Clock clock;
    private final SpanBuffer buffer = new SpanBuffer();
    private final ActiveSpanStack activeSpans = new ActiveSpanStack();
    private final ExecutorService flushExecutor;

    public BufferedTracer(SpanRepository repository) {
        this(repository, TracingConfig.defaults());
    }

    public BufferedTracer(SpanRepository repository, TracingConfig config) {
        this(repository, config, new NoOpTracerMetrics(), Clock.systemUTC());
    }

    public BufferedTracer(SpanRepository repository, TracingConfig config, TracerMetrics metrics, Clock clock) {
        this.repository = repository;
        this.config = config;
        this.metrics = metrics != null ? metrics : new NoOpTracerMetrics();
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.flushExecutor = config.asyncFlush() ? Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "span-flush");
            t.setDaemon(true);
            return t;
        }) : null;
        log.info("Buffered tracer initialized: bufferSize={}, asyncFlush={}, store={}",
                config.bufferSize(), config.asyncFlush(), repository.getClass().getSimpleName());
    }

    @Override
    public Span startSpan(String name, Span parent, SpanKind kind, Map<String, ?> attributes) {
        Span effectiveParent = parent != null ? parent : activeSpans.current();
        String traceId;
        String parentSpanId;
        if (effectiveParent != null) {
            traceId = effectiveParent.traceId();
            parentSpanId = effectiveParent.spanId();
        } else {
            traceId = SpanIds.newTraceId();
            parentSpanId = null;
        }

        BufferedSpan span = new BufferedSpan(this, traceId, SpanIds.newSpanId(), parentSpanId,
                name == null || name.isBlank() ? "unnamed" : name,
                kind != null ? kind : SpanKind.INTERNAL,
                now());
        if (config.agentId() != null) {
            span.setAttribute(AGENT_ID_ATTRIBUTE, config.agentId());
        }
        if (config.projectId() != null) {
            span.setAttribute(PROJECT_ID_ATTRIBUTE, config.projectId());
        }
        AttributeValue.fromMap(attributes).forEach(span::setAttribute);

        span.activateOn(activeSpans.push(span));
        log.debug("Started span {} ({}) trace={} parent={}", span.name(), span.spanId(), traceId, parentSpanId);
        return span;
    }

    @Override
    public Span getActiveSpan() {
        return activeSpans.current();
    }

    void onEnd(BufferedSpan span, Deque<Span> owner) {
        try {
            activeSpans.remove(span, owner);
            metrics.recordSpanEnded();
            int pending = buffer.add(SpanRecord.of(span, config.agentId(), config.projectId(),
                    config.defaultClassification()));
            if (pending >= config.bufferSize()) {
                triggerFlush();
            }
        } catch (RuntimeException e) {
            log.warn("Failed to buffer ended span {}: {}", span.spanId(), e.getMessage());
        }
    }

    private void triggerFlush() {
        if (flushExecutor == null) {
            flush();
            return;
        }
        try {
            flushExecutor.execute(this::flush);
        } catch (RejectedExecutionException e) {
            flush();
        }
    }

    @Override
    public void flush() {
        List<SpanRecord> batch = buffer.drain();
        if (batch.isEmpty()) {
            return;
        }
        long started = System.nanoTime();
        try {
            int inserted = repository.saveAll(batch);
            metrics.recordFlush(inserted, Duration.ofNanos(System.nanoTime() - started));
            log.debug("Flushed {} spans ({} new)", batch.size(), inserted);
        } catch (Exception e) {
            metrics.recordSpansDropped(batch.size());
            log.warn("Dropping {} spans, span store write failed: {}", batch.size(), e.getMessage());
        }
    }

    @Override
    public List<SpanRecord> querySpans(SpanQuery query) {
        try {
            return repository.query(query != null ? query : SpanQuery.all());
        } catch (Exception e) {
            log.warn("Span query failed, returning no results: {}", e.getMessage());
            return List.of();
        }
    }

    /**
     * Number of ended spans waiting for the next flush.
     */
    public int pendingCount() {
        return buffer.size();
    }

    /**
     * Wraps a task so that it runs with the calling thread's active span as the
     * implicit parent of spans started on the executing thread.
     */
    public Runnable propagate(Runnable task) {
        return activeSpans.propagate(task);
    }

    public <T> Callable<T> propagate(Callable<T> task) {
        return activeSpans.propagate(task);
    }

    @Override
    public void close() {
        if (flushExecutor != null) {
            flushExecutor.shutdown();
            try {
                if (!flushExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Span flush thread did not stop within 5s");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        flush();
        log.info("Buffered tracer closed");
    }

    Instant now() {
        return clock.instant();
    }

    @Override
    public String toString() {
        return "BufferedTracer{" + repository.getClass().getSimpleName() + "}";
    }
}
