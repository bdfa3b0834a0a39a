package com.span.tracing.buffered;

import com.span.tracing.Span;
import com.span.tracing.logging.TraceLogContext;

import java.util.Deque;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Per-thread stack of open spans for one tracer.
 *
 * <p>Starting a span pushes it; ending it removes it, so the parent becomes the
 * active span again once a child ends. A span ended out of order is removed
 * from wherever it sits. Each span remembers the stack of the thread that started
 * it, so ending it on another thread still removes it from the right stack.</p>
 *
 * <p>The MDC of a thread can only be updated by that thread. When a span is ended
 * on another thread, the starting thread's MDC keeps the ended span's ids until
 * that thread next asks for its active span ({@link #current()}, which every
 * {@code startSpan} and {@code getActiveSpan} does) and the MDC is corrected.</p>
 *
 * <p>Threads from an executor do not see the submitting thread's spans. Use
 * {@link #propagate(Runnable)} or {@link #propagate(Callable)} to carry the
 * caller's active span over as the implicit parent.</p>
 */
public final class ActiveSpanStack {

    private final ThreadLocal<Deque<Span>> stacks = ThreadLocal.withInitial(ConcurrentLinkedDeque::new);
    // span id this stack last wrote to the calling thread's MDC
    private final ThreadLocal<String> published = new ThreadLocal<>();
    private final boolean publishToMdc;

    public ActiveSpanStack() {
        this(true);
    }

    public ActiveSpanStack(boolean publishToMdc) {
        this.publishToMdc = publishToMdc;
    }

    /**
     * Makes {@code span} the calling thread's active span.
     *
     * @return the stack the span was pushed on, to be passed to {@link #remove}
     */
    public Deque<Span> push(Span span) {
        Deque<Span> stack = stacks.get();
        stack.addLast(span);
        if (publishToMdc) {
            publish(span);
        }
        return stack;
    }

    /**
     * Removes {@code span} from the stack it was pushed on.
     */
    public void remove(Span span, Deque<Span> owner) {
        if (owner == null) {
            return;
        }
        owner.removeLastOccurrence(span);
        Deque<Span> current = stacks.get();
        if (owner != current) {
            return;
        }
        Span top = current.peekLast();
        if (top == null) {
            stacks.remove();
        }
        if (publishToMdc) {
            if (top != null) {
                publish(top);
            } else {
                TraceLogContext.clear();
                published.remove();
            }
        }
    }

    /**
     * @return the calling thread's active span, or null
     */
    public Span current() {
        Deque<Span> stack = stacks.get();
        Span top = stack.peekLast();
        if (top == null) {
            stacks.remove();
        }
        if (publishToMdc) {
            syncMdc(top);
        }
        return top;
    }

    private void publish(Span span) {
        TraceLogContext.set(span.traceId(), span.spanId());
        published.set(span.spanId());
    }

    private void syncMdc(Span top) {
        String last = published.get();
        if (top == null) {
            if (last != null) {
                if (last.equals(TraceLogContext.currentSpanId())) {
                    TraceLogContext.clear();
                }
                published.remove();
            }
        } else if (!top.spanId().equals(last)) {
            publish(top);
        }
    }

    /**
     * Captures the calling thread's active span and returns a task that runs with
     * it as the active span on the executing thread.
     */
    public Runnable propagate(Runnable task) {
        Span captured = current();
        if (captured == null) {
            return task;
        }
        return () -> {
            Deque<Span> stack = push(captured);
            try {
                task.run();
            } finally {
                remove(captured, stack);
            }
        };
    }

    /**
     * Callable variant of {@link #propagate(Runnable)}.
     */
    public <T> Callable<T> propagate(Callable<T> task) {
        Span captured = current();
        if (captured == null) {
            return task;
        }
        return () -> {
            Deque<Span> stack = push(captured);
            try {
                return task.call();
            } finally {
                remove(captured, stack);
            }
        };
    }
}
