package com.span.tracing.instrument;

import com.span.tracing.Span;
import com.span.tracing.StatusCode;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Iterator whose whole iteration is covered by one span.
 *
 * <p>Exhausting the iterator records {@code generator.item_count} and ends the span
 * with {@link StatusCode#OK}. An exception thrown by the underlying iterator ends
 * the span with {@link StatusCode#ERROR} and is rethrown. Closing the iterator
 * early records the count and ends the span without a status. The span is ended
 * exactly once in every case.</p>
 */
public class TracedIterator<T> implements Iterator<T>, AutoCloseable {

    private final Span span;
    private final Iterator<T> delegate;
    private final Runnable onClose;
    private long count;
    private boolean finished;

    TracedIterator(Span span, Iterator<T> delegate, Runnable onClose) {
        this.span = span;
        this.delegate = delegate;
        this.onClose = onClose;
    }

    @Override
    public boolean hasNext() {
        if (finished) {
            return false;
        }
        boolean hasNext;
        try {
            hasNext = delegate.hasNext();
        } catch (Throwable t) {
            fail(t);
            throw t;
        }
        if (!hasNext) {
            complete();
        }
        return hasNext;
    }

    @Override
    public T next() {
        if (finished) {
            throw new NoSuchElementException();
        }
        try {
            T item = delegate.next();
            count++;
            return item;
        } catch (NoSuchElementException e) {
            complete();
            throw e;
        } catch (Throwable t) {
            fail(t);
            throw t;
        }
    }

    /**
     * @return the number of items produced so far
     */
    public long count() {
        return count;
    }

    public Span span() {
        return span;
    }

    @Override
    public void close() {
        if (!finished) {
            finished = true;
            span.setAttribute(Instrumentation.ITEM_COUNT, count);
            span.end();
        }
        if (onClose != null) {
            onClose.run();
        }
    }

    private void complete() {
        if (finished) {
            return;
        }
        finished = true;
        span.setAttribute(Instrumentation.ITEM_COUNT, count);
        span.setStatus(StatusCode.OK);
        span.end();
    }

    private void fail(Throwable t) {
        if (finished) {
            return;
        }
        finished = true;
        span.setAttribute(Instrumentation.ITEM_COUNT, count);
        span.recordException(t);
        span.end();
    }
}
