package com.span.tracing;

/**
 * A unit of work without a result run inside a span.
 *
 * @param <E> the exception type the work may throw
 */
@FunctionalInterface
public interface TracedRunnable<E extends Throwable> {

    void run() throws E;
}
