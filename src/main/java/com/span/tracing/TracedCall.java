package com.span.tracing;

/**
 * A unit of work run inside a span. The type parameter {@code E} lets checked
 * exceptions pass through a tracing wrapper unchanged.
 *
 * @param <T> the result type
 * @param <E> the exception type the work may throw
 */
@FunctionalInterface
public interface TracedCall<T, E extends Throwable> {

    T call() throws E;
}
