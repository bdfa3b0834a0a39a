package com.span.tracing.store;

/**
 * Thrown by a {@link SpanRepository} when spans cannot be written or read.
 */
public class SpanStorageException extends RuntimeException {

    public SpanStorageException(String message) {
        super(message);
    }

    public SpanStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
