package com.span.tracing;

/**
 * The role a span plays in the operation it describes.
 */
public enum SpanKind {
    INTERNAL,
    CLIENT,
    SERVER,
    PRODUCER,
    CONSUMER;

    /**
     * Parses a kind name case-insensitively, falling back to {@link #INTERNAL}
     * for null or unknown values.
     */
    public static SpanKind fromString(String value) {
        if (value == null || value.isBlank()) {
            return INTERNAL;
        }
        try {
            return valueOf(value.trim().toUpperCase(java.util.Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return INTERNAL;
        }
    }
}
