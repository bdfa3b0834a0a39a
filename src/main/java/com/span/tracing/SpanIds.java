package com.span.tracing;

import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Generates trace and span identifiers in the W3C trace-context format:
 * 32 lowercase hex characters for a trace, 16 for a span.
 */
public final class SpanIds {

    public static final int TRACE_ID_LENGTH = 32;
    public static final int SPAN_ID_LENGTH = 16;

    private SpanIds() {
        // Utility class
    }

    public static String newTraceId() {
        UUID uuid = UUID.randomUUID();
        return toHex(uuid.getMostSignificantBits()) + toHex(uuid.getLeastSignificantBits());
    }

    public static String newSpanId() {
        long id;
        do {
            id = ThreadLocalRandom.current().nextLong();
        } while (id == 0L);
        return toHex(id);
    }

    private static String toHex(long value) {
        String hex = Long.toHexString(value);
        if (hex.length() == SPAN_ID_LENGTH) {
            return hex;
        }
        return "0".repeat(SPAN_ID_LENGTH - hex.length()) + hex;
    }
}
