package com.span.tracing.store;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Fixed-width ISO-8601 UTC timestamps with microsecond precision, so that the
 * lexical order of stored strings equals chronological order.
 */
public final class SpanTimestamps {

    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'").withZone(ZoneOffset.UTC);

    private SpanTimestamps() {
        // Utility class
    }

    public static String format(Instant instant) {
        return instant != null ? FORMAT.format(instant) : null;
    }

    public static Instant parse(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        return Instant.parse(value);
    }
}
