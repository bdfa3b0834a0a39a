package com.span.tracing.store;

/**
 * Filter for reading persisted spans. Every non-null criterion must match.
 * Results are ordered by start time, newest first, and capped at {@code limit}.
 *
 * @param traceId   only spans of this trace, or null
 * @param projectId only spans recorded for this project, or null
 * @param name      only spans with this exact name, or null
 * @param limit     maximum number of records returned
 */
public record SpanQuery(String traceId, String projectId, String name, int limit) {

    public static final int DEFAULT_LIMIT = 100;

    public SpanQuery {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
    }

    /**
     * Query matching every span, limited to {@value #DEFAULT_LIMIT} records.
     */
    public static SpanQuery all() {
        return builder().build();
    }

    public static SpanQuery byTraceId(String traceId) {
        return builder().traceId(traceId).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    boolean matches(SpanRecord record) {
        return (traceId == null || traceId.equals(record.traceId()))
                && (projectId == null || projectId.equals(record.projectId()))
                && (name == null || name.equals(record.name()));
    }

    public static class Builder {
        private String traceId;
        private String projectId;
        private String name;
        private int limit = DEFAULT_LIMIT;

        public Builder traceId(String traceId) {
            this.traceId = traceId;
            return this;
        }

        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public SpanQuery build() {
            return new SpanQuery(traceId, projectId, name, limit);
        }
    }
}
