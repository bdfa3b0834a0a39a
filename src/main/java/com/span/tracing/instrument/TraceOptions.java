package com.span.tracing.instrument;

import com.span.tracing.SpanKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options for a traced call.
 *
 * @param name         span name, or null to name the span after the calling method
 * @param kind         span kind
 * @param attributes   static attributes set on every span
 * @param recordArgs   whether to record a fingerprint of the arguments
 * @param recordResult whether to record a fingerprint of the result
 */
public record TraceOptions(
        String name,
        SpanKind kind,
        Map<String, Object> attributes,
        boolean recordArgs,
        boolean recordResult
) {

    public TraceOptions {
        if (name != null && name.isBlank()) {
            name = null;
        }
        kind = kind != null ? kind : SpanKind.INTERNAL;
        attributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                : Map.of();
    }

    public static TraceOptions defaults() {
        return builder().build();
    }

    public static TraceOptions named(String name) {
        return builder().name(name).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private SpanKind kind = SpanKind.INTERNAL;
        private final Map<String, Object> attributes = new LinkedHashMap<>();
        private boolean recordArgs;
        private boolean recordResult;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder kind(SpanKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder attribute(String key, Object value) {
            this.attributes.put(key, value);
            return this;
        }

        public Builder attributes(Map<String, ?> attributes) {
            this.attributes.putAll(attributes);
            return this;
        }

        public Builder recordArgs(boolean recordArgs) {
            this.recordArgs = recordArgs;
            return this;
        }

        public Builder recordResult(boolean recordResult) {
            this.recordResult = recordResult;
            return this;
        }

        public TraceOptions build() {
            return new TraceOptions(name, kind, attributes, recordArgs, recordResult);
        }
    }
}
