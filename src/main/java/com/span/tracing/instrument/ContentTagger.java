package com.span.tracing.instrument;

import com.span.tracing.Span;
import com.span.tracing.config.TracingConfig;

/**
 * Records content such as prompts or documents on a span.
 * The SHA-256 of the value is always recorded under {@code key + "_hash"}; the
 * plaintext is recorded under {@code key} only when content tracing is enabled.
 */
public class ContentTagger {

    public static final String HASH_SUFFIX = "_hash";

    private final boolean contentTracingEnabled;

    public ContentTagger(boolean contentTracingEnabled) {
        this.contentTracingEnabled = contentTracingEnabled;
    }

    /**
     * @return a tagger that records plaintext only if {@code config.contentTracingEnabled()}
     */
    public static ContentTagger from(TracingConfig config) {
        return new ContentTagger(config != null && config.contentTracingEnabled());
    }

    public boolean isContentTracingEnabled() {
        return contentTracingEnabled;
    }

    public void setContentTag(Span span, String key, String value) {
        if (span == null || key == null || value == null) {
            return;
        }
        span.setAttribute(key + HASH_SUFFIX, Fingerprints.sha256Hex(value));
        if (contentTracingEnabled) {
            span.setAttribute(key, value);
        }
    }
}
