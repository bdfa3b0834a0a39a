package com.span.tracing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Set;

/**
 * Tracing backends that can be selected by name.
 */
public enum TracingBackend {
    NULL(Set.of("null", "none", "off")),
    BUFFERED(Set.of("buffered", "sqlite", "jdbc", "persistent")),
    OPENTELEMETRY(Set.of("otel", "opentelemetry"));

    private static final Logger log = LoggerFactory.getLogger(TracingBackend.class);

    private final Set<String> aliases;

    TracingBackend(Set<String> aliases) {
        this.aliases = aliases;
    }

    public Set<String> aliases() {
        return aliases;
    }

    /**
     * Resolves a backend selector, case-insensitively. A null or blank selector
     * means {@link #NULL}; an unknown selector is logged and also resolves to
     * {@link #NULL}.
     */
    public static TracingBackend fromSelector(String selector) {
        if (selector == null || selector.isBlank()) {
            return NULL;
        }
        String normalized = selector.trim().toLowerCase(Locale.ROOT);
        for (TracingBackend backend : values()) {
            if (backend.aliases.contains(normalized)) {
                return backend;
            }
        }
        log.warn("Unknown tracing backend '{}', tracing disabled", selector);
        return NULL;
    }
}
