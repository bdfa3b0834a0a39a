package com.span.tracing.config;

/**
 * Resolved tracing configuration. Values are supplied by the caller; this
 * library does not read environment variables or configuration files.
 *
 * @param backend               backend selector, see {@code TracingBackend}
 * @param bufferSize            number of ended spans that triggers a flush
 * @param defaultClassification classification stored with every persisted span
 * @param agentId               agent identifier recorded on every span, may be null
 * @param projectId             project identifier recorded on every span, may be null
 * @param otlpEndpoint          OTLP collector endpoint for the OpenTelemetry backend, may be null
 * @param serviceName           service name reported to OpenTelemetry
 * @param contentTracingEnabled whether content tags may record plaintext values
 * @param asyncFlush            whether automatic flushes run on a background thread
 */
public record TracingConfig(
        String backend,
        int bufferSize,
        String defaultClassification,
        String agentId,
        String projectId,
        String otlpEndpoint,
        String serviceName,
        boolean contentTracingEnabled,
        boolean asyncFlush
) {

    public static final int DEFAULT_BUFFER_SIZE = 10;
    public static final String DEFAULT_CLASSIFICATION = "CUI";
    public static final String DEFAULT_SERVICE_NAME = "span-tracing";

    public TracingConfig {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be > 0");
        }
        if (backend == null || backend.isBlank()) {
            backend = "null";
        }
        if (defaultClassification == null || defaultClassification.isBlank()) {
            defaultClassification = DEFAULT_CLASSIFICATION;
        }
        if (serviceName == null || serviceName.isBlank()) {
            serviceName = DEFAULT_SERVICE_NAME;
        }
    }

    /**
     * Default configuration: null backend, buffer of 10, {@code CUI} classification,
     * content tracing and asynchronous flushing disabled.
     */
    public static TracingConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .backend(backend)
                .bufferSize(bufferSize)
                .defaultClassification(defaultClassification)
                .agentId(agentId)
                .projectId(projectId)
                .otlpEndpoint(otlpEndpoint)
                .serviceName(serviceName)
                .contentTracingEnabled(contentTracingEnabled)
                .asyncFlush(asyncFlush);
    }

    public static class Builder {
        private String backend = "null";
        private int bufferSize = DEFAULT_BUFFER_SIZE;
        private String defaultClassification = DEFAULT_CLASSIFICATION;
        private String agentId;
        private String projectId;
        private String otlpEndpoint;
        private String serviceName = DEFAULT_SERVICE_NAME;
        private boolean contentTracingEnabled;
        private boolean asyncFlush;

        public Builder backend(String backend) {
            this.backend = backend;
            return this;
        }

        public Builder bufferSize(int bufferSize) {
            this.bufferSize = bufferSize;
            return this;
        }

        public Builder defaultClassification(String defaultClassification) {
            this.defaultClassification = defaultClassification;
            return this;
        }

        public Builder agentId(String agentId) {
            this.agentId = agentId;
            return this;
        }

        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder otlpEndpoint(String otlpEndpoint) {
            this.otlpEndpoint = otlpEndpoint;
            return this;
        }

        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        public Builder contentTracingEnabled(boolean contentTracingEnabled) {
            this.contentTracingEnabled = contentTracingEnabled;
            return this;
        }

        public Builder asyncFlush(boolean asyncFlush) {
            this.asyncFlush = asyncFlush;
            return this;
        }

        public TracingConfig build() {
            return new TracingConfig(backend, bufferSize, defaultClassification, agentId, projectId,
                    otlpEndpoint, serviceName, contentTracingEnabled, asyncFlush);
        }
    }
}
