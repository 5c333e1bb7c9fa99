package fr.lapetina.hotswap.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Represents a client request addressed to a model, to be forwarded to its active worker.
 * Immutable and thread-safe.
 *
 * @param workerPath path on the worker's inference API, always starting with {@code /}
 * @param body       raw request payload, forwarded verbatim
 */
public record ModelRequest(
        String requestId,
        String modelName,
        String workerPath,
        byte[] body,
        String contentType,
        Instant createdAt,
        String correlationId
) {
    public ModelRequest {
        Objects.requireNonNull(modelName, "Model name is required");
        Objects.requireNonNull(workerPath, "Worker path is required");
        if (!workerPath.startsWith("/")) {
            workerPath = "/" + workerPath;
        }
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (correlationId == null) {
            correlationId = requestId;
        }
        if (contentType == null) {
            contentType = "application/json";
        }
        body = body != null ? body.clone() : new byte[0];
    }

    /**
     * Creates a JSON request against the given worker path.
     */
    public static ModelRequest ofJson(String modelName, String workerPath, String json) {
        return builder()
                .modelName(modelName)
                .workerPath(workerPath)
                .body(json.getBytes(java.nio.charset.StandardCharsets.UTF_8))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String requestId;
        private String modelName;
        private String workerPath = "/";
        private byte[] body;
        private String contentType;
        private Instant createdAt;
        private String correlationId;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder modelName(String modelName) {
            this.modelName = modelName;
            return this;
        }

        public Builder workerPath(String workerPath) {
            this.workerPath = workerPath;
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        public Builder contentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public ModelRequest build() {
            return new ModelRequest(requestId, modelName, workerPath, body, contentType, createdAt, correlationId);
        }
    }
}
