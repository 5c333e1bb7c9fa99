package fr.lapetina.hotswap.domain.model;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Objects;

/**
 * Represents the outcome of a routed request.
 * Worker responses (including worker-reported error statuses) are carried verbatim;
 * {@code errorType} is only set when the controller itself produced the failure.
 */
public record ModelResponse(
        String requestId,
        String modelName,
        int statusCode,
        byte[] body,
        String contentType,
        SlotId slotId,
        Instant completedAt,
        ErrorType errorType,
        String errorMessage
) {
    public ModelResponse {
        Objects.requireNonNull(requestId, "Request ID is required");
        if (completedAt == null) {
            completedAt = Instant.now();
        }
        body = body != null ? body : new byte[0];
    }

    public boolean isError() {
        return errorType != null;
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    /**
     * Wraps a worker's HTTP response.
     */
    public static ModelResponse fromWorker(
            ModelRequest request,
            SlotId slotId,
            int statusCode,
            byte[] body,
            String contentType
    ) {
        return new ModelResponse(
                request.requestId(), request.modelName(), statusCode, body, contentType,
                slotId, Instant.now(), null, null
        );
    }

    /**
     * Creates a controller-side error response; the HTTP status follows the error type.
     */
    public static ModelResponse error(ModelRequest request, ErrorType errorType, String errorMessage) {
        return error(request.requestId(), request.modelName(), errorType, errorMessage);
    }

    public static ModelResponse error(String requestId, String modelName, ErrorType errorType, String errorMessage) {
        return new ModelResponse(
                requestId, modelName, errorType.httpStatus(), null, null,
                null, Instant.now(), errorType, errorMessage
        );
    }
}
