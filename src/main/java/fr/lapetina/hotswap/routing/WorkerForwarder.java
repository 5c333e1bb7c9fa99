package fr.lapetina.hotswap.routing;

import fr.lapetina.hotswap.domain.model.ErrorType;
import fr.lapetina.hotswap.domain.model.ModelRequest;
import fr.lapetina.hotswap.domain.model.ModelResponse;
import fr.lapetina.hotswap.domain.model.WorkerHandle;
import fr.lapetina.hotswap.domain.model.WorkerHealth;
import fr.lapetina.hotswap.infrastructure.http.WorkerHttpClient;
import fr.lapetina.hotswap.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Sends an admitted request to a worker slot.
 *
 * The caller must already hold an in-flight permit on the handle; it is released when
 * the worker answers or fails. A failed connection marks the slot UNHEALTHY and is
 * reported as UPSTREAM_UNAVAILABLE, never retried against the other slot.
 */
public class WorkerForwarder {

    private static final Logger log = LoggerFactory.getLogger(WorkerForwarder.class);

    private final WorkerHttpClient httpClient;
    private final MetricsRegistry metricsRegistry;

    /**
     * @param metricsRegistry may be null
     */
    public WorkerForwarder(WorkerHttpClient httpClient, MetricsRegistry metricsRegistry) {
        this.httpClient = httpClient;
        this.metricsRegistry = metricsRegistry;
    }

    public CompletableFuture<ModelResponse> forward(WorkerHandle handle, ModelRequest request) {
        Instant start = Instant.now();
        CompletableFuture<ModelResponse> result;
        try {
            result = httpClient.forward(handle, request);
        } catch (RuntimeException e) {
            handle.release();
            log.error("Forwarding failed: model={}, slot={}, requestId={}",
                    handle.getModelName(), handle.getSlotId(), request.requestId(), e);
            return CompletableFuture.completedFuture(
                    ModelResponse.error(request, ErrorType.INTERNAL_ERROR, e.getMessage()));
        }

        return result.handle((response, ex) -> {
            handle.release();
            if (ex != null) {
                log.error("Forwarding failed: model={}, slot={}, requestId={}",
                        handle.getModelName(), handle.getSlotId(), request.requestId(), ex);
                response = ModelResponse.error(request, ErrorType.INTERNAL_ERROR, ex.getMessage());
            }
            if (response.errorType() == ErrorType.UPSTREAM_UNAVAILABLE
                    && handle.getHealth() != WorkerHealth.STOPPED) {
                log.warn("Marking worker unhealthy after connection failure: model={}, slot={}",
                        handle.getModelName(), handle.getSlotId());
                handle.setHealth(WorkerHealth.UNHEALTHY);
            }
            if (metricsRegistry != null) {
                if (response.isError()) {
                    metricsRegistry.incrementRequestError(request.modelName(), response.errorType());
                } else {
                    metricsRegistry.recordForwardLatency(request.modelName(), handle.getSlotId(),
                            Duration.between(start, Instant.now()));
                }
            }
            return response;
        });
    }
}
