package fr.lapetina.hotswap.routing;

import fr.lapetina.hotswap.domain.model.ErrorType;
import fr.lapetina.hotswap.domain.model.ModelRequest;
import fr.lapetina.hotswap.domain.model.ModelResponse;
import fr.lapetina.hotswap.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.hotswap.lifecycle.Admission;
import fr.lapetina.hotswap.lifecycle.ModelEntry;
import fr.lapetina.hotswap.lifecycle.ModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for inference traffic.
 *
 * Resolves the model, then either forwards to the active slot or parks the request
 * until a slot becomes active. The returned future completes with the worker's
 * response or an error response; it never completes exceptionally. Cancelling a
 * future whose request is still queued removes it from the queue.
 */
public final class RequestRouter {

    private static final Logger log = LoggerFactory.getLogger(RequestRouter.class);

    private final ModelRegistry registry;
    private final WorkerForwarder forwarder;
    private final MetricsRegistry metricsRegistry;

    /**
     * @param metricsRegistry may be null
     */
    public RequestRouter(ModelRegistry registry, WorkerForwarder forwarder, MetricsRegistry metricsRegistry) {
        this.registry = registry;
        this.forwarder = forwarder;
        this.metricsRegistry = metricsRegistry;
    }

    public CompletableFuture<ModelResponse> route(String modelName, ModelRequest request) {
        Optional<ModelEntry> entry = registry.find(modelName);
        if (entry.isEmpty()) {
            log.info("Unknown model: model={}, requestId={}", modelName, request.requestId());
            count(modelName, "not_found");
            return CompletableFuture.completedFuture(
                    ModelResponse.error(request, ErrorType.NOT_FOUND, "Unknown model: " + modelName));
        }

        Admission admission;
        try {
            admission = entry.get().controller().admit(request);
        } catch (IllegalStateException e) {
            log.warn("Request rejected: model={}, requestId={}, error={}", modelName, request.requestId(), e.getMessage());
            return CompletableFuture.completedFuture(
                    ModelResponse.error(request, ErrorType.CANCELLED, e.getMessage()));
        }

        if (admission.isQueued()) {
            log.info("Request held until a slot is active: model={}, requestId={}", modelName, request.requestId());
            count(modelName, "queued");
            return admission.queued().response();
        }

        log.debug("Request admitted: model={}, slot={}, requestId={}",
                modelName, admission.handle().getSlotId(), request.requestId());
        count(modelName, "forwarded");
        return forwarder.forward(admission.handle(), request);
    }

    private void count(String modelName, String outcome) {
        if (metricsRegistry != null) {
            metricsRegistry.incrementRouted(modelName, outcome);
        }
    }
}
