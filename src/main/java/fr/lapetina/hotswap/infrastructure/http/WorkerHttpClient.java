package fr.lapetina.hotswap.infrastructure.http;

import fr.lapetina.hotswap.domain.model.ErrorType;
import fr.lapetina.hotswap.domain.model.ModelRequest;
import fr.lapetina.hotswap.domain.model.ModelResponse;
import fr.lapetina.hotswap.domain.model.WorkerHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * HTTP client for communicating with worker processes.
 *
 * Uses java.net.http.HttpClient for non-blocking I/O.
 * Worker responses are returned verbatim, whatever their status code;
 * only transport failures become controller errors.
 */
public class WorkerHttpClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerHttpClient.class);

    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final Duration probeTimeout;
    private final String healthPath;

    public WorkerHttpClient(
            Duration connectTimeout,
            Duration requestTimeout,
            Duration probeTimeout,
            String healthPath
    ) {
        this.requestTimeout = requestTimeout;
        this.probeTimeout = probeTimeout;
        this.healthPath = healthPath.startsWith("/") ? healthPath : "/" + healthPath;

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    public WorkerHttpClient() {
        this(Duration.ofSeconds(5), Duration.ofSeconds(60), Duration.ofSeconds(2), "/");
    }

    /**
     * Forwards a request to the given worker.
     *
     * @param handle  Target worker slot
     * @param request Request to forward
     * @return CompletableFuture with the worker's response, or an UPSTREAM_UNAVAILABLE
     *         error response if the worker could not be reached; never completes exceptionally
     */
    public CompletableFuture<ModelResponse> forward(WorkerHandle handle, ModelRequest request) {
        HttpRequest httpRequest;
        try {
            httpRequest = HttpRequest.newBuilder()
                    .uri(resolve(handle.getBaseUrl(), request.workerPath()))
                    .timeout(requestTimeout)
                    .header("Content-Type", request.contentType())
                    .header("X-Request-ID", request.requestId())
                    .header("X-Correlation-ID", request.correlationId())
                    .POST(HttpRequest.BodyPublishers.ofByteArray(request.body()))
                    .build();
        } catch (IllegalArgumentException e) {
            log.error("Failed to build request: model={}, slot={}, requestId={}",
                    handle.getModelName(), handle.getSlotId(), request.requestId(), e);
            return CompletableFuture.completedFuture(
                    ModelResponse.error(request, ErrorType.INTERNAL_ERROR, "Failed to build request: " + e.getMessage()));
        }

        Instant startTime = Instant.now();
        log.info("Forwarding request: model={}, slot={}, requestId={}, uri={}",
                handle.getModelName(), handle.getSlotId(), request.requestId(), httpRequest.uri());

        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofByteArray())
                .thenApply(response -> handleResponse(handle, request, response, startTime))
                .exceptionally(ex -> handleException(handle, request, ex));
    }

    private ModelResponse handleResponse(
            WorkerHandle handle,
            ModelRequest request,
            HttpResponse<byte[]> response,
            Instant startTime
    ) {
        long latencyMs = Duration.between(startTime, Instant.now()).toMillis();
        int statusCode = response.statusCode();
        if (statusCode >= 200 && statusCode < 300) {
            log.info("Worker responded: model={}, slot={}, requestId={}, status={}, latencyMs={}",
                    handle.getModelName(), handle.getSlotId(), request.requestId(), statusCode, latencyMs);
        } else {
            log.warn("Worker responded with error status: model={}, slot={}, requestId={}, status={}, latencyMs={}",
                    handle.getModelName(), handle.getSlotId(), request.requestId(), statusCode, latencyMs);
        }
        String contentType = response.headers().firstValue("Content-Type").orElse(null);
        return ModelResponse.fromWorker(request, handle.getSlotId(), statusCode, response.body(), contentType);
    }

    private ModelResponse handleException(WorkerHandle handle, ModelRequest request, Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof IOException) {
            log.error("Worker connection error: model={}, slot={}, requestId={}, errorType={}, error={}",
                    handle.getModelName(), handle.getSlotId(), request.requestId(),
                    cause.getClass().getSimpleName(), cause.getMessage());
            return ModelResponse.error(request, ErrorType.UPSTREAM_UNAVAILABLE,
                    "Worker " + handle.getGroupName() + " unavailable: " + cause.getMessage());
        }
        log.error("Forwarding failed unexpectedly: model={}, slot={}, requestId={}",
                handle.getModelName(), handle.getSlotId(), request.requestId(), cause);
        return ModelResponse.error(request, ErrorType.INTERNAL_ERROR, cause.getMessage());
    }

    /**
     * Performs a lightweight health probe against a worker.
     *
     * @return true if the health endpoint answered 2xx; never completes exceptionally
     */
    public CompletableFuture<Boolean> probe(WorkerHandle handle) {
        URI uri = resolve(handle.getBaseUrl(), healthPath);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(probeTimeout)
                .GET()
                .build();

        log.debug("Health probe started: model={}, slot={}, uri={}", handle.getModelName(), handle.getSlotId(), uri);

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .thenApply(response -> {
                    boolean healthy = response.statusCode() >= 200 && response.statusCode() < 300;
                    if (healthy) {
                        log.debug("Health probe passed: model={}, slot={}", handle.getModelName(), handle.getSlotId());
                    } else {
                        log.debug("Health probe failed: model={}, slot={}, status={}",
                                handle.getModelName(), handle.getSlotId(), response.statusCode());
                    }
                    return healthy;
                })
                .exceptionally(ex -> {
                    log.debug("Health probe error: model={}, slot={}, error={}",
                            handle.getModelName(), handle.getSlotId(), ex.getMessage());
                    return false;
                });
    }

    static URI resolve(URI baseUrl, String path) {
        String base = baseUrl.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + (path.startsWith("/") ? path : "/" + path));
    }

    @Override
    public void close() {
        // HttpClient has no close() before Java 21
    }
}
