package fr.lapetina.hotswap.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.hotswap.api.dto.ModelStatusView;
import fr.lapetina.hotswap.api.dto.UploadReceipt;
import fr.lapetina.hotswap.disruptor.LifecycleEventBus;
import fr.lapetina.hotswap.domain.model.ErrorType;
import fr.lapetina.hotswap.domain.model.ModelRequest;
import fr.lapetina.hotswap.domain.model.ModelResponse;
import fr.lapetina.hotswap.infrastructure.http.SupervisorUiProxy;
import fr.lapetina.hotswap.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.hotswap.infrastructure.storage.ArtifactStore;
import fr.lapetina.hotswap.lifecycle.LifecycleController;
import fr.lapetina.hotswap.lifecycle.ModelEntry;
import fr.lapetina.hotswap.lifecycle.ModelRegistry;
import fr.lapetina.hotswap.routing.RequestRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - GET /models - List registered model names
 * - GET /model/{name} - Lifecycle status and recent events of a model
 * - POST /model/{name}[/{path}] - Forward to the active worker (held while none is active)
 * - PUT /model/{name}?filename=... - Upload a new artifact and start promoting it
 * - GET /supervisor[/...] - Pass-through to the supervisor web UI
 * - GET /health - Health check endpoint
 * - GET /metrics - Prometheus metrics endpoint
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final RequestRouter router;
    private final ModelRegistry registry;
    private final ArtifactStore artifactStore;
    private final LifecycleEventBus eventBus;
    private final MetricsRegistry metricsRegistry;
    private final SupervisorUiProxy supervisorUi;
    private final String defaultInferencePath;
    private final Duration responseTimeout;

    private HttpServer(Builder builder) throws IOException {
        this.router = builder.router;
        this.registry = builder.registry;
        this.artifactStore = builder.artifactStore;
        this.eventBus = builder.eventBus;
        this.metricsRegistry = builder.metricsRegistry;
        this.supervisorUi = builder.supervisorUi;
        this.defaultInferencePath = builder.defaultInferencePath;
        this.responseTimeout = builder.responseTimeout;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule());

        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(builder.host, builder.port), builder.backlog
        );

        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "http-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext("/models", new ModelsHandler());
        server.createContext("/model/", new ModelHandler());
        server.createContext("/supervisor", new SupervisorHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());

        log.info("HTTP server configured on {}:{}", builder.host, builder.port);
    }

    public void start() {
        server.start();
        log.info("HTTP server started");
    }

    /**
     * Actual bound port, useful when configured with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdownNow();
        log.info("HTTP server stopped");
    }

    // ==================== MODELS HANDLER ====================

    private class ModelsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            sendJson(exchange, 200, Map.of("models", registry.names()));
        }
    }

    // ==================== MODEL HANDLER ====================

    private class ModelHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String requestId = Optional.ofNullable(exchange.getRequestHeaders().getFirst("X-Request-ID"))
                    .orElse(UUID.randomUUID().toString());
            MDC.put("requestId", requestId);

            try {
                String rest = exchange.getRequestURI().getPath().substring("/model/".length());
                int slash = rest.indexOf('/');
                String modelName = slash < 0 ? rest : rest.substring(0, slash);
                String workerPath = slash < 0 ? "" : rest.substring(slash);

                if (modelName.isEmpty()) {
                    sendError(exchange, 404, "Not Found");
                    return;
                }

                switch (exchange.getRequestMethod().toUpperCase()) {
                    case "GET" -> handleStatus(exchange, modelName);
                    case "POST" -> handleInference(exchange, requestId, modelName, workerPath);
                    case "PUT" -> handleUpload(exchange, modelName);
                    default -> sendError(exchange, 405, "Method Not Allowed");
                }
            } catch (Exception e) {
                log.error("Error handling model request", e);
                sendError(exchange, 500, "Internal server error: " + e.getMessage());
            } finally {
                MDC.clear();
            }
        }

        private void handleStatus(HttpExchange exchange, String modelName) throws IOException {
            Optional<ModelEntry> entry = registry.find(modelName);
            if (entry.isEmpty()) {
                sendError(exchange, 404, "Unknown model: " + modelName);
                return;
            }
            ModelStatusView view = new ModelStatusView(
                    entry.get().controller().snapshot(),
                    eventBus.recentEvents(modelName)
            );
            sendJson(exchange, 200, view);
        }

        private void handleInference(HttpExchange exchange, String requestId, String modelName, String workerPath)
                throws IOException {
            byte[] body;
            try (InputStream is = exchange.getRequestBody()) {
                body = is.readAllBytes();
            }

            ModelRequest request = ModelRequest.builder()
                    .requestId(requestId)
                    .modelName(modelName)
                    .workerPath(workerPath.isEmpty() ? defaultInferencePath : workerPath)
                    .body(body)
                    .contentType(exchange.getRequestHeaders().getFirst("Content-Type"))
                    .correlationId(exchange.getRequestHeaders().getFirst("X-Correlation-ID"))
                    .build();

            CompletableFuture<ModelResponse> future = router.route(modelName, request);
            ModelResponse response = await(future, request);

            if (response.isError()) {
                sendError(exchange, response.statusCode(), response.errorMessage(), response.errorType());
                return;
            }
            if (response.contentType() != null) {
                exchange.getResponseHeaders().set("Content-Type", response.contentType());
            }
            sendBytes(exchange, response.statusCode(), response.body());
        }

        private ModelResponse await(CompletableFuture<ModelResponse> future, ModelRequest request) {
            try {
                return responseTimeout != null
                        ? future.get(responseTimeout.toMillis(), TimeUnit.MILLISECONDS)
                        : future.get();
            } catch (TimeoutException e) {
                boolean held = registry.find(request.modelName())
                        .map(entry -> entry.queue().isHeld(request))
                        .orElse(false);
                future.cancel(false);
                log.warn("Request timed out waiting for a response: model={}, held={}", request.modelName(), held);
                return held
                        ? ModelResponse.error(request, ErrorType.QUEUE_TIMEOUT, "Timed out waiting for an active slot")
                        : ModelResponse.error(request, ErrorType.UPSTREAM_UNAVAILABLE, "Timed out waiting for the worker response");
            } catch (InterruptedException e) {
                future.cancel(false);
                Thread.currentThread().interrupt();
                return ModelResponse.error(request, ErrorType.CANCELLED, "Request interrupted");
            } catch (ExecutionException e) {
                log.error("Routing failed: model={}", request.modelName(), e.getCause());
                return ModelResponse.error(request, ErrorType.INTERNAL_ERROR, String.valueOf(e.getCause()));
            } catch (CancellationException e) {
                return ModelResponse.error(request, ErrorType.CANCELLED, "Request cancelled");
            }
        }

        private void handleUpload(HttpExchange exchange, String modelName) throws IOException {
            if (!ArtifactStore.isValidModelName(modelName)) {
                sendError(exchange, 400, "Invalid model name: " + modelName);
                return;
            }
            byte[] content;
            try (InputStream is = exchange.getRequestBody()) {
                content = is.readAllBytes();
            }
            if (content.length == 0) {
                sendError(exchange, 400, "Empty artifact");
                return;
            }

            String fileName = queryParameters(exchange.getRequestURI().getRawQuery()).get("filename");
            ArtifactStore.StoreResult stored;
            try {
                stored = artifactStore.store(modelName, fileName, content);
            } catch (UncheckedIOException e) {
                log.error("Failed to store artifact: model={}", modelName, e);
                sendError(exchange, 500, "Failed to store artifact: " + e.getMessage());
                return;
            }

            LifecycleController controller = registry.getOrCreate(modelName).controller();
            LifecycleController.SubmitResult result = controller.submitArtifact(stored.version());
            log.info("Artifact uploaded: model={}, version={}, created={}, outcome={}",
                    modelName, stored.version().label(), stored.created(), result);

            sendJson(exchange, 202, UploadReceipt.of(stored.version(), result));
        }
    }

    // ==================== SUPERVISOR HANDLER ====================

    private class SupervisorHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            String relative = exchange.getRequestURI().getRawPath().substring("/supervisor".length());
            try {
                HttpResponse<byte[]> response = supervisorUi.get(relative, exchange.getRequestURI().getRawQuery());
                response.headers().firstValue("Content-Type")
                        .ifPresent(type -> exchange.getResponseHeaders().set("Content-Type", type));
                sendBytes(exchange, response.statusCode(), response.body());
            } catch (IOException e) {
                log.warn("Supervisor UI unreachable: error={}", e.getMessage());
                sendError(exchange, 502, "Supervisor UI unreachable: " + e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                sendError(exchange, 503, "Interrupted");
            }
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            List<ModelEntry> entries = registry.all();
            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", determineOverallHealth(entries));
            health.put("timestamp", System.currentTimeMillis());

            List<Map<String, Object>> models = new ArrayList<>();
            for (ModelEntry entry : entries) {
                Map<String, Object> info = new LinkedHashMap<>();
                info.put("name", entry.name());
                info.put("state", entry.controller().getState().name());
                info.put("active", entry.controller().currentActive().map(Enum::name).orElse(null));
                info.put("queued", entry.queue().depth());
                models.add(info);
            }
            health.put("models", models);
            health.put("eventsDropped", eventBus.getDroppedCount());

            int statusCode = "UP".equals(health.get("status")) ? 200 : 503;
            sendJson(exchange, statusCode, health);
        }

        private String determineOverallHealth(List<ModelEntry> entries) {
            boolean allActive = entries.stream()
                    .allMatch(entry -> entry.controller().currentActive().isPresent());
            return allActive ? "UP" : "DEGRADED";
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            if (metricsRegistry == null) {
                sendError(exchange, 404, "Metrics disabled");
                return;
            }

            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            sendBytes(exchange, 200, metricsRegistry.scrape().getBytes(StandardCharsets.UTF_8));
        }
    }

    // ==================== HELPER METHODS ====================

    static Map<String, String> queryParameters(String rawQuery) {
        Map<String, String> params = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            params.put(URLDecoder.decode(key, StandardCharsets.UTF_8), URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return params;
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        sendBytes(exchange, statusCode, bytes);
    }

    private void sendBytes(HttpExchange exchange, int statusCode, byte[] bytes) throws IOException {
        exchange.sendResponseHeaders(statusCode, bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        sendJson(exchange, statusCode, Map.of("error", message != null ? message : ""));
    }

    private void sendError(HttpExchange exchange, int statusCode, String message, ErrorType errorType) throws IOException {
        Map<String, String> error = new LinkedHashMap<>();
        error.put("error", message != null ? message : "");
        error.put("error_type", errorType.name());
        sendJson(exchange, statusCode, error);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for HttpServer.
     */
    public static final class Builder {
        private String host = "0.0.0.0";
        private int port = 5000;
        private int backlog = 100;
        private RequestRouter router;
        private ModelRegistry registry;
        private ArtifactStore artifactStore;
        private LifecycleEventBus eventBus;
        private MetricsRegistry metricsRegistry;
        private SupervisorUiProxy supervisorUi;
        private String defaultInferencePath = "/webhooks/rest/webhook";
        private Duration responseTimeout;

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder backlog(int backlog) {
            this.backlog = backlog;
            return this;
        }

        public Builder router(RequestRouter router) {
            this.router = router;
            return this;
        }

        public Builder registry(ModelRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder artifactStore(ArtifactStore artifactStore) {
            this.artifactStore = artifactStore;
            return this;
        }

        public Builder eventBus(LifecycleEventBus eventBus) {
            this.eventBus = eventBus;
            return this;
        }

        /**
         * Null disables the /metrics endpoint.
         */
        public Builder metricsRegistry(MetricsRegistry metricsRegistry) {
            this.metricsRegistry = metricsRegistry;
            return this;
        }

        public Builder supervisorUi(SupervisorUiProxy supervisorUi) {
            this.supervisorUi = supervisorUi;
            return this;
        }

        public Builder defaultInferencePath(String defaultInferencePath) {
            this.defaultInferencePath = defaultInferencePath;
            return this;
        }

        /**
         * Upper bound on how long a handler waits for a routed response; null waits indefinitely.
         */
        public Builder responseTimeout(Duration responseTimeout) {
            this.responseTimeout = responseTimeout;
            return this;
        }

        public HttpServer build() throws IOException {
            return new HttpServer(this);
        }
    }
}
