package fr.lapetina.hotswap;

import fr.lapetina.hotswap.api.HttpServer;
import fr.lapetina.hotswap.infrastructure.config.HotSwapConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the model hot-swap controller.
 */
public class HotSwapApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HotSwapApplication.class);

    private final ControllerFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public HotSwapApplication(String configPath) throws Exception {
        this(ControllerFactory.create(configPath));
    }

    public HotSwapApplication(ControllerFactory factory) throws Exception {
        log.info("Starting model hot-swap controller...");

        this.factory = factory.start();

        HotSwapConfig config = factory.getConfig();
        this.httpServer = HttpServer.builder()
                .host(config.getServer().getHost())
                .port(config.getServer().getPort())
                .backlog(config.getServer().getBacklog())
                .router(factory.getRouter())
                .registry(factory.getRegistry())
                .artifactStore(factory.getArtifactStore())
                .eventBus(factory.getEventBus())
                .metricsRegistry(config.getMetrics().isEnabled() ? factory.getMetricsRegistry() : null)
                .supervisorUi(factory.getSupervisorUi())
                .defaultInferencePath(config.getWorkers().getInferencePath())
                .responseTimeout(responseTimeout(config))
                .build();

        log.info("Model hot-swap controller initialized");
    }

    /**
     * Longest a handler may wait: the queue hold bound plus one worker round trip.
     * Null when queue expiry is disabled.
     */
    static Duration responseTimeout(HotSwapConfig config) {
        long maxHoldMs = config.getQueue().getMaxHoldMs();
        if (maxHoldMs <= 0) {
            return null;
        }
        return Duration.ofMillis(maxHoldMs + config.getWorkers().getRequestTimeoutMs() + 5_000);
    }

    public void start() {
        httpServer.start();
        log.info("Model hot-swap controller started on port {}", httpServer.getPort());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public ControllerFactory getFactory() {
        return factory;
    }

    public HttpServer getHttpServer() {
        return httpServer;
    }

    @Override
    public void close() {
        log.info("Shutting down model hot-swap controller...");

        try {
            httpServer.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP server", e);
        }

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("Model hot-swap controller shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            HotSwapApplication app = new HotSwapApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start model hot-swap controller", e);
            System.exit(1);
        }
    }
}
