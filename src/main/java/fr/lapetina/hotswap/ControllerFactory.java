package fr.lapetina.hotswap;

import fr.lapetina.hotswap.disruptor.LifecycleEventBus;
import fr.lapetina.hotswap.domain.model.ArtifactVersion;
import fr.lapetina.hotswap.domain.model.SlotId;
import fr.lapetina.hotswap.domain.model.WorkerHandle;
import fr.lapetina.hotswap.infrastructure.config.ConfigLoader;
import fr.lapetina.hotswap.infrastructure.config.HotSwapConfig;
import fr.lapetina.hotswap.infrastructure.health.WorkerHealthChecker;
import fr.lapetina.hotswap.infrastructure.http.SupervisorUiProxy;
import fr.lapetina.hotswap.infrastructure.http.WorkerHttpClient;
import fr.lapetina.hotswap.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.hotswap.infrastructure.storage.ArtifactStore;
import fr.lapetina.hotswap.infrastructure.supervisor.SupervisorGateway;
import fr.lapetina.hotswap.infrastructure.supervisor.XmlRpcSupervisorGateway;
import fr.lapetina.hotswap.lifecycle.LifecycleController;
import fr.lapetina.hotswap.lifecycle.LifecycleSettings;
import fr.lapetina.hotswap.lifecycle.ModelEntry;
import fr.lapetina.hotswap.lifecycle.ModelRegistry;
import fr.lapetina.hotswap.lifecycle.ModelSlotPair;
import fr.lapetina.hotswap.lifecycle.RequestQueue;
import fr.lapetina.hotswap.lifecycle.WorkerEndpoints;
import fr.lapetina.hotswap.routing.RequestRouter;
import fr.lapetina.hotswap.routing.WorkerForwarder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates the fully-wired controller stack from configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (ControllerFactory factory = ControllerFactory.create("config.yaml").start()) {
 *     RequestRouter router = factory.getRouter();
 *     // use router...
 * }
 * }</pre>
 */
public class ControllerFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ControllerFactory.class);

    private final HotSwapConfig config;
    private final ArtifactStore artifactStore;
    private final MetricsRegistry metricsRegistry;
    private final LifecycleEventBus eventBus;
    private final WorkerHttpClient httpClient;
    private final SupervisorGateway gateway;
    private final SupervisorUiProxy supervisorUi;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService lifecycleExecutor;
    private final WorkerForwarder forwarder;
    private final WorkerEndpoints endpoints;
    private final LifecycleSettings settings;
    private final ModelRegistry registry;
    private final RequestRouter router;
    private final WorkerHealthChecker healthChecker;

    /**
     * @param gatewayOverride    replaces the XML-RPC supervisor gateway when not null
     * @param httpClientOverride replaces the worker HTTP client when not null
     */
    protected ControllerFactory(
            HotSwapConfig config,
            SupervisorGateway gatewayOverride,
            WorkerHttpClient httpClientOverride
    ) {
        this.config = config;
        log.info("Initializing ControllerFactory: artifactRoot={}, supervisor={}",
                config.getStorage().getArtifactRoot(), config.getSupervisor().getRpcUrl());

        this.artifactStore = new ArtifactStore(Path.of(config.getStorage().getArtifactRoot()));
        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        this.eventBus = LifecycleEventBus.builder()
                .fromConfig(config)
                .metricsRegistry(metricsRegistry)
                .build();

        this.httpClient = httpClientOverride != null ? httpClientOverride : createHttpClient();
        this.gateway = gatewayOverride != null ? gatewayOverride : createGateway();
        this.supervisorUi = new SupervisorUiProxy(
                URI.create(config.getSupervisor().getUiUrl()),
                Duration.ofMillis(config.getSupervisor().getRpcTimeoutMs())
        );

        this.scheduler = Executors.newScheduledThreadPool(2, daemonThreads("lifecycle-timer"));
        this.lifecycleExecutor = Executors.newCachedThreadPool(daemonThreads("lifecycle"));

        this.forwarder = new WorkerForwarder(httpClient, metricsRegistry);
        this.endpoints = new WorkerEndpoints(config, artifactStore);
        this.settings = LifecycleSettings.fromConfig(config.getLifecycle());
        this.registry = new ModelRegistry(this::createEntry);
        this.router = new RequestRouter(registry, forwarder, metricsRegistry);

        this.healthChecker = new WorkerHealthChecker(
                registry,
                Duration.ofMillis(config.getSupervision().getIntervalMs()),
                Duration.ofMillis(config.getWorkers().getProbeTimeoutMs())
        );

        log.info("ControllerFactory initialized");
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static ControllerFactory create(String configPath) {
        return new ControllerFactory(new ConfigLoader(configPath).load(), null, null);
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static ControllerFactory create() {
        return create("config.yaml");
    }

    /**
     * Starts the event bus, registers known models, resumes stored artifacts and
     * starts supervision.
     */
    public ControllerFactory start() {
        eventBus.start();
        bootstrap();
        if (config.getSupervision().isEnabled()) {
            healthChecker.start();
        }
        log.info("Controller started: models={}", registry.size());
        return this;
    }

    /**
     * Registers configured models, then submits the latest stored artifact of every
     * model found on disk.
     */
    void bootstrap() {
        for (HotSwapConfig.ModelConfig model : config.getModels()) {
            registry.getOrCreate(model.getName());
        }
        for (String modelName : artifactStore.listModels()) {
            Optional<ArtifactVersion> latest = artifactStore.latest(modelName);
            if (latest.isEmpty()) {
                continue;
            }
            LifecycleController.SubmitResult result = registry.getOrCreate(modelName).controller()
                    .submitArtifact(latest.get());
            log.info("Stored artifact resumed: model={}, version={}, outcome={}",
                    modelName, latest.get().label(), result);
        }
    }

    public HotSwapConfig getConfig() {
        return config;
    }

    public ArtifactStore getArtifactStore() {
        return artifactStore;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public LifecycleEventBus getEventBus() {
        return eventBus;
    }

    public WorkerHttpClient getHttpClient() {
        return httpClient;
    }

    public SupervisorGateway getGateway() {
        return gateway;
    }

    public SupervisorUiProxy getSupervisorUi() {
        return supervisorUi;
    }

    public ModelRegistry getRegistry() {
        return registry;
    }

    public RequestRouter getRouter() {
        return router;
    }

    public WorkerHealthChecker getHealthChecker() {
        return healthChecker;
    }

    private ModelEntry createEntry(String modelName) {
        WorkerHandle slotA = createHandle(modelName, SlotId.A);
        WorkerHandle slotB = createHandle(modelName, SlotId.B);
        ModelSlotPair slots = new ModelSlotPair(
                slotA, slotB, gateway, httpClient, artifactStore, settings.unhealthyThreshold());
        RequestQueue queue = new RequestQueue(
                modelName, scheduler, Duration.ofMillis(config.getQueue().getMaxHoldMs()));
        LifecycleController controller = LifecycleController.builder()
                .slots(slots)
                .queue(queue)
                .forwarder(forwarder)
                .events(eventBus)
                .settings(settings)
                .scheduler(scheduler)
                .lifecycleExecutor(lifecycleExecutor)
                .metricsRegistry(metricsRegistry)
                .build();

        metricsRegistry.registerModel(modelName, queue::depth, () -> controller.getState().ordinal());
        return new ModelEntry(modelName, slots, queue, controller);
    }

    private WorkerHandle createHandle(String modelName, SlotId slotId) {
        return WorkerHandle.builder()
                .modelName(modelName)
                .slotId(slotId)
                .groupName(endpoints.groupName(modelName, slotId))
                .baseUrl(endpoints.baseUrl(modelName, slotId))
                .build();
    }

    private WorkerHttpClient createHttpClient() {
        HotSwapConfig.WorkersConfig workers = config.getWorkers();
        return new WorkerHttpClient(
                Duration.ofMillis(workers.getConnectTimeoutMs()),
                Duration.ofMillis(workers.getRequestTimeoutMs()),
                Duration.ofMillis(workers.getProbeTimeoutMs()),
                workers.getHealthPath()
        );
    }

    private SupervisorGateway createGateway() {
        HotSwapConfig.SupervisorConfig supervisor = config.getSupervisor();
        return new XmlRpcSupervisorGateway(
                URI.create(supervisor.getRpcUrl()),
                Duration.ofMillis(supervisor.getRpcTimeoutMs()),
                supervisor.getUsername(),
                supervisor.getPassword()
        );
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }

    @Override
    public void close() {
        log.info("Shutting down ControllerFactory...");

        try {
            healthChecker.close();
        } catch (Exception e) {
            log.warn("Error closing health checker", e);
        }

        try {
            registry.close();
        } catch (Exception e) {
            log.warn("Error closing model registry", e);
        }

        scheduler.shutdownNow();
        lifecycleExecutor.shutdown();
        try {
            if (!lifecycleExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                lifecycleExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            lifecycleExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        try {
            eventBus.close();
        } catch (Exception e) {
            log.warn("Error closing event bus", e);
        }

        try {
            httpClient.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP client", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("ControllerFactory shut down");
    }
}
