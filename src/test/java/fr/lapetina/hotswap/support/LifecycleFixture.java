package fr.lapetina.hotswap.support;

import fr.lapetina.hotswap.domain.model.ArtifactVersion;
import fr.lapetina.hotswap.domain.model.SlotId;
import fr.lapetina.hotswap.domain.model.WorkerHandle;
import fr.lapetina.hotswap.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.hotswap.lifecycle.LifecycleController;
import fr.lapetina.hotswap.lifecycle.LifecycleSettings;
import fr.lapetina.hotswap.lifecycle.ModelEntry;
import fr.lapetina.hotswap.lifecycle.ModelSlotPair;
import fr.lapetina.hotswap.lifecycle.RequestQueue;
import fr.lapetina.hotswap.routing.WorkerForwarder;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * One model wired with a fake supervisor and a stub worker client, with fast timings.
 * Group names are {@code <model>-a} and {@code <model>-b}.
 */
public final class LifecycleFixture implements AutoCloseable {

    public static final LifecycleSettings FAST = new LifecycleSettings(
            Duration.ofMillis(500),
            Duration.ofMillis(10),
            2,
            Duration.ofMillis(500),
            Duration.ofMillis(5),
            2
    );

    public final String model;
    public final FakeSupervisorGateway gateway;
    public final StubWorkerClient client;
    public final RecordingEventPublisher events = new RecordingEventPublisher();
    public final ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(2);
    public final ExecutorService executor = Executors.newCachedThreadPool();
    public final MetricsRegistry metrics = new MetricsRegistry("fixture");
    public final WorkerForwarder forwarder;
    public final ModelSlotPair slots;
    public final RequestQueue queue;
    public final LifecycleController controller;

    public LifecycleFixture(String model) {
        this(model, FAST, Duration.ofSeconds(5), new FakeSupervisorGateway(), new StubWorkerClient());
    }

    public LifecycleFixture(
            String model,
            LifecycleSettings settings,
            Duration maxHold,
            FakeSupervisorGateway gateway,
            StubWorkerClient client
    ) {
        this.model = model;
        this.gateway = gateway;
        this.client = client;
        this.forwarder = new WorkerForwarder(client, null);
        this.slots = new ModelSlotPair(handle(model, SlotId.A), handle(model, SlotId.B),
                gateway, client, null, settings.unhealthyThreshold());
        this.queue = new RequestQueue(model, scheduler, maxHold);
        this.controller = LifecycleController.builder()
                .slots(slots)
                .queue(queue)
                .forwarder(forwarder)
                .events(events)
                .settings(settings)
                .scheduler(scheduler)
                .lifecycleExecutor(executor)
                .metricsRegistry(metrics)
                .build();
    }

    public String group(SlotId slotId) {
        return model + "-" + slotId.label();
    }

    public ModelEntry entry() {
        return new ModelEntry(model, slots, queue, controller);
    }

    /**
     * An artifact whose hash is derived from the given content tag.
     */
    public ArtifactVersion artifact(long version, String content) {
        return new ArtifactVersion(model, version, sha256(content), Path.of("/tmp", model, "v" + version), null);
    }

    public static String sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    private static WorkerHandle handle(String model, SlotId slotId) {
        return WorkerHandle.builder()
                .modelName(model)
                .slotId(slotId)
                .groupName(model + "-" + slotId.label())
                .baseUrl("http://" + model + "-" + slotId.label() + ".test")
                .build();
    }

    @Override
    public void close() {
        controller.close();
        scheduler.shutdownNow();
        executor.shutdownNow();
        metrics.close();
    }
}
