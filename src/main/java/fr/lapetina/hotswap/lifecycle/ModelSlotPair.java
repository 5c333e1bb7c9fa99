package fr.lapetina.hotswap.lifecycle;

import fr.lapetina.hotswap.domain.model.ArtifactVersion;
import fr.lapetina.hotswap.domain.model.SlotId;
import fr.lapetina.hotswap.domain.model.WorkerHandle;
import fr.lapetina.hotswap.domain.model.WorkerHealth;
import fr.lapetina.hotswap.infrastructure.http.WorkerHttpClient;
import fr.lapetina.hotswap.infrastructure.storage.ArtifactStore;
import fr.lapetina.hotswap.infrastructure.supervisor.GatewayException;
import fr.lapetina.hotswap.infrastructure.supervisor.ProcessStatus;
import fr.lapetina.hotswap.infrastructure.supervisor.SupervisorGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * The two worker slots of a model and the pointer to the active one.
 *
 * Only {@link LifecycleController} mutates the active pointer, through {@link #promote(SlotId)}.
 * Readers see either the old or the new slot, never an intermediate value.
 */
public final class ModelSlotPair {

    private static final Logger log = LoggerFactory.getLogger(ModelSlotPair.class);

    private final String modelName;
    private final Map<SlotId, WorkerHandle> handles = new EnumMap<>(SlotId.class);
    private final SupervisorGateway gateway;
    private final WorkerHttpClient workerClient;
    private final ArtifactStore artifactStore;
    private final int unhealthyThreshold;
    private volatile SlotId active;

    /**
     * @param artifactStore may be null when workers load artifacts on their own
     */
    public ModelSlotPair(
            WorkerHandle slotA,
            WorkerHandle slotB,
            SupervisorGateway gateway,
            WorkerHttpClient workerClient,
            ArtifactStore artifactStore,
            int unhealthyThreshold
    ) {
        if (slotA.getSlotId() != SlotId.A || slotB.getSlotId() != SlotId.B) {
            throw new IllegalArgumentException("Handles must be bound to slots A and B");
        }
        if (!slotA.getModelName().equals(slotB.getModelName())) {
            throw new IllegalArgumentException("Handles belong to different models");
        }
        this.modelName = slotA.getModelName();
        this.handles.put(SlotId.A, slotA);
        this.handles.put(SlotId.B, slotB);
        this.gateway = gateway;
        this.workerClient = workerClient;
        this.artifactStore = artifactStore;
        this.unhealthyThreshold = Math.max(1, unhealthyThreshold);
    }

    public String getModelName() {
        return modelName;
    }

    public WorkerHandle handle(SlotId slotId) {
        return handles.get(slotId);
    }

    public Optional<SlotId> activeSlot() {
        return Optional.ofNullable(active);
    }

    /**
     * Returns the active handle, or null while no slot has ever been promoted.
     */
    public WorkerHandle activeHandle() {
        SlotId current = active;
        return current != null ? handles.get(current) : null;
    }

    /**
     * Slot a new artifact is started in: the one that is not active (A when none is).
     */
    public SlotId standbySlot() {
        SlotId current = active;
        return current != null ? current.other() : SlotId.A;
    }

    /**
     * Binds the artifact to the slot and starts its process group.
     * A group still running from an earlier attempt is stopped first.
     */
    public void startSlot(SlotId slotId, ArtifactVersion version) throws GatewayException {
        WorkerHandle handle = handles.get(slotId);
        handle.bindArtifact(version);
        if (artifactStore != null) {
            artifactStore.bind(slotId, version);
        }

        if (gateway.status(handle.getGroupName()) == ProcessStatus.RUNNING) {
            log.info("Slot group still running, stopping before start: model={}, slot={}, group={}",
                    modelName, slotId, handle.getGroupName());
            gateway.stop(handle.getGroupName());
        }

        handle.resetFailures();
        handle.setHealth(WorkerHealth.STARTING);
        try {
            gateway.start(handle.getGroupName());
        } catch (GatewayException e) {
            handle.setHealth(WorkerHealth.UNHEALTHY);
            throw e;
        }
        log.info("Slot started: model={}, slot={}, group={}, version={}",
                modelName, slotId, handle.getGroupName(), version.label());
    }

    /**
     * Probes the slot's worker once and updates its health.
     *
     * While STARTING a failed probe leaves the slot STARTING. Once READY, failed probes
     * count toward the unhealthy threshold. A STOPPED slot is left alone.
     */
    public CompletableFuture<WorkerHealth> pollReady(SlotId slotId) {
        WorkerHandle handle = handles.get(slotId);
        return workerClient.probe(handle)
                .exceptionally(ex -> false)
                .thenApply(healthy -> {
                    WorkerHealth current = handle.getHealth();
                    if (current == WorkerHealth.STOPPED) {
                        return current;
                    }
                    if (healthy) {
                        handle.recordSuccess();
                        if (current != WorkerHealth.READY) {
                            log.info("Worker ready: model={}, slot={}, previousHealth={}",
                                    modelName, slotId, current);
                            handle.setHealth(WorkerHealth.READY);
                        }
                    } else if (current != WorkerHealth.STARTING) {
                        int failures = handle.recordFailure();
                        if (failures >= unhealthyThreshold && current != WorkerHealth.UNHEALTHY) {
                            log.warn("Worker unhealthy: model={}, slot={}, consecutiveFailures={}",
                                    modelName, slotId, failures);
                            handle.setHealth(WorkerHealth.UNHEALTHY);
                        }
                    }
                    return handle.getHealth();
                });
    }

    public ProcessStatus status(SlotId slotId) throws GatewayException {
        return gateway.status(handles.get(slotId).getGroupName());
    }

    public void stopSlot(SlotId slotId) throws GatewayException {
        WorkerHandle handle = handles.get(slotId);
        try {
            gateway.stop(handle.getGroupName());
        } catch (GatewayException e) {
            handle.setHealth(WorkerHealth.UNHEALTHY);
            throw e;
        }
        handle.setHealth(WorkerHealth.STOPPED);
        log.info("Slot stopped: model={}, slot={}, group={}", modelName, slotId, handle.getGroupName());
    }

    /**
     * Makes the slot the active one.
     *
     * @throws IllegalStateException if the slot is not READY
     */
    public void promote(SlotId slotId) {
        WorkerHandle handle = handles.get(slotId);
        if (!handle.isReady()) {
            throw new IllegalStateException("Cannot promote slot " + slotId + " of model " + modelName
                    + " in health " + handle.getHealth());
        }
        SlotId previous = active;
        active = slotId;
        log.info("Active slot switched: model={}, previous={}, active={}", modelName, previous, slotId);
    }
}
