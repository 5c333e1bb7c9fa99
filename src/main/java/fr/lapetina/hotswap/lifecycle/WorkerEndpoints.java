package fr.lapetina.hotswap.lifecycle;

import fr.lapetina.hotswap.domain.model.SlotId;
import fr.lapetina.hotswap.infrastructure.config.HotSwapConfig;
import fr.lapetina.hotswap.infrastructure.storage.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Resolves supervisor group names and worker base URLs for a model's slots.
 *
 * Models listed in the configuration use their configured URLs. Any other model gets
 * {@code http://host:(basePort + 2 * index + slot)}. The index is assigned on first
 * resolution and recorded in the artifact store, so a model keeps its ports across
 * restarts whatever order models are registered in.
 */
public final class WorkerEndpoints {

    private static final Logger log = LoggerFactory.getLogger(WorkerEndpoints.class);

    private final HotSwapConfig.WorkersConfig workers;
    private final String groupNamePattern;
    private final ArtifactStore store;
    private final Map<String, HotSwapConfig.ModelConfig> configured = new ConcurrentHashMap<>();
    private final Map<String, Integer> indexes = new ConcurrentHashMap<>();
    private final AtomicInteger nextIndex = new AtomicInteger();

    /**
     * @param store where assigned indexes are recorded; null keeps them in memory only
     */
    public WorkerEndpoints(HotSwapConfig.WorkersConfig workers, String groupNamePattern,
                           List<HotSwapConfig.ModelConfig> models, ArtifactStore store) {
        this.workers = workers;
        this.groupNamePattern = groupNamePattern;
        this.store = store;
        if (models != null) {
            for (HotSwapConfig.ModelConfig model : models) {
                configured.put(model.getName(), model);
            }
        }
        if (store != null) {
            indexes.putAll(store.endpointIndexes());
            nextIndex.set(indexes.values().stream().mapToInt(Integer::intValue).max().orElse(-1) + 1);
            if (!indexes.isEmpty()) {
                log.info("Endpoint indexes restored: {}", indexes);
            }
        }
    }

    public WorkerEndpoints(HotSwapConfig.WorkersConfig workers, String groupNamePattern,
                           List<HotSwapConfig.ModelConfig> models) {
        this(workers, groupNamePattern, models, null);
    }

    public WorkerEndpoints(HotSwapConfig config, ArtifactStore store) {
        this(config.getWorkers(), config.getSupervisor().getGroupNamePattern(), config.getModels(), store);
    }

    public String groupName(String modelName, SlotId slotId) {
        return String.format(groupNamePattern, modelName, slotId.label());
    }

    public URI baseUrl(String modelName, SlotId slotId) {
        HotSwapConfig.ModelConfig model = configured.get(modelName);
        if (model != null) {
            return URI.create(slotId == SlotId.A ? model.getSlotAUrl() : model.getSlotBUrl());
        }
        int index = indexes.computeIfAbsent(modelName, this::assignIndex);
        int port = workers.getBasePort() + 2 * index + slotId.ordinal();
        return URI.create("http://" + workers.getHost() + ":" + port);
    }

    private int assignIndex(String modelName) {
        int index = nextIndex.getAndIncrement();
        if (store != null) {
            store.saveEndpointIndex(modelName, index);
        }
        return index;
    }
}
