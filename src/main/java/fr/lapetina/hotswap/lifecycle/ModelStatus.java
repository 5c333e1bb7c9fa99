package fr.lapetina.hotswap.lifecycle;

import fr.lapetina.hotswap.domain.model.LifecycleState;
import fr.lapetina.hotswap.domain.model.SlotId;
import fr.lapetina.hotswap.domain.model.WorkerHealth;

import java.util.List;

/**
 * Point-in-time view of a model's lifecycle, taken under the controller lock.
 *
 * @param targetVersion  version being promoted or restarted, null when idle
 * @param pendingVersion newest upload waiting for the current operation to finish
 * @param holding        true while new requests are held for a restart
 */
public record ModelStatus(
        String modelName,
        LifecycleState state,
        SlotId activeSlot,
        String activeVersion,
        String targetVersion,
        String pendingVersion,
        List<SlotStatus> slots,
        int queueDepth,
        int restartAttempts,
        boolean holding,
        String lastError
) {

    public record SlotStatus(
            SlotId slotId,
            String groupName,
            String baseUrl,
            WorkerHealth health,
            int inFlightRequests,
            String version
    ) {
    }
}
