package fr.lapetina.hotswap.domain.event;

import fr.lapetina.hotswap.domain.model.ErrorType;
import fr.lapetina.hotswap.domain.model.LifecycleState;
import fr.lapetina.hotswap.domain.model.SlotId;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable record of one lifecycle event for a model.
 *
 * @param state     lifecycle state after the event
 * @param slotId    slot the event concerns, may be null
 * @param version   artifact version label, may be null
 * @param errorType set for failure events only
 */
public record LifecycleEvent(
        String modelName,
        LifecycleEventType type,
        LifecycleState state,
        SlotId slotId,
        String version,
        ErrorType errorType,
        String message,
        Instant timestamp
) {
    public LifecycleEvent {
        Objects.requireNonNull(modelName, "Model name is required");
        Objects.requireNonNull(type, "Event type is required");
        Objects.requireNonNull(state, "State is required");
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public boolean isFailure() {
        return errorType != null;
    }

    public static LifecycleEvent of(
            String modelName,
            LifecycleEventType type,
            LifecycleState state,
            SlotId slotId,
            String version,
            String message
    ) {
        return new LifecycleEvent(modelName, type, state, slotId, version, null, message, null);
    }

    public static LifecycleEvent failure(
            String modelName,
            LifecycleEventType type,
            LifecycleState state,
            SlotId slotId,
            String version,
            ErrorType errorType,
            String message
    ) {
        return new LifecycleEvent(modelName, type, state, slotId, version, errorType, message, null);
    }
}
