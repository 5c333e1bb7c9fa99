package fr.lapetina.hotswap.domain.event;

/**
 * Kinds of observable lifecycle events emitted by a model's controller.
 */
public enum LifecycleEventType {
    /** New artifact accepted, promotion starting */
    ARTIFACT_ACCEPTED,

    /** Artifact parked until the running promotion finishes */
    ARTIFACT_PENDING,

    /** Upload identical to the active or in-progress version, nothing restarted */
    ARTIFACT_UNCHANGED,

    /** Lifecycle state changed */
    STATE_CHANGED,

    /** Supervisor asked to start a slot */
    SLOT_STARTING,

    /** Slot passed its readiness probe */
    SLOT_READY,

    /** Active pointer flipped to a new slot */
    PROMOTED,

    /** Held requests replayed against the new active slot */
    QUEUE_REPLAYED,

    /** Previous slot stopped after draining */
    SLOT_STOPPED,

    /** Supervisor failed to stop a slot */
    SLOT_STOP_FAILED,

    /** Promotion attempt failed or timed out */
    PROMOTION_FAILED,

    /** Active worker found crashed or unhealthy */
    WORKER_CRASHED,

    /** Active worker restarted with its current artifact */
    WORKER_RESTARTED,

    /** Restart attempt failed */
    RESTART_FAILED
}
