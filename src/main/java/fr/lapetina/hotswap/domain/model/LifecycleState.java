package fr.lapetina.hotswap.domain.model;

/**
 * Lifecycle state of a model name, owned by its lifecycle controller.
 */
public enum LifecycleState {
    /** No artifact has ever been promoted */
    EMPTY,

    /** Steady state: one slot active, the other stopped */
    ACTIVE_ONLY,

    /** Standby slot is starting with a new artifact */
    PROMOTING,

    /** Active pointer flipped, previous slot finishing in-flight work */
    DRAINING,

    /** Last upload attempt failed; the previous active slot (if any) keeps serving */
    FAILED
}
