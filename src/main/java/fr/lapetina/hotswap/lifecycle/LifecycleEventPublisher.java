package fr.lapetina.hotswap.lifecycle;

import fr.lapetina.hotswap.domain.event.LifecycleEvent;

/**
 * Sink for lifecycle events emitted by controllers.
 * Implementations must not block the caller.
 */
@FunctionalInterface
public interface LifecycleEventPublisher {

    void publish(LifecycleEvent event);

    /**
     * Publisher that discards every event.
     */
    static LifecycleEventPublisher noop() {
        return event -> {
        };
    }
}
