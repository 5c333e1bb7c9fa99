package fr.lapetina.hotswap.support;

import fr.lapetina.hotswap.domain.event.LifecycleEvent;
import fr.lapetina.hotswap.domain.event.LifecycleEventType;
import fr.lapetina.hotswap.lifecycle.LifecycleEventPublisher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps every published lifecycle event in order.
 */
public final class RecordingEventPublisher implements LifecycleEventPublisher {

    private final List<LifecycleEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void publish(LifecycleEvent event) {
        events.add(event);
    }

    public List<LifecycleEvent> events() {
        return List.copyOf(events);
    }

    public List<LifecycleEventType> types() {
        return events.stream().map(LifecycleEvent::type).toList();
    }

    public boolean contains(LifecycleEventType type) {
        return events.stream().anyMatch(event -> event.type() == type);
    }
}
