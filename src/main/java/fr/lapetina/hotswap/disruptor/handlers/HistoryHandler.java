package fr.lapetina.hotswap.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.hotswap.domain.event.LifecycleEvent;
import fr.lapetina.hotswap.domain.event.LifecycleEventHolder;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Final stage handler: keeps a bounded history of events per model for status queries,
 * then clears the holder for reuse.
 */
public final class HistoryHandler implements EventHandler<LifecycleEventHolder> {

    private final int historySize;
    private final Map<String, Deque<LifecycleEvent>> history = new ConcurrentHashMap<>();

    public HistoryHandler(int historySize) {
        this.historySize = Math.max(1, historySize);
    }

    @Override
    public void onEvent(LifecycleEventHolder holder, long sequence, boolean endOfBatch) {
        LifecycleEvent event = holder.getEvent();
        try {
            if (event != null) {
                Deque<LifecycleEvent> events = history.computeIfAbsent(event.modelName(), k -> new ArrayDeque<>());
                synchronized (events) {
                    events.addLast(event);
                    while (events.size() > historySize) {
                        events.removeFirst();
                    }
                }
            }
        } finally {
            holder.clear();
        }
    }

    /**
     * Returns a snapshot of the recent events of a model, oldest first.
     */
    public List<LifecycleEvent> recent(String modelName) {
        Deque<LifecycleEvent> events = history.get(modelName);
        if (events == null) {
            return List.of();
        }
        synchronized (events) {
            return List.copyOf(events);
        }
    }
}
