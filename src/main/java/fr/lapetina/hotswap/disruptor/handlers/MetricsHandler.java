package fr.lapetina.hotswap.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.hotswap.domain.event.LifecycleEvent;
import fr.lapetina.hotswap.domain.event.LifecycleEventHolder;
import fr.lapetina.hotswap.infrastructure.metrics.MetricsRegistry;

/**
 * Second stage handler: counts lifecycle events per model and type.
 */
public final class MetricsHandler implements EventHandler<LifecycleEventHolder> {

    private final MetricsRegistry metricsRegistry;

    public MetricsHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(LifecycleEventHolder holder, long sequence, boolean endOfBatch) {
        LifecycleEvent event = holder.getEvent();
        if (event != null) {
            metricsRegistry.incrementLifecycleEvent(event.modelName(), event.type());
        }
    }
}
