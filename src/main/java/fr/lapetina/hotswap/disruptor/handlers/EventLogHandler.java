package fr.lapetina.hotswap.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.hotswap.domain.event.LifecycleEvent;
import fr.lapetina.hotswap.domain.event.LifecycleEventHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * First stage handler: writes every lifecycle event to the log with MDC context.
 */
public final class EventLogHandler implements EventHandler<LifecycleEventHolder> {

    private static final Logger log = LoggerFactory.getLogger(EventLogHandler.class);

    @Override
    public void onEvent(LifecycleEventHolder holder, long sequence, boolean endOfBatch) {
        LifecycleEvent event = holder.getEvent();
        if (event == null) {
            return;
        }

        MDC.put("model", event.modelName());
        MDC.put("lifecycleState", event.state().name());
        try {
            if (event.isFailure()) {
                log.warn("Lifecycle event: model={}, type={}, state={}, slot={}, version={}, errorType={}, message={}",
                        event.modelName(), event.type(), event.state(), event.slotId(), event.version(),
                        event.errorType(), event.message());
            } else {
                log.info("Lifecycle event: model={}, type={}, state={}, slot={}, version={}, message={}",
                        event.modelName(), event.type(), event.state(), event.slotId(), event.version(),
                        event.message());
            }
        } finally {
            MDC.remove("model");
            MDC.remove("lifecycleState");
        }
    }
}
