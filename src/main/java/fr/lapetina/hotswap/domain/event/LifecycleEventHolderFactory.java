package fr.lapetina.hotswap.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Factory for pre-allocating LifecycleEventHolder instances in the Disruptor ring buffer.
 */
public final class LifecycleEventHolderFactory implements EventFactory<LifecycleEventHolder> {

    @Override
    public LifecycleEventHolder newInstance() {
        return new LifecycleEventHolder();
    }
}
