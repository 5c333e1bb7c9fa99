package fr.lapetina.hotswap.domain.event;

import java.time.Instant;

/**
 * Event slot for the LMAX Disruptor ring buffer.
 *
 * This is a mutable holder that gets reused across the ring buffer.
 * It should never be accessed outside the event bus handlers.
 */
public final class LifecycleEventHolder {

    private LifecycleEvent event;
    private Instant publishedAt;
    private long sequence = -1;

    /**
     * Clears the holder for reuse.
     */
    public void clear() {
        this.event = null;
        this.publishedAt = null;
        this.sequence = -1;
    }

    public void initialize(LifecycleEvent event, long sequence) {
        this.event = event;
        this.sequence = sequence;
        this.publishedAt = Instant.now();
    }

    public LifecycleEvent getEvent() {
        return event;
    }

    public Instant getPublishedAt() {
        return publishedAt;
    }

    public long getSequence() {
        return sequence;
    }

    @Override
    public String toString() {
        return "LifecycleEventHolder{" +
                "sequence=" + sequence +
                ", event=" + event +
                '}';
    }
}
