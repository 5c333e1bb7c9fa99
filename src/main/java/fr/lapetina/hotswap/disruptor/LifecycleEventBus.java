package fr.lapetina.hotswap.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.hotswap.disruptor.handlers.EventLogHandler;
import fr.lapetina.hotswap.disruptor.handlers.HistoryHandler;
import fr.lapetina.hotswap.disruptor.handlers.MetricsHandler;
import fr.lapetina.hotswap.domain.event.LifecycleEvent;
import fr.lapetina.hotswap.domain.event.LifecycleEventHolder;
import fr.lapetina.hotswap.domain.event.LifecycleEventHolderFactory;
import fr.lapetina.hotswap.infrastructure.config.HotSwapConfig;
import fr.lapetina.hotswap.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.hotswap.lifecycle.LifecycleEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Disruptor-backed bus carrying lifecycle events from controllers to observers.
 *
 * <p>Controllers publish from many threads (HTTP handlers, lifecycle executor,
 * scheduler), hence a MULTI producer ring. Handlers run in sequence:
 * log, then metrics, then history. Publishing never blocks: if the ring is full
 * the event is dropped and counted.
 */
public final class LifecycleEventBus implements LifecycleEventPublisher, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LifecycleEventBus.class);

    private final Disruptor<LifecycleEventHolder> disruptor;
    private final RingBuffer<LifecycleEventHolder> ringBuffer;
    private final HistoryHandler historyHandler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong dropped = new AtomicLong();

    private LifecycleEventBus(Builder builder) {
        this.disruptor = new Disruptor<>(
                new LifecycleEventHolderFactory(),
                builder.ringBufferSize,
                new BusThreadFactory("lifecycle-events"),
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );

        this.historyHandler = new HistoryHandler(builder.historySize);
        if (builder.metricsRegistry != null) {
            disruptor.handleEventsWith(new EventLogHandler())
                    .then(new MetricsHandler(builder.metricsRegistry))
                    .then(historyHandler);
        } else {
            disruptor.handleEventsWith(new EventLogHandler())
                    .then(historyHandler);
        }
        disruptor.setDefaultExceptionHandler(new BusExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("LifecycleEventBus created: ringBufferSize={}, waitStrategy={}, historySize={}",
                builder.ringBufferSize, builder.waitStrategy, builder.historySize);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("LifecycleEventBus started");
        }
    }

    @Override
    public void publish(LifecycleEvent event) {
        if (!running.get()) {
            log.debug("Event bus not running, dropping event: {}", event);
            return;
        }

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            long total = dropped.incrementAndGet();
            log.warn("Lifecycle event dropped, ring buffer full: model={}, type={}, droppedTotal={}",
                    event.modelName(), event.type(), total);
            return;
        }

        try {
            ringBuffer.get(sequence).initialize(event, sequence);
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    /**
     * Returns the most recent events of a model, oldest first.
     */
    public List<LifecycleEvent> recentEvents(String modelName) {
        return historyHandler.recent(modelName);
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            try {
                disruptor.shutdown(5, TimeUnit.SECONDS);
                log.info("LifecycleEventBus shut down");
            } catch (TimeoutException e) {
                log.warn("LifecycleEventBus shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    private static class BusThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        BusThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    private static class BusExceptionHandler implements ExceptionHandler<LifecycleEventHolder> {

        @Override
        public void handleEventException(Throwable ex, long sequence, LifecycleEventHolder holder) {
            log.error("Exception in lifecycle event handler: sequence={}, holder={}", sequence, holder, ex);
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during event bus start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during event bus shutdown", ex);
        }
    }

    /**
     * Builder for LifecycleEventBus.
     */
    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private int historySize = 50;
        private MetricsRegistry metricsRegistry;

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder historySize(int historySize) {
            this.historySize = historySize;
            return this;
        }

        /**
         * Optional; without it the metrics stage is skipped.
         */
        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder fromConfig(HotSwapConfig config) {
            ringBufferSize(config.getEvents().getRingBufferSize());
            this.waitStrategy = config.getEvents().getWaitStrategy();
            this.historySize = config.getEvents().getHistorySize();
            return this;
        }

        public LifecycleEventBus build() {
            return new LifecycleEventBus(this);
        }
    }
}
