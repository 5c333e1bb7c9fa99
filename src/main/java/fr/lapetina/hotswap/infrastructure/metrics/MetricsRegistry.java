package fr.lapetina.hotswap.infrastructure.metrics;

import fr.lapetina.hotswap.domain.event.LifecycleEventType;
import fr.lapetina.hotswap.domain.model.ErrorType;
import fr.lapetina.hotswap.domain.model.SlotId;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Routed request counters per model and outcome
 * - Forwarding latency per model and slot
 * - Lifecycle event and promotion outcome counters
 * - Queue depth and lifecycle state gauges per model
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> routedCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> eventCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> promotionTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Boolean> modelGauges = new ConcurrentHashMap<>();

    private final AtomicInteger registeredModels = new AtomicInteger(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        Gauge.builder(prefix + "_registered_models", registeredModels, AtomicInteger::get)
                .description("Number of registered model names")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("hotswap");
    }

    /**
     * Counts a routed request by outcome (forwarded, queued, replayed, not_found).
     */
    public void incrementRouted(String model, String outcome) {
        incrementRouted(model, outcome, 1);
    }

    public void incrementRouted(String model, String outcome, int amount) {
        String key = model + ":" + outcome;
        routedCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_requests_total")
                        .description("Total number of routed requests")
                        .tag("model", model)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment(amount);
    }

    /**
     * Counts a request that failed in the controller.
     */
    public void incrementRequestError(String model, ErrorType errorType) {
        String key = model + ":" + errorType.name();
        errorCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_request_errors_total")
                        .description("Total number of request errors raised by the controller")
                        .tag("model", model)
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Records forwarding latency against a worker slot.
     */
    public void recordForwardLatency(String model, SlotId slotId, Duration latency) {
        String key = model + ":" + slotId;
        latencyTimers.computeIfAbsent(key, k ->
                Timer.builder(prefix + "_forward_latency")
                        .description("Latency of requests forwarded to workers")
                        .tag("model", model)
                        .tag("slot", slotId.name())
                        .publishPercentiles(0.5, 0.9, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Counts a lifecycle event.
     */
    public void incrementLifecycleEvent(String model, LifecycleEventType type) {
        String key = model + ":" + type.name();
        eventCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_lifecycle_events_total")
                        .description("Total number of lifecycle events")
                        .tag("model", model)
                        .tag("type", type.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Records the duration of a finished promotion attempt.
     */
    public void recordPromotion(String model, String outcome, Duration duration) {
        String key = model + ":" + outcome;
        promotionTimers.computeIfAbsent(key, k ->
                Timer.builder(prefix + "_promotion_duration")
                        .description("Duration of promotion attempts")
                        .tag("model", model)
                        .tag("outcome", outcome)
                        .register(registry)
        ).record(duration);
    }

    /**
     * Registers per-model gauges once.
     *
     * @param queueDepth supplier of the number of held requests
     * @param stateOrdinal supplier of the lifecycle state ordinal
     */
    public void registerModel(String model, Supplier<Number> queueDepth, Supplier<Number> stateOrdinal) {
        if (modelGauges.putIfAbsent(model, Boolean.TRUE) != null) {
            return;
        }
        registeredModels.incrementAndGet();
        Gauge.builder(prefix + "_queue_depth", queueDepth, s -> s.get().doubleValue())
                .description("Requests held while no slot is active")
                .tag("model", model)
                .strongReference(true)
                .register(registry);
        Gauge.builder(prefix + "_lifecycle_state", stateOrdinal, s -> s.get().doubleValue())
                .description("Lifecycle state (0=EMPTY, 1=ACTIVE_ONLY, 2=PROMOTING, 3=DRAINING, 4=FAILED)")
                .tag("model", model)
                .strongReference(true)
                .register(registry);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
