package fr.lapetina.hotswap.infrastructure.health;

import fr.lapetina.hotswap.domain.model.SlotId;
import fr.lapetina.hotswap.domain.model.WorkerHealth;
import fr.lapetina.hotswap.infrastructure.supervisor.GatewayException;
import fr.lapetina.hotswap.infrastructure.supervisor.ProcessStatus;
import fr.lapetina.hotswap.lifecycle.LifecycleController;
import fr.lapetina.hotswap.lifecycle.ModelEntry;
import fr.lapetina.hotswap.lifecycle.ModelRegistry;
import fr.lapetina.hotswap.lifecycle.ModelSlotPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background supervision of active workers.
 *
 * Periodically probes each model's active slot and asks the supervisor whether its
 * process group is still running. A crashed group or an UNHEALTHY worker triggers an
 * in-place restart through the model's controller. Models with a promotion or restart
 * in progress are skipped.
 */
public final class WorkerHealthChecker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerHealthChecker.class);

    private final ModelRegistry registry;
    private final ScheduledExecutorService scheduler;
    private final Duration checkInterval;
    private final Duration probeTimeout;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public WorkerHealthChecker(ModelRegistry registry, Duration checkInterval, Duration probeTimeout) {
        this.registry = registry;
        this.checkInterval = checkInterval;
        this.probeTimeout = probeTimeout;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "worker-health-checker");
            t.setDaemon(true);
            return t;
        });
    }

    public WorkerHealthChecker(ModelRegistry registry) {
        this(registry, Duration.ofSeconds(5), Duration.ofSeconds(5));
    }

    /**
     * Starts the periodic checks.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(
                    this::checkAllModels,
                    checkInterval.toMillis(),
                    checkInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Worker health checker started with interval: {}", checkInterval);
        }
    }

    /**
     * Checks every registered model once.
     */
    public void checkAllModels() {
        for (ModelEntry entry : registry.all()) {
            try {
                checkModel(entry);
            } catch (RuntimeException e) {
                log.error("Health check failed unexpectedly: model={}", entry.name(), e);
            }
        }
    }

    /**
     * Checks a single model's active worker.
     *
     * @return true if a restart was triggered
     */
    public boolean checkModel(ModelEntry entry) {
        LifecycleController controller = entry.controller();
        ModelSlotPair slots = entry.slots();
        Optional<SlotId> active = slots.activeSlot();
        if (active.isEmpty() || controller.isBusy()) {
            return false;
        }
        SlotId slot = active.get();

        WorkerHealth health = probe(slots, slot);

        ProcessStatus status;
        try {
            status = slots.status(slot);
        } catch (GatewayException e) {
            // Supervisor unreachable says nothing about the worker itself
            log.warn("Supervisor status unavailable: model={}, slot={}, error={}", entry.name(), slot, e.getMessage());
            status = ProcessStatus.UNKNOWN;
        }

        log.debug("Health check: model={}, slot={}, health={}, processStatus={}", entry.name(), slot, health, status);

        boolean crashed = status == ProcessStatus.FATAL || status == ProcessStatus.STOPPED;
        if (crashed || health == WorkerHealth.UNHEALTHY) {
            log.warn("Active worker down: model={}, slot={}, health={}, processStatus={}",
                    entry.name(), slot, health, status);
            return controller.restartActive();
        }
        return false;
    }

    private WorkerHealth probe(ModelSlotPair slots, SlotId slot) {
        try {
            return slots.pollReady(slot).get(probeTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return slots.handle(slot).getHealth();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Health probe did not complete: model={}, slot={}, error={}",
                    slots.getModelName(), slot, e.toString());
            return slots.handle(slot).getHealth();
        }
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Worker health checker stopped");
        } else {
            scheduler.shutdownNow();
        }
    }
}
