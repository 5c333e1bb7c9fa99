package fr.lapetina.hotswap.lifecycle;

import fr.lapetina.hotswap.domain.event.LifecycleEvent;
import fr.lapetina.hotswap.domain.event.LifecycleEventType;
import fr.lapetina.hotswap.domain.model.ArtifactVersion;
import fr.lapetina.hotswap.domain.model.ErrorType;
import fr.lapetina.hotswap.domain.model.LifecycleState;
import fr.lapetina.hotswap.domain.model.ModelRequest;
import fr.lapetina.hotswap.domain.model.ModelResponse;
import fr.lapetina.hotswap.domain.model.SlotId;
import fr.lapetina.hotswap.domain.model.WorkerHandle;
import fr.lapetina.hotswap.domain.model.WorkerHealth;
import fr.lapetina.hotswap.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.hotswap.infrastructure.supervisor.GatewayException;
import fr.lapetina.hotswap.infrastructure.supervisor.ProcessStatus;
import fr.lapetina.hotswap.routing.WorkerForwarder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;

/**
 * Per-model lifecycle state machine driving blue/green promotion between two slots.
 *
 * <pre>
 * EMPTY ──upload──▶ PROMOTING ──ready──▶ ACTIVE_ONLY (first activation)
 * ACTIVE_ONLY ──upload──▶ PROMOTING ──ready──▶ DRAINING ──drained──▶ ACTIVE_ONLY
 * PROMOTING ──timeout/crash/gateway error──▶ FAILED (previous active keeps serving)
 * FAILED ──upload──▶ PROMOTING
 * </pre>
 *
 * All state lives behind this object's monitor. At most one promotion or restart runs
 * at a time; uploads arriving meanwhile are coalesced into a single pending artifact.
 * Blocking supervisor calls run on the lifecycle executor; readiness and drain waits are
 * tasks on the shared scheduler, so no thread is held while waiting.
 *
 * {@link #admit} and the pointer flip in promotion share the monitor: a request is
 * either counted against the active slot or parked in the queue, and the queue is
 * replayed in the same critical section that makes the new slot active.
 */
public final class LifecycleController implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LifecycleController.class);

    /**
     * Outcome of {@link #submitArtifact}.
     */
    public enum SubmitResult {
        /** A promotion to this artifact has started. */
        ACCEPTED,
        /** Another operation is running; this artifact runs next. */
        PENDING,
        /** Same content as the active or in-progress artifact; nothing to do. */
        UNCHANGED
    }

    private final String modelName;
    private final ModelSlotPair slots;
    private final RequestQueue queue;
    private final WorkerForwarder forwarder;
    private final LifecycleEventPublisher events;
    private final LifecycleSettings settings;
    private final ScheduledExecutorService scheduler;
    private final Executor lifecycleExecutor;
    private final MetricsRegistry metricsRegistry;

    // Guarded by this
    private LifecycleState state = LifecycleState.EMPTY;
    private boolean busy;
    private boolean holding;
    private boolean restartExhausted;
    private boolean closed;
    private ArtifactVersion target;
    private ArtifactVersion pending;
    private String lastError;
    private int restartAttempts;
    private Instant operationStartedAt;
    private ScheduledFuture<?> timer;

    private LifecycleController(Builder builder) {
        this.slots = Objects.requireNonNull(builder.slots, "Slot pair is required");
        this.queue = Objects.requireNonNull(builder.queue, "Request queue is required");
        this.forwarder = Objects.requireNonNull(builder.forwarder, "Forwarder is required");
        this.scheduler = Objects.requireNonNull(builder.scheduler, "Scheduler is required");
        this.lifecycleExecutor = Objects.requireNonNull(builder.lifecycleExecutor, "Lifecycle executor is required");
        this.events = builder.events != null ? builder.events : LifecycleEventPublisher.noop();
        this.settings = builder.settings != null ? builder.settings : LifecycleSettings.defaults();
        this.metricsRegistry = builder.metricsRegistry;
        this.modelName = slots.getModelName();
    }

    public String getModelName() {
        return modelName;
    }

    /**
     * Starts promoting an artifact, or records it as pending. Never waits for the promotion.
     */
    public SubmitResult submitArtifact(ArtifactVersion version) {
        if (!modelName.equals(version.modelName())) {
            throw new IllegalArgumentException("Artifact " + version.label() + " belongs to model "
                    + version.modelName() + ", not " + modelName);
        }

        SlotId standby;
        synchronized (this) {
            if (closed) {
                throw new IllegalStateException("Lifecycle controller closed: " + modelName);
            }
            if (busy) {
                if ((target != null && target.sameContentAs(version))
                        || (pending != null && pending.sameContentAs(version))) {
                    return unchanged(version);
                }
                ArtifactVersion replaced = pending;
                pending = version;
                emit(LifecycleEventType.ARTIFACT_PENDING, null, version,
                        replaced != null ? "Replaces pending " + replaced.label() : "Queued behind current operation");
                log.info("Artifact pending: model={}, version={}, replaced={}",
                        modelName, version.label(), replaced != null ? replaced.label() : null);
                return SubmitResult.PENDING;
            }
            if (isActiveContent(version)) {
                return unchanged(version);
            }
            standby = beginPromotion(version);
        }

        dispatch(() -> startStandby(standby, version));
        return SubmitResult.ACCEPTED;
    }

    /**
     * Slot requests are routed to, empty until a first promotion succeeds.
     */
    public Optional<SlotId> currentActive() {
        return slots.activeSlot();
    }

    /**
     * Takes an in-flight permit on the active slot, or parks the request when no slot
     * is active or a restart holds traffic.
     *
     * @throws IllegalStateException if the controller is closed
     */
    public synchronized Admission admit(ModelRequest request) {
        if (closed) {
            throw new IllegalStateException("Lifecycle controller closed: " + modelName);
        }
        WorkerHandle active = slots.activeHandle();
        if (active != null && !holding) {
            active.acquire();
            return Admission.forward(active);
        }
        return Admission.queued(queue.enqueue(request));
    }

    /**
     * Restarts the active slot in place after its process went down.
     * Requests arriving meanwhile are held and replayed once it is ready again.
     *
     * @return false if another operation is running or there is nothing to restart
     */
    public boolean restartActive() {
        SlotId slot;
        ArtifactVersion version;
        synchronized (this) {
            WorkerHandle active = slots.activeHandle();
            if (closed || busy || restartExhausted || active == null || active.getArtifact() == null) {
                return false;
            }
            slot = active.getSlotId();
            version = active.getArtifact();
            busy = true;
            holding = true;
            restartAttempts = 0;
            target = version;
            operationStartedAt = Instant.now();
            emitFailure(LifecycleEventType.WORKER_CRASHED, slot, version, ErrorType.UPSTREAM_UNAVAILABLE,
                    "Active worker down, restarting");
        }

        log.warn("Active worker down, restarting: model={}, slot={}, version={}", modelName, slot, version.label());
        dispatch(() -> attemptRestart(slot, version));
        return true;
    }

    public synchronized LifecycleState getState() {
        return state;
    }

    /**
     * True while a promotion or restart is in progress.
     */
    public synchronized boolean isBusy() {
        return busy;
    }

    public synchronized boolean isHolding() {
        return holding;
    }

    public ModelSlotPair getSlots() {
        return slots;
    }

    public int queueDepth() {
        return queue.depth();
    }

    public synchronized ModelStatus snapshot() {
        List<ModelStatus.SlotStatus> slotStatuses = new ArrayList<>();
        for (SlotId slotId : SlotId.values()) {
            WorkerHandle handle = slots.handle(slotId);
            slotStatuses.add(new ModelStatus.SlotStatus(
                    slotId,
                    handle.getGroupName(),
                    handle.getBaseUrl().toString(),
                    handle.getHealth(),
                    handle.getInFlightRequests(),
                    label(handle.getArtifact())
            ));
        }
        WorkerHandle active = slots.activeHandle();
        return new ModelStatus(
                modelName,
                state,
                active != null ? active.getSlotId() : null,
                active != null ? label(active.getArtifact()) : null,
                label(target),
                label(pending),
                List.copyOf(slotStatuses),
                queue.depth(),
                restartAttempts,
                holding,
                lastError
        );
    }

    @Override
    public void close() {
        List<QueuedRequest> abandoned;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            if (timer != null) {
                timer.cancel(false);
            }
            abandoned = queue.drainAll();
        }
        for (QueuedRequest entry : abandoned) {
            entry.response().complete(ModelResponse.error(entry.request(), ErrorType.CANCELLED, "Service shutting down"));
        }
        log.info("Lifecycle controller closed: model={}, abandonedRequests={}", modelName, abandoned.size());
    }

    // ---- promotion ----

    // Caller holds the monitor
    private SlotId beginPromotion(ArtifactVersion version) {
        SlotId standby = slots.standbySlot();
        busy = true;
        target = version;
        operationStartedAt = Instant.now();
        emit(LifecycleEventType.ARTIFACT_ACCEPTED, standby, version, "Promotion requested");
        transition(LifecycleState.PROMOTING, standby, version);
        log.info("Promotion started: model={}, version={}, standby={}, active={}",
                modelName, version.label(), standby, slots.activeSlot().orElse(null));
        return standby;
    }

    private void startStandby(SlotId slot, ArtifactVersion version) {
        try {
            slots.startSlot(slot, version);
        } catch (GatewayException | RuntimeException e) {
            failPromotion(slot, version, ErrorType.PROMOTION_FAILED,
                    "Failed to start slot " + slot + ": " + e.getMessage(), e);
            return;
        }

        synchronized (this) {
            emit(LifecycleEventType.SLOT_STARTING, slot, version, "Waiting for readiness");
        }
        long deadline = System.nanoTime() + settings.readinessTimeout().toNanos();
        checkReadiness(slot, deadline,
                () -> completePromotion(slot, version),
                (type, message) -> failPromotion(slot, version, type, message, null));
    }

    private void completePromotion(SlotId slot, ArtifactVersion version) {
        SlotId previous;
        boolean promoted = false;
        synchronized (this) {
            if (closed) {
                return;
            }
            previous = slots.activeSlot().orElse(null);
            if (slots.handle(slot).isReady()) {
                slots.promote(slot);
                promoted = true;
                target = null;
                lastError = null;
                restartExhausted = false;
                emit(LifecycleEventType.SLOT_READY, slot, version, "Worker reported ready");
                emit(LifecycleEventType.PROMOTED, slot, version,
                        previous != null ? "Replaces slot " + previous : "First activation");
                replayQueue(slots.handle(slot));
                transition(previous != null ? LifecycleState.DRAINING : LifecycleState.ACTIVE_ONLY, slot, version);
            }
        }

        if (!promoted) {
            failPromotion(slot, version, ErrorType.PROMOTION_FAILED, "Slot " + slot + " lost readiness before promotion", null);
            return;
        }

        recordPromotion("success");
        log.info("Promotion complete: model={}, version={}, active={}, previous={}",
                modelName, version.label(), slot, previous);

        if (previous == null) {
            finishOperation();
        } else {
            long deadline = System.nanoTime() + settings.drainTimeout().toNanos();
            checkDrain(previous, deadline);
        }
    }

    private void failPromotion(SlotId slot, ArtifactVersion version, ErrorType errorType, String message, Throwable cause) {
        if (cause != null) {
            log.error("Promotion failed: model={}, version={}, slot={}, errorType={}, message={}",
                    modelName, version.label(), slot, errorType, message, cause);
        } else {
            log.error("Promotion failed: model={}, version={}, slot={}, errorType={}, message={}",
                    modelName, version.label(), slot, errorType, message);
        }

        try {
            slots.stopSlot(slot);
        } catch (GatewayException e) {
            log.warn("Failed to stop standby after failed promotion: model={}, slot={}, error={}",
                    modelName, slot, e.getMessage());
        }

        synchronized (this) {
            target = null;
            lastError = message;
            transition(LifecycleState.FAILED, slot, version);
            emitFailure(LifecycleEventType.PROMOTION_FAILED, slot, version, errorType, message);
        }
        recordPromotion(errorType == ErrorType.PROMOTION_TIMEOUT ? "timeout" : "failure");
        finishOperation();
    }

    private void checkDrain(SlotId previous, long deadline) {
        if (isClosed()) {
            return;
        }
        int inFlight = slots.handle(previous).getInFlightRequests();
        if (inFlight > 0 && System.nanoTime() - deadline < 0) {
            schedule(() -> checkDrain(previous, deadline), settings.drainPollInterval());
            return;
        }
        if (inFlight > 0) {
            log.warn("Drain timed out, stopping slot with requests in flight: model={}, slot={}, inFlight={}",
                    modelName, previous, inFlight);
        }
        dispatch(() -> stopDrained(previous));
    }

    private void stopDrained(SlotId previous) {
        WorkerHandle handle = slots.handle(previous);
        try {
            slots.stopSlot(previous);
            synchronized (this) {
                emit(LifecycleEventType.SLOT_STOPPED, previous, handle.getArtifact(), "Drained");
            }
        } catch (GatewayException e) {
            log.warn("Failed to stop drained slot: model={}, slot={}, group={}, error={}",
                    modelName, previous, handle.getGroupName(), e.getMessage());
            synchronized (this) {
                emitFailure(LifecycleEventType.SLOT_STOP_FAILED, previous, handle.getArtifact(),
                        ErrorType.GATEWAY_ERROR, e.getMessage());
            }
        }

        synchronized (this) {
            WorkerHandle active = slots.activeHandle();
            transition(LifecycleState.ACTIVE_ONLY, active.getSlotId(), active.getArtifact());
        }
        finishOperation();
    }

    // ---- restart ----

    private void attemptRestart(SlotId slot, ArtifactVersion version) {
        int attempt;
        synchronized (this) {
            if (closed) {
                return;
            }
            attempt = ++restartAttempts;
        }
        log.info("Restarting worker: model={}, slot={}, attempt={}/{}",
                modelName, slot, attempt, settings.maxRestartAttempts());

        try {
            slots.startSlot(slot, version);
        } catch (GatewayException | RuntimeException e) {
            restartFailed(slot, version, "Failed to restart slot " + slot + ": " + e.getMessage());
            return;
        }

        long deadline = System.nanoTime() + settings.readinessTimeout().toNanos();
        checkReadiness(slot, deadline,
                () -> restartSucceeded(slot, version),
                (type, message) -> restartFailed(slot, version, message));
    }

    private void restartSucceeded(SlotId slot, ArtifactVersion version) {
        synchronized (this) {
            if (closed) {
                return;
            }
            holding = false;
            target = null;
            lastError = null;
            emit(LifecycleEventType.WORKER_RESTARTED, slot, version, "Restarted after " + restartAttempts + " attempt(s)");
            replayQueue(slots.handle(slot));
            transition(LifecycleState.ACTIVE_ONLY, slot, version);
        }
        log.info("Worker restarted: model={}, slot={}, version={}", modelName, slot, version.label());
        finishOperation();
    }

    private void restartFailed(SlotId slot, ArtifactVersion version, String message) {
        int attempts;
        synchronized (this) {
            attempts = restartAttempts;
            if (closed) {
                return;
            }
        }
        if (attempts < settings.maxRestartAttempts()) {
            log.warn("Restart attempt failed: model={}, slot={}, attempt={}, message={}",
                    modelName, slot, attempts, message);
            attemptRestart(slot, version);
            return;
        }

        List<QueuedRequest> abandoned;
        synchronized (this) {
            holding = false;
            restartExhausted = true;
            target = null;
            lastError = message;
            abandoned = queue.drainAll();
            transition(LifecycleState.FAILED, slot, version);
            emitFailure(LifecycleEventType.RESTART_FAILED, slot, version, ErrorType.UPSTREAM_UNAVAILABLE,
                    "Gave up after " + attempts + " attempt(s): " + message);
        }
        log.error("Worker restart failed: model={}, slot={}, attempts={}, abandonedRequests={}, message={}",
                modelName, slot, attempts, abandoned.size(), message);
        for (QueuedRequest entry : abandoned) {
            entry.response().complete(ModelResponse.error(entry.request(), ErrorType.UPSTREAM_UNAVAILABLE,
                    "Worker for model " + modelName + " could not be restarted"));
        }
        finishOperation();
    }

    // ---- shared steps ----

    /**
     * Polls supervisor status and worker health until READY, a crash, or the deadline.
     */
    private void checkReadiness(
            SlotId slot,
            long deadline,
            Runnable onReady,
            BiConsumer<ErrorType, String> onFailure
    ) {
        if (isClosed()) {
            return;
        }

        ProcessStatus status;
        try {
            status = slots.status(slot);
        } catch (GatewayException e) {
            onFailure.accept(ErrorType.PROMOTION_FAILED, "Supervisor status query failed: " + e.getMessage());
            return;
        }
        if (status == ProcessStatus.FATAL || status == ProcessStatus.STOPPED) {
            onFailure.accept(ErrorType.PROMOTION_FAILED,
                    "Worker process " + status + " before becoming ready (group " + slots.handle(slot).getGroupName() + ")");
            return;
        }

        slots.pollReady(slot).whenComplete((health, ex) -> {
            if (health == WorkerHealth.READY) {
                dispatch(onReady);
            } else if (System.nanoTime() - deadline >= 0) {
                dispatch(() -> onFailure.accept(ErrorType.PROMOTION_TIMEOUT,
                        "Slot " + slot + " not ready within " + settings.readinessTimeout().toMillis() + " ms"));
            } else {
                schedule(() -> dispatch(() -> checkReadiness(slot, deadline, onReady, onFailure)),
                        settings.probeInterval());
            }
        });
    }

    // Caller holds the monitor
    private void replayQueue(WorkerHandle handle) {
        List<QueuedRequest> drained = queue.drainAll();
        int replayed = 0;
        for (QueuedRequest entry : drained) {
            if (entry.isDone()) {
                continue;
            }
            handle.acquire();
            forwarder.forward(handle, entry.request()).thenAccept(response -> entry.response().complete(response));
            replayed++;
        }
        if (replayed > 0) {
            if (metricsRegistry != null) {
                metricsRegistry.incrementRouted(modelName, "replayed", replayed);
            }
            emit(LifecycleEventType.QUEUE_REPLAYED, handle.getSlotId(), handle.getArtifact(),
                    replayed + " held request(s) replayed");
        }
    }

    private void finishOperation() {
        SlotId standby;
        ArtifactVersion next;
        synchronized (this) {
            busy = false;
            target = null;
            operationStartedAt = null;
            next = pending;
            pending = null;
            if (next == null || closed) {
                return;
            }
            if (isActiveContent(next)) {
                unchanged(next);
                return;
            }
            standby = beginPromotion(next);
        }
        dispatch(() -> startStandby(standby, next));
    }

    // Caller holds the monitor
    private boolean isActiveContent(ArtifactVersion version) {
        WorkerHandle active = slots.activeHandle();
        return active != null
                && !restartExhausted
                && active.getArtifact() != null
                && active.getArtifact().sameContentAs(version);
    }

    // Caller holds the monitor
    private SubmitResult unchanged(ArtifactVersion version) {
        log.info("Artifact unchanged, no promotion: model={}, version={}", modelName, version.label());
        emit(LifecycleEventType.ARTIFACT_UNCHANGED, null, version, "Content matches active or in-progress artifact");
        return SubmitResult.UNCHANGED;
    }

    // Caller holds the monitor
    private void transition(LifecycleState next, SlotId slot, ArtifactVersion version) {
        LifecycleState previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        log.info("Lifecycle transition: model={}, from={}, to={}, slot={}, version={}",
                modelName, previous, next, slot, label(version));
        emit(LifecycleEventType.STATE_CHANGED, slot, version, previous + " -> " + next);
    }

    private void emit(LifecycleEventType type, SlotId slot, ArtifactVersion version, String message) {
        events.publish(LifecycleEvent.of(modelName, type, state, slot, label(version), message));
    }

    private void emitFailure(
            LifecycleEventType type,
            SlotId slot,
            ArtifactVersion version,
            ErrorType errorType,
            String message
    ) {
        events.publish(LifecycleEvent.failure(modelName, type, state, slot, label(version), errorType, message));
    }

    private void recordPromotion(String outcome) {
        Instant startedAt;
        synchronized (this) {
            startedAt = operationStartedAt;
        }
        if (metricsRegistry != null && startedAt != null) {
            metricsRegistry.recordPromotion(modelName, outcome, Duration.between(startedAt, Instant.now()));
        }
    }

    private synchronized boolean isClosed() {
        return closed;
    }

    private void dispatch(Runnable task) {
        try {
            lifecycleExecutor.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("Lifecycle task failed: model={}", modelName, e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Lifecycle task rejected: model={}, error={}", modelName, e.getMessage());
        }
    }

    private void schedule(Runnable task, Duration delay) {
        synchronized (this) {
            if (closed) {
                return;
            }
            try {
                timer = scheduler.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.warn("Lifecycle timer rejected: model={}, error={}", modelName, e.getMessage());
            }
        }
    }

    private static String label(ArtifactVersion version) {
        return version != null ? version.label() : null;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for LifecycleController.
     */
    public static final class Builder {
        private ModelSlotPair slots;
        private RequestQueue queue;
        private WorkerForwarder forwarder;
        private LifecycleEventPublisher events;
        private LifecycleSettings settings;
        private ScheduledExecutorService scheduler;
        private Executor lifecycleExecutor;
        private MetricsRegistry metricsRegistry;

        public Builder slots(ModelSlotPair slots) {
            this.slots = slots;
            return this;
        }

        public Builder queue(RequestQueue queue) {
            this.queue = queue;
            return this;
        }

        public Builder forwarder(WorkerForwarder forwarder) {
            this.forwarder = forwarder;
            return this;
        }

        public Builder events(LifecycleEventPublisher events) {
            this.events = events;
            return this;
        }

        public Builder settings(LifecycleSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        /**
         * Executor for blocking supervisor calls.
         */
        public Builder lifecycleExecutor(Executor lifecycleExecutor) {
            this.lifecycleExecutor = lifecycleExecutor;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry metricsRegistry) {
            this.metricsRegistry = metricsRegistry;
            return this;
        }

        public LifecycleController build() {
            return new LifecycleController(this);
        }
    }
}
