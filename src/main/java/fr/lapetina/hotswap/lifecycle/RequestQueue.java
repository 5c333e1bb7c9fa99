package fr.lapetina.hotswap.lifecycle;

import fr.lapetina.hotswap.domain.model.ErrorType;
import fr.lapetina.hotswap.domain.model.ModelRequest;
import fr.lapetina.hotswap.domain.model.ModelResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Per-model FIFO of requests waiting for an active slot.
 *
 * Entries leave the queue in exactly one way: drained for replay, expired after
 * {@code maxHold} (resolved with QUEUE_TIMEOUT), or cancelled by their caller.
 * Removing one entry never reorders the others.
 */
public final class RequestQueue {

    private static final Logger log = LoggerFactory.getLogger(RequestQueue.class);

    private final String modelName;
    private final ScheduledExecutorService scheduler;
    private final Duration maxHold;
    private final Deque<QueuedRequest> entries = new ArrayDeque<>();

    /**
     * @param maxHold zero or negative disables expiry
     */
    public RequestQueue(String modelName, ScheduledExecutorService scheduler, Duration maxHold) {
        this.modelName = modelName;
        this.scheduler = scheduler;
        this.maxHold = maxHold;
    }

    public String getModelName() {
        return modelName;
    }

    public QueuedRequest enqueue(ModelRequest request) {
        QueuedRequest entry = new QueuedRequest(request);
        synchronized (entries) {
            entries.addLast(entry);
        }

        if (!maxHold.isZero() && !maxHold.isNegative()) {
            entry.setExpiry(scheduler.schedule(() -> expire(entry), maxHold.toMillis(), TimeUnit.MILLISECONDS));
        }
        // Caller gave up (disconnect, timeout): drop the entry
        entry.response().whenComplete((response, ex) -> {
            if (entry.response().isCancelled()) {
                cancel(entry);
            }
        });

        log.debug("Request queued: model={}, requestId={}, depth={}", modelName, request.requestId(), depth());
        return entry;
    }

    /**
     * Removes every entry, oldest first, and stops their expiry timers.
     */
    public List<QueuedRequest> drainAll() {
        List<QueuedRequest> drained;
        synchronized (entries) {
            drained = new ArrayList<>(entries);
            entries.clear();
        }
        drained.forEach(QueuedRequest::cancelExpiry);
        if (!drained.isEmpty()) {
            log.info("Request queue drained: model={}, count={}", modelName, drained.size());
        }
        return drained;
    }

    /**
     * Removes a single entry and cancels its response if still pending.
     *
     * @return true if the entry was still queued
     */
    public boolean cancel(QueuedRequest entry) {
        boolean removed;
        synchronized (entries) {
            removed = entries.remove(entry);
        }
        if (removed) {
            entry.cancelExpiry();
            entry.response().cancel(false);
            log.debug("Queued request cancelled: model={}, requestId={}", modelName, entry.request().requestId());
        }
        return removed;
    }

    /**
     * Returns true while the given request is waiting in this queue.
     */
    public boolean isHeld(ModelRequest request) {
        synchronized (entries) {
            return entries.stream().anyMatch(entry -> entry.request() == request);
        }
    }

    public int depth() {
        synchronized (entries) {
            return entries.size();
        }
    }

    private void expire(QueuedRequest entry) {
        boolean removed;
        synchronized (entries) {
            removed = entries.remove(entry);
        }
        if (removed) {
            log.warn("Queued request expired: model={}, requestId={}, maxHoldMs={}",
                    modelName, entry.request().requestId(), maxHold.toMillis());
            entry.response().complete(ModelResponse.error(
                    entry.request(),
                    ErrorType.QUEUE_TIMEOUT,
                    "No active worker for model " + modelName + " within " + maxHold.toMillis() + " ms"
            ));
        }
    }
}
