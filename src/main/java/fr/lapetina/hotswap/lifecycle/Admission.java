package fr.lapetina.hotswap.lifecycle;

import fr.lapetina.hotswap.domain.model.WorkerHandle;

/**
 * Result of {@link LifecycleController#admit}: either a handle to forward to (its in-flight
 * permit already taken) or the queue entry the request was parked in.
 */
public record Admission(WorkerHandle handle, QueuedRequest queued) {

    public static Admission forward(WorkerHandle handle) {
        return new Admission(handle, null);
    }

    public static Admission queued(QueuedRequest queued) {
        return new Admission(null, queued);
    }

    public boolean isQueued() {
        return queued != null;
    }
}
