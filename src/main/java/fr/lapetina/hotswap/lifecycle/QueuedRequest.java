package fr.lapetina.hotswap.lifecycle;

import fr.lapetina.hotswap.domain.model.ModelRequest;
import fr.lapetina.hotswap.domain.model.ModelResponse;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * A request parked in a {@link RequestQueue}.
 * The caller waits on {@link #response()}; cancelling that future removes the entry.
 */
public final class QueuedRequest {

    private final ModelRequest request;
    private final Instant enqueuedAt;
    private final CompletableFuture<ModelResponse> response = new CompletableFuture<>();
    private volatile ScheduledFuture<?> expiry;

    QueuedRequest(ModelRequest request) {
        this.request = request;
        this.enqueuedAt = Instant.now();
    }

    public ModelRequest request() {
        return request;
    }

    public Instant enqueuedAt() {
        return enqueuedAt;
    }

    public CompletableFuture<ModelResponse> response() {
        return response;
    }

    public boolean isDone() {
        return response.isDone();
    }

    void setExpiry(ScheduledFuture<?> expiry) {
        this.expiry = expiry;
    }

    void cancelExpiry() {
        ScheduledFuture<?> timer = expiry;
        if (timer != null) {
            timer.cancel(false);
        }
    }

    @Override
    public String toString() {
        return "QueuedRequest{" +
                "requestId='" + request.requestId() + '\'' +
                ", model='" + request.modelName() + '\'' +
                ", enqueuedAt=" + enqueuedAt +
                '}';
    }
}
