package fr.lapetina.hotswap.support;

import fr.lapetina.hotswap.domain.model.ErrorType;
import fr.lapetina.hotswap.domain.model.ModelRequest;
import fr.lapetina.hotswap.domain.model.ModelResponse;
import fr.lapetina.hotswap.domain.model.WorkerHandle;
import fr.lapetina.hotswap.infrastructure.http.WorkerHttpClient;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stub worker client keyed by supervisor group name.
 *
 * Probes answer from a health table (unhealthy by default). Forwarded requests are
 * answered with {@code "<group>:<body>"}, unless the group is unreachable or its
 * responses are held until {@link #releaseHeld()}.
 */
public final class StubWorkerClient extends WorkerHttpClient {

    private final Set<String> healthy = ConcurrentHashMap.newKeySet();
    private final Set<String> unreachable = ConcurrentHashMap.newKeySet();
    private final Set<String> holding = ConcurrentHashMap.newKeySet();
    private final List<Runnable> held = new ArrayList<>();
    private final List<Forwarded> forwarded = new ArrayList<>();

    public record Forwarded(String groupName, ModelRequest request) {
    }

    @Override
    public CompletableFuture<ModelResponse> forward(WorkerHandle handle, ModelRequest request) {
        String group = handle.getGroupName();
        synchronized (forwarded) {
            forwarded.add(new Forwarded(group, request));
        }
        if (unreachable.contains(group)) {
            return CompletableFuture.completedFuture(ModelResponse.error(
                    request, ErrorType.UPSTREAM_UNAVAILABLE, "Connection refused: " + group));
        }

        byte[] body = (group + ":" + new String(request.body(), StandardCharsets.UTF_8))
                .getBytes(StandardCharsets.UTF_8);
        ModelResponse response = ModelResponse.fromWorker(request, handle.getSlotId(), 200, body, "text/plain");
        if (holding.contains(group)) {
            CompletableFuture<ModelResponse> future = new CompletableFuture<>();
            synchronized (held) {
                held.add(() -> future.complete(response));
            }
            return future;
        }
        return CompletableFuture.completedFuture(response);
    }

    @Override
    public CompletableFuture<Boolean> probe(WorkerHandle handle) {
        return CompletableFuture.completedFuture(healthy.contains(handle.getGroupName()));
    }

    public void setHealthy(String groupName, boolean isHealthy) {
        if (isHealthy) {
            healthy.add(groupName);
        } else {
            healthy.remove(groupName);
        }
    }

    public void setUnreachable(String groupName, boolean isUnreachable) {
        if (isUnreachable) {
            unreachable.add(groupName);
        } else {
            unreachable.remove(groupName);
        }
    }

    /**
     * Responses of this group stay pending until {@link #releaseHeld()}.
     */
    public void holdResponses(String groupName) {
        holding.add(groupName);
    }

    public void releaseHeld() {
        List<Runnable> toRelease;
        synchronized (held) {
            toRelease = new ArrayList<>(held);
            held.clear();
        }
        holding.clear();
        toRelease.forEach(Runnable::run);
    }

    public List<Forwarded> forwarded() {
        synchronized (forwarded) {
            return List.copyOf(forwarded);
        }
    }
}
