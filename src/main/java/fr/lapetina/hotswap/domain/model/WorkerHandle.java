package fr.lapetina.hotswap.domain.model;

import java.net.URI;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Represents one supervised worker process slot of a model.
 * Thread-safe for concurrent access from the router and the lifecycle controller.
 */
public final class WorkerHandle {
    private final String modelName;
    private final SlotId slotId;
    private final String groupName;
    private final URI baseUrl;

    // Mutable state - thread-safe
    private final AtomicReference<WorkerHealth> health;
    private final AtomicReference<ArtifactVersion> artifact = new AtomicReference<>();
    private final AtomicInteger inFlightRequests = new AtomicInteger(0);
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private volatile long lastHealthChange;
    private volatile long lastSuccessfulProbe;

    private WorkerHandle(Builder builder) {
        this.modelName = Objects.requireNonNull(builder.modelName, "Model name is required");
        this.slotId = Objects.requireNonNull(builder.slotId, "Slot ID is required");
        this.groupName = Objects.requireNonNull(builder.groupName, "Group name is required");
        this.baseUrl = Objects.requireNonNull(builder.baseUrl, "Base URL is required");
        this.health = new AtomicReference<>(builder.initialHealth);
        this.lastHealthChange = System.currentTimeMillis();
    }

    public String getModelName() {
        return modelName;
    }

    public SlotId getSlotId() {
        return slotId;
    }

    /**
     * Supervisor process group backing this slot.
     */
    public String getGroupName() {
        return groupName;
    }

    public URI getBaseUrl() {
        return baseUrl;
    }

    public WorkerHealth getHealth() {
        return health.get();
    }

    public void setHealth(WorkerHealth newHealth) {
        if (health.getAndSet(newHealth) != newHealth) {
            lastHealthChange = System.currentTimeMillis();
        }
    }

    public boolean isReady() {
        return health.get() == WorkerHealth.READY;
    }

    public ArtifactVersion getArtifact() {
        return artifact.get();
    }

    public void bindArtifact(ArtifactVersion version) {
        artifact.set(version);
    }

    public int getInFlightRequests() {
        return inFlightRequests.get();
    }

    /**
     * Attributes a request to this slot. Must be paired with {@link #release()}.
     */
    public void acquire() {
        inFlightRequests.incrementAndGet();
    }

    /**
     * Releases a request attributed to this slot.
     */
    public void release() {
        inFlightRequests.updateAndGet(current -> current > 0 ? current - 1 : 0);
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public void recordSuccess() {
        consecutiveFailures.set(0);
        lastSuccessfulProbe = System.currentTimeMillis();
    }

    public int recordFailure() {
        return consecutiveFailures.incrementAndGet();
    }

    public void resetFailures() {
        consecutiveFailures.set(0);
    }

    public long getLastHealthChange() {
        return lastHealthChange;
    }

    public long getLastSuccessfulProbe() {
        return lastSuccessfulProbe;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkerHandle that = (WorkerHandle) o;
        return modelName.equals(that.modelName) && slotId == that.slotId;
    }

    @Override
    public int hashCode() {
        return Objects.hash(modelName, slotId);
    }

    @Override
    public String toString() {
        ArtifactVersion bound = artifact.get();
        return "WorkerHandle{" +
                "model='" + modelName + '\'' +
                ", slot=" + slotId +
                ", group='" + groupName + '\'' +
                ", baseUrl=" + baseUrl +
                ", health=" + health.get() +
                ", inFlight=" + inFlightRequests.get() +
                ", artifact=" + (bound != null ? bound.label() : "none") +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String modelName;
        private SlotId slotId;
        private String groupName;
        private URI baseUrl;
        private WorkerHealth initialHealth = WorkerHealth.STOPPED;

        public Builder modelName(String modelName) {
            this.modelName = modelName;
            return this;
        }

        public Builder slotId(SlotId slotId) {
            this.slotId = slotId;
            return this;
        }

        public Builder groupName(String groupName) {
            this.groupName = groupName;
            return this;
        }

        public Builder baseUrl(String url) {
            this.baseUrl = URI.create(url);
            return this;
        }

        public Builder baseUrl(URI url) {
            this.baseUrl = url;
            return this;
        }

        public Builder initialHealth(WorkerHealth health) {
            this.initialHealth = health;
            return this;
        }

        public WorkerHandle build() {
            return new WorkerHandle(this);
        }
    }
}
