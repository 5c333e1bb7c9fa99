package fr.lapetina.hotswap.lifecycle;

import fr.lapetina.hotswap.domain.model.SlotId;
import fr.lapetina.hotswap.infrastructure.config.HotSwapConfig;
import fr.lapetina.hotswap.infrastructure.storage.ArtifactStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WorkerEndpointsTest {

    @TempDir
    Path root;

    private HotSwapConfig.WorkersConfig workers;
    private HotSwapConfig.ModelConfig pinned;
    private WorkerEndpoints endpoints;

    @BeforeEach
    void setUp() {
        workers = new HotSwapConfig.WorkersConfig();
        workers.setHost("10.0.0.5");
        workers.setBasePort(6000);

        pinned = new HotSwapConfig.ModelConfig();
        pinned.setName("pinned");
        pinned.setSlotAUrl("http://worker-1:8080");
        pinned.setSlotBUrl("http://worker-2:8080");

        endpoints = new WorkerEndpoints(workers, "rasa-%s-%s", List.of(pinned));
    }

    private WorkerEndpoints persistent(ArtifactStore store) {
        return new WorkerEndpoints(workers, "rasa-%s-%s", List.of(pinned), store);
    }

    @Test
    @DisplayName("should derive group names from the pattern")
    void shouldFormatGroupNames() {
        assertThat(endpoints.groupName("greeter", SlotId.A)).isEqualTo("rasa-greeter-a");
        assertThat(endpoints.groupName("greeter", SlotId.B)).isEqualTo("rasa-greeter-b");
    }

    @Test
    @DisplayName("should use configured URLs for listed models")
    void shouldUseConfiguredUrls() {
        assertThat(endpoints.baseUrl("pinned", SlotId.A).toString()).isEqualTo("http://worker-1:8080");
        assertThat(endpoints.baseUrl("pinned", SlotId.B).toString()).isEqualTo("http://worker-2:8080");
    }

    @Test
    @DisplayName("should give each other model its own pair of ports")
    void shouldAllocatePortPairs() {
        assertThat(endpoints.baseUrl("first", SlotId.A).toString()).isEqualTo("http://10.0.0.5:6000");
        assertThat(endpoints.baseUrl("first", SlotId.B).toString()).isEqualTo("http://10.0.0.5:6001");
        assertThat(endpoints.baseUrl("second", SlotId.A).toString()).isEqualTo("http://10.0.0.5:6002");
        assertThat(endpoints.baseUrl("second", SlotId.B).toString()).isEqualTo("http://10.0.0.5:6003");
        assertThat(endpoints.baseUrl("first", SlotId.B).getPort()).isEqualTo(6001);
    }

    @Test
    @DisplayName("should keep each model's ports when resolved in a different order after a restart")
    void shouldKeepPortsAcrossRestarts() {
        ArtifactStore store = new ArtifactStore(root);
        WorkerEndpoints before = persistent(store);
        assertThat(before.baseUrl("zeta", SlotId.A).getPort()).isEqualTo(6000);
        assertThat(before.baseUrl("alpha", SlotId.A).getPort()).isEqualTo(6002);

        WorkerEndpoints after = persistent(new ArtifactStore(root));

        assertThat(after.baseUrl("alpha", SlotId.A).getPort()).isEqualTo(6002);
        assertThat(after.baseUrl("zeta", SlotId.B).getPort()).isEqualTo(6001);
        assertThat(store.endpointIndex("zeta")).contains(0);
        assertThat(store.endpointIndex("alpha")).contains(1);
    }

    @Test
    @DisplayName("should give a new model ports after every recorded pair")
    void shouldNotReuseRecordedIndexes() {
        ArtifactStore store = new ArtifactStore(root);
        store.saveEndpointIndex("old", 4);

        WorkerEndpoints restored = persistent(store);

        assertThat(restored.baseUrl("fresh", SlotId.A).getPort()).isEqualTo(6010);
        assertThat(restored.baseUrl("old", SlotId.A).getPort()).isEqualTo(6008);
    }

    @Test
    @DisplayName("should not record an index for models with configured URLs")
    void shouldNotRecordConfiguredModels() {
        ArtifactStore store = new ArtifactStore(root);

        persistent(store).baseUrl("pinned", SlotId.A);

        assertThat(store.endpointIndex("pinned")).isEmpty();
    }
}
