package fr.lapetina.hotswap.lifecycle;

import fr.lapetina.hotswap.domain.model.ArtifactVersion;
import fr.lapetina.hotswap.domain.model.SlotId;
import fr.lapetina.hotswap.domain.model.WorkerHandle;
import fr.lapetina.hotswap.domain.model.WorkerHealth;
import fr.lapetina.hotswap.infrastructure.storage.ArtifactStore;
import fr.lapetina.hotswap.infrastructure.supervisor.GatewayException;
import fr.lapetina.hotswap.infrastructure.supervisor.ProcessStatus;
import fr.lapetina.hotswap.support.FakeSupervisorGateway;
import fr.lapetina.hotswap.support.StubWorkerClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelSlotPairTest {

    private FakeSupervisorGateway gateway;
    private StubWorkerClient client;
    private ModelSlotPair slots;
    private ArtifactVersion v1;

    @BeforeEach
    void setUp() {
        gateway = new FakeSupervisorGateway();
        client = new StubWorkerClient();
        slots = new ModelSlotPair(handle(SlotId.A), handle(SlotId.B), gateway, client, null, 2);
        v1 = new ArtifactVersion("greeter", 1, "a".repeat(64), Path.of("/tmp/greeter/v1"), null);
    }

    private static WorkerHandle handle(SlotId slotId) {
        return WorkerHandle.builder()
                .modelName("greeter")
                .slotId(slotId)
                .groupName("greeter-" + slotId.label())
                .baseUrl("http://greeter-" + slotId.label() + ".test")
                .build();
    }

    private WorkerHealth poll(SlotId slotId) {
        return slots.pollReady(slotId).join();
    }

    @Test
    @DisplayName("should reject handles bound to the wrong slots")
    void shouldRejectMismatchedHandles() {
        assertThatThrownBy(() -> new ModelSlotPair(handle(SlotId.B), handle(SlotId.A), gateway, client, null, 2))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should use slot A as standby until a slot is active")
    void shouldPickStandbySlot() {
        assertThat(slots.activeSlot()).isEmpty();
        assertThat(slots.activeHandle()).isNull();
        assertThat(slots.standbySlot()).isEqualTo(SlotId.A);
    }

    @Nested
    @DisplayName("startSlot")
    class StartSlot {

        @Test
        @DisplayName("should bind the artifact and start the group")
        void shouldStartGroup() throws Exception {
            slots.startSlot(SlotId.A, v1);

            assertThat(slots.handle(SlotId.A).getArtifact()).isEqualTo(v1);
            assertThat(slots.handle(SlotId.A).getHealth()).isEqualTo(WorkerHealth.STARTING);
            assertThat(gateway.calls()).containsExactly("start greeter-a");
        }

        @Test
        @DisplayName("should stop a group still running before starting it again")
        void shouldRestartRunningGroup() throws Exception {
            gateway.setStatus("greeter-a", ProcessStatus.RUNNING);

            slots.startSlot(SlotId.A, v1);

            assertThat(gateway.calls()).containsExactly("stop greeter-a", "start greeter-a");
        }

        @Test
        @DisplayName("should mark the slot unhealthy when the supervisor refuses to start it")
        void shouldMarkUnhealthyOnStartFailure() {
            gateway.failStartOf("greeter-a");

            assertThatThrownBy(() -> slots.startSlot(SlotId.A, v1))
                    .isInstanceOf(GatewayException.class)
                    .satisfies(e -> assertThat(((GatewayException) e).getFaultCode()).isEqualTo(50));
            assertThat(slots.handle(SlotId.A).getHealth()).isEqualTo(WorkerHealth.UNHEALTHY);
        }

        @Test
        @DisplayName("should point the slot's current artifact at the new version")
        void shouldBindInArtifactStore(@TempDir Path root) throws Exception {
            ArtifactStore store = new ArtifactStore(root);
            ArtifactVersion stored = store.store("greeter", "model.tar.gz",
                    "weights".getBytes(StandardCharsets.UTF_8)).version();
            ModelSlotPair withStore = new ModelSlotPair(handle(SlotId.A), handle(SlotId.B), gateway, client, store, 2);

            withStore.startSlot(SlotId.B, stored);

            Path current = store.slotDirectory("greeter", SlotId.B).resolve("current");
            assertThat(Files.readString(current)).isEqualTo("weights");
        }
    }

    @Nested
    @DisplayName("pollReady")
    class PollReady {

        @Test
        @DisplayName("should stay STARTING while the worker is not answering yet")
        void shouldStayStartingOnFailedProbe() throws Exception {
            slots.startSlot(SlotId.A, v1);

            assertThat(poll(SlotId.A)).isEqualTo(WorkerHealth.STARTING);
            assertThat(poll(SlotId.A)).isEqualTo(WorkerHealth.STARTING);
            assertThat(poll(SlotId.A)).isEqualTo(WorkerHealth.STARTING);
        }

        @Test
        @DisplayName("should become READY once the probe passes")
        void shouldBecomeReady() throws Exception {
            slots.startSlot(SlotId.A, v1);
            client.setHealthy("greeter-a", true);

            assertThat(poll(SlotId.A)).isEqualTo(WorkerHealth.READY);
            assertThat(slots.handle(SlotId.A).getLastSuccessfulProbe()).isPositive();
        }

        @Test
        @DisplayName("should turn UNHEALTHY only after consecutive failures reach the threshold")
        void shouldApplyUnhealthyThreshold() throws Exception {
            slots.startSlot(SlotId.A, v1);
            client.setHealthy("greeter-a", true);
            poll(SlotId.A);

            client.setHealthy("greeter-a", false);
            assertThat(poll(SlotId.A)).isEqualTo(WorkerHealth.READY);
            assertThat(poll(SlotId.A)).isEqualTo(WorkerHealth.UNHEALTHY);

            client.setHealthy("greeter-a", true);
            assertThat(poll(SlotId.A)).isEqualTo(WorkerHealth.READY);
            assertThat(slots.handle(SlotId.A).getConsecutiveFailures()).isZero();
        }

        @Test
        @DisplayName("should leave a stopped slot alone")
        void shouldIgnoreStoppedSlot() {
            client.setHealthy("greeter-b", true);

            assertThat(poll(SlotId.B)).isEqualTo(WorkerHealth.STOPPED);
        }
    }

    @Nested
    @DisplayName("promote and stop")
    class PromoteAndStop {

        @Test
        @DisplayName("should refuse to promote a slot that is not READY")
        void shouldRefuseUnreadyPromotion() throws Exception {
            slots.startSlot(SlotId.A, v1);

            assertThatThrownBy(() -> slots.promote(SlotId.A))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("STARTING");
            assertThat(slots.activeSlot()).isEmpty();
        }

        @Test
        @DisplayName("should flip the active pointer and swap the standby")
        void shouldPromoteReadySlot() throws Exception {
            slots.startSlot(SlotId.A, v1);
            client.setHealthy("greeter-a", true);
            poll(SlotId.A);

            slots.promote(SlotId.A);

            assertThat(slots.activeSlot()).contains(SlotId.A);
            assertThat(slots.activeHandle().getGroupName()).isEqualTo("greeter-a");
            assertThat(slots.standbySlot()).isEqualTo(SlotId.B);
        }

        @Test
        @DisplayName("should mark the slot STOPPED, or UNHEALTHY when the stop call fails")
        void shouldStopSlot() throws Exception {
            slots.startSlot(SlotId.A, v1);
            slots.stopSlot(SlotId.A);
            assertThat(slots.handle(SlotId.A).getHealth()).isEqualTo(WorkerHealth.STOPPED);
            assertThat(slots.status(SlotId.A)).isEqualTo(ProcessStatus.STOPPED);

            slots.startSlot(SlotId.B, v1);
            gateway.failStopOf("greeter-b");
            assertThatThrownBy(() -> slots.stopSlot(SlotId.B)).isInstanceOf(GatewayException.class);
            assertThat(slots.handle(SlotId.B).getHealth()).isEqualTo(WorkerHealth.UNHEALTHY);
        }
    }
}
