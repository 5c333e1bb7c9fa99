package fr.lapetina.hotswap.disruptor;

import fr.lapetina.hotswap.domain.event.LifecycleEvent;
import fr.lapetina.hotswap.domain.event.LifecycleEventType;
import fr.lapetina.hotswap.domain.model.ErrorType;
import fr.lapetina.hotswap.domain.model.LifecycleState;
import fr.lapetina.hotswap.domain.model.SlotId;
import fr.lapetina.hotswap.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.hotswap.support.Eventually;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LifecycleEventBusTest {

    private MetricsRegistry metrics;
    private LifecycleEventBus bus;

    @BeforeEach
    void setUp() {
        metrics = new MetricsRegistry("bustest");
        bus = LifecycleEventBus.builder()
                .ringBufferSize(64)
                .waitStrategy("sleeping")
                .historySize(5)
                .metricsRegistry(metrics)
                .build();
    }

    @AfterEach
    void tearDown() {
        bus.close();
        metrics.close();
    }

    private static LifecycleEvent event(String model, LifecycleEventType type, String message) {
        return LifecycleEvent.of(model, type, LifecycleState.PROMOTING, SlotId.A, "v1-abc", message);
    }

    @Test
    @DisplayName("should keep recent events per model in publication order")
    void shouldKeepHistoryInOrder() {
        bus.start();
        bus.publish(event("greeter", LifecycleEventType.ARTIFACT_ACCEPTED, "first"));
        bus.publish(event("other", LifecycleEventType.ARTIFACT_ACCEPTED, "elsewhere"));
        bus.publish(event("greeter", LifecycleEventType.SLOT_STARTING, "second"));

        Eventually.await(() -> bus.recentEvents("greeter").size() == 2);
        assertThat(bus.recentEvents("greeter"))
                .extracting(LifecycleEvent::message)
                .containsExactly("first", "second");
        Eventually.await(() -> bus.recentEvents("other").size() == 1);
        assertThat(bus.recentEvents("unknown")).isEmpty();
    }

    @Test
    @DisplayName("should bound the history to the configured size")
    void shouldBoundHistory() {
        bus.start();
        for (int i = 0; i < 12; i++) {
            bus.publish(event("greeter", LifecycleEventType.STATE_CHANGED, "e" + i));
        }

        Eventually.await(() -> bus.recentEvents("greeter").stream().anyMatch(e -> e.message().equals("e11")));
        assertThat(bus.recentEvents("greeter"))
                .extracting(LifecycleEvent::message)
                .containsExactly("e7", "e8", "e9", "e10", "e11");
    }

    @Test
    @DisplayName("should count events in metrics")
    void shouldCountEventsInMetrics() {
        bus.start();
        bus.publish(LifecycleEvent.failure("greeter", LifecycleEventType.PROMOTION_FAILED,
                LifecycleState.FAILED, SlotId.B, "v2-def", ErrorType.PROMOTION_TIMEOUT, "too slow"));

        Eventually.await(() -> bus.recentEvents("greeter").size() == 1);
        assertThat(metrics.scrape()).contains("bustest_lifecycle_events_total").contains("PROMOTION_FAILED");
    }

    @Test
    @DisplayName("should drop events published before start")
    void shouldDropEventsBeforeStart() {
        bus.publish(event("greeter", LifecycleEventType.ARTIFACT_ACCEPTED, "too early"));
        bus.start();

        assertThat(bus.recentEvents("greeter")).isEmpty();
        assertThat(bus.getRemainingCapacity()).isEqualTo(64);
    }

    @Test
    @DisplayName("should accept events from concurrent publishers")
    void shouldAcceptConcurrentPublishers() throws Exception {
        LifecycleEventBus wide = LifecycleEventBus.builder()
                .ringBufferSize(1024)
                .historySize(1000)
                .build();
        wide.start();
        try {
            int threads = 4;
            int perThread = 100;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch done = new CountDownLatch(threads);
            for (int t = 0; t < threads; t++) {
                executor.submit(() -> {
                    for (int i = 0; i < perThread; i++) {
                        wide.publish(event("greeter", LifecycleEventType.STATE_CHANGED, "x"));
                    }
                    done.countDown();
                });
            }
            assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
            executor.shutdown();

            Eventually.await(() -> wide.recentEvents("greeter").size() + wide.getDroppedCount() == threads * perThread);
        } finally {
            wide.close();
        }
    }

    @Test
    @DisplayName("should reject a ring buffer size that is not a power of 2")
    void shouldRejectInvalidRingBufferSize() {
        assertThatThrownBy(() -> LifecycleEventBus.builder().ringBufferSize(100))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
