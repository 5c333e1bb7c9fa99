package fr.lapetina.hotswap;

import fr.lapetina.hotswap.infrastructure.config.HotSwapConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class HotSwapApplicationTest {

    @Test
    @DisplayName("should bound the response wait by hold time plus one worker round trip")
    void shouldComputeResponseTimeout() {
        HotSwapConfig config = new HotSwapConfig();
        config.getQueue().setMaxHoldMs(3_000);
        config.getWorkers().setRequestTimeoutMs(2_000);

        assertThat(HotSwapApplication.responseTimeout(config)).isEqualTo(Duration.ofMillis(10_000));
    }

    @Test
    @DisplayName("should wait indefinitely when queue expiry is disabled")
    void shouldDisableResponseTimeout() {
        HotSwapConfig config = new HotSwapConfig();
        config.getQueue().setMaxHoldMs(0);

        assertThat(HotSwapApplication.responseTimeout(config)).isNull();
    }
}
