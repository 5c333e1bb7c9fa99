package fr.lapetina.hotswap.lifecycle;

import fr.lapetina.hotswap.infrastructure.config.HotSwapConfig;

import java.time.Duration;

/**
 * Timing bounds applied by every {@link LifecycleController}.
 */
public record LifecycleSettings(
        Duration readinessTimeout,
        Duration probeInterval,
        int unhealthyThreshold,
        Duration drainTimeout,
        Duration drainPollInterval,
        int maxRestartAttempts
) {
    public static LifecycleSettings fromConfig(HotSwapConfig.LifecycleConfig config) {
        return new LifecycleSettings(
                Duration.ofMillis(config.getReadinessTimeoutMs()),
                Duration.ofMillis(config.getProbeIntervalMs()),
                config.getUnhealthyThreshold(),
                Duration.ofMillis(config.getDrainTimeoutMs()),
                Duration.ofMillis(config.getDrainPollIntervalMs()),
                config.getMaxRestartAttempts()
        );
    }

    public static LifecycleSettings defaults() {
        return fromConfig(new HotSwapConfig.LifecycleConfig());
    }
}
