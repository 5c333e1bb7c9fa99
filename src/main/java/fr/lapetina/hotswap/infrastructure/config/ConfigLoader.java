package fr.lapetina.hotswap.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Configuration loader.
 *
 * Supports:
 * - Loading from file system, falling back to the classpath
 * - Validation of the bounds the lifecycle controller relies on
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final AtomicReference<HotSwapConfig> currentConfig = new AtomicReference<>();
    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(HotSwapConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public HotSwapConfig load() {
        HotSwapConfig config = validate(loadFromPath());
        currentConfig.set(config);
        return config;
    }

    private HotSwapConfig loadFromPath() {
        // Try file system first
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        // Try classpath
        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private HotSwapConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public HotSwapConfig loadFromStream(InputStream inputStream) {
        HotSwapConfig config = validate(parse(inputStream, "stream"));
        currentConfig.set(config);
        return config;
    }

    private HotSwapConfig parse(InputStream is, String source) {
        try {
            HotSwapConfig config = yaml.load(is);
            // An empty document yields null
            return config != null ? config : createDefault();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Returns the current configuration.
     */
    public HotSwapConfig getCurrentConfig() {
        return currentConfig.get();
    }

    static HotSwapConfig validate(HotSwapConfig config) {
        HotSwapConfig.LifecycleConfig lifecycle = config.getLifecycle();
        if (lifecycle.getReadinessTimeoutMs() <= 0) {
            throw new ConfigurationException("lifecycle.readinessTimeoutMs must be positive");
        }
        if (lifecycle.getProbeIntervalMs() <= 0 || lifecycle.getDrainPollIntervalMs() <= 0) {
            throw new ConfigurationException("lifecycle poll intervals must be positive");
        }
        if (lifecycle.getUnhealthyThreshold() < 1) {
            throw new ConfigurationException("lifecycle.unhealthyThreshold must be at least 1");
        }
        if (lifecycle.getMaxRestartAttempts() < 1) {
            throw new ConfigurationException("lifecycle.maxRestartAttempts must be at least 1");
        }
        int ringBufferSize = config.getEvents().getRingBufferSize();
        if (Integer.bitCount(ringBufferSize) != 1) {
            throw new ConfigurationException("events.ringBufferSize must be a power of 2: " + ringBufferSize);
        }
        String pattern = config.getSupervisor().getGroupNamePattern();
        if (pattern == null || !pattern.contains("%s")) {
            throw new ConfigurationException("supervisor.groupNamePattern must contain %s: " + pattern);
        }
        if (config.getModels() == null) {
            config.setModels(new ArrayList<>());
        }
        for (HotSwapConfig.ModelConfig model : config.getModels()) {
            if (model.getName() == null || model.getSlotAUrl() == null || model.getSlotBUrl() == null) {
                throw new ConfigurationException("models entries require name, slotAUrl and slotBUrl");
            }
        }
        return config;
    }

    /**
     * Creates a default configuration.
     */
    public static HotSwapConfig createDefault() {
        return new HotSwapConfig();
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
