package fr.lapetina.hotswap.infrastructure.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the hot-swap controller.
 * Designed to be populated from YAML.
 */
public class HotSwapConfig {

    private ServerConfig server = new ServerConfig();
    private StorageConfig storage = new StorageConfig();
    private SupervisorConfig supervisor = new SupervisorConfig();
    private WorkersConfig workers = new WorkersConfig();
    private List<ModelConfig> models = new ArrayList<>();
    private LifecycleConfig lifecycle = new LifecycleConfig();
    private QueueConfig queue = new QueueConfig();
    private SupervisionConfig supervision = new SupervisionConfig();
    private EventsConfig events = new EventsConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public StorageConfig getStorage() { return storage; }
    public void setStorage(StorageConfig storage) { this.storage = storage; }

    public SupervisorConfig getSupervisor() { return supervisor; }
    public void setSupervisor(SupervisorConfig supervisor) { this.supervisor = supervisor; }

    public WorkersConfig getWorkers() { return workers; }
    public void setWorkers(WorkersConfig workers) { this.workers = workers; }

    public List<ModelConfig> getModels() { return models; }
    public void setModels(List<ModelConfig> models) { this.models = models; }

    public LifecycleConfig getLifecycle() { return lifecycle; }
    public void setLifecycle(LifecycleConfig lifecycle) { this.lifecycle = lifecycle; }

    public QueueConfig getQueue() { return queue; }
    public void setQueue(QueueConfig queue) { this.queue = queue; }

    public SupervisionConfig getSupervision() { return supervision; }
    public void setSupervision(SupervisionConfig supervision) { this.supervision = supervision; }

    public EventsConfig getEvents() { return events; }
    public void setEvents(EventsConfig events) { this.events = events; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 5000;
        private String host = "0.0.0.0";
        private int backlog = 100;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }
    }

    /**
     * Artifact storage configuration.
     */
    public static class StorageConfig {
        private String artifactRoot = "data/model";

        public String getArtifactRoot() { return artifactRoot; }
        public void setArtifactRoot(String artifactRoot) { this.artifactRoot = artifactRoot; }
    }

    /**
     * Process supervisor (supervisord) connection.
     */
    public static class SupervisorConfig {
        private String rpcUrl = "http://localhost:9999/RPC2";
        private String uiUrl = "http://localhost:9999";
        private String groupNamePattern = "%s-%s";
        private long rpcTimeoutMs = 10000;
        private String username;
        private String password;

        public String getRpcUrl() { return rpcUrl; }
        public void setRpcUrl(String rpcUrl) { this.rpcUrl = rpcUrl; }

        public String getUiUrl() { return uiUrl; }
        public void setUiUrl(String uiUrl) { this.uiUrl = uiUrl; }

        public String getGroupNamePattern() { return groupNamePattern; }
        public void setGroupNamePattern(String groupNamePattern) { this.groupNamePattern = groupNamePattern; }

        public long getRpcTimeoutMs() { return rpcTimeoutMs; }
        public void setRpcTimeoutMs(long rpcTimeoutMs) { this.rpcTimeoutMs = rpcTimeoutMs; }

        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }
    }

    /**
     * Worker process endpoints and HTTP timeouts.
     */
    public static class WorkersConfig {
        private String host = "127.0.0.1";
        private int basePort = 5005;
        private String healthPath = "/";
        private String inferencePath = "/webhooks/rest/webhook";
        private long connectTimeoutMs = 5000;
        private long requestTimeoutMs = 60000;
        private long probeTimeoutMs = 2000;

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBasePort() { return basePort; }
        public void setBasePort(int basePort) { this.basePort = basePort; }

        public String getHealthPath() { return healthPath; }
        public void setHealthPath(String healthPath) { this.healthPath = healthPath; }

        public String getInferencePath() { return inferencePath; }
        public void setInferencePath(String inferencePath) { this.inferencePath = inferencePath; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public long getProbeTimeoutMs() { return probeTimeoutMs; }
        public void setProbeTimeoutMs(long probeTimeoutMs) { this.probeTimeoutMs = probeTimeoutMs; }
    }

    /**
     * Static worker endpoints for a model name.
     */
    public static class ModelConfig {
        private String name;
        private String slotAUrl;
        private String slotBUrl;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getSlotAUrl() { return slotAUrl; }
        public void setSlotAUrl(String slotAUrl) { this.slotAUrl = slotAUrl; }

        public String getSlotBUrl() { return slotBUrl; }
        public void setSlotBUrl(String slotBUrl) { this.slotBUrl = slotBUrl; }
    }

    /**
     * Promotion, drain and restart bounds.
     */
    public static class LifecycleConfig {
        private long readinessTimeoutMs = 300000;
        private long probeIntervalMs = 1000;
        private int unhealthyThreshold = 3;
        private long drainTimeoutMs = 60000;
        private long drainPollIntervalMs = 200;
        private int maxRestartAttempts = 3;

        public long getReadinessTimeoutMs() { return readinessTimeoutMs; }
        public void setReadinessTimeoutMs(long readinessTimeoutMs) { this.readinessTimeoutMs = readinessTimeoutMs; }

        public long getProbeIntervalMs() { return probeIntervalMs; }
        public void setProbeIntervalMs(long probeIntervalMs) { this.probeIntervalMs = probeIntervalMs; }

        public int getUnhealthyThreshold() { return unhealthyThreshold; }
        public void setUnhealthyThreshold(int unhealthyThreshold) { this.unhealthyThreshold = unhealthyThreshold; }

        public long getDrainTimeoutMs() { return drainTimeoutMs; }
        public void setDrainTimeoutMs(long drainTimeoutMs) { this.drainTimeoutMs = drainTimeoutMs; }

        public long getDrainPollIntervalMs() { return drainPollIntervalMs; }
        public void setDrainPollIntervalMs(long drainPollIntervalMs) { this.drainPollIntervalMs = drainPollIntervalMs; }

        public int getMaxRestartAttempts() { return maxRestartAttempts; }
        public void setMaxRestartAttempts(int maxRestartAttempts) { this.maxRestartAttempts = maxRestartAttempts; }
    }

    /**
     * Request hold queue configuration.
     */
    public static class QueueConfig {
        private long maxHoldMs = 120000;

        public long getMaxHoldMs() { return maxHoldMs; }
        public void setMaxHoldMs(long maxHoldMs) { this.maxHoldMs = maxHoldMs; }
    }

    /**
     * Periodic supervision of active workers.
     */
    public static class SupervisionConfig {
        private boolean enabled = true;
        private long intervalMs = 5000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }
    }

    /**
     * Lifecycle event bus (LMAX Disruptor) configuration.
     */
    public static class EventsConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private int historySize = 50;

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }

        public int getHistorySize() { return historySize; }
        public void setHistorySize(int historySize) { this.historySize = historySize; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "hotswap";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
