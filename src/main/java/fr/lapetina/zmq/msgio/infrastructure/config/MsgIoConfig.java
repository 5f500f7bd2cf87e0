package fr.lapetina.zmq.msgio.infrastructure.config;

/**
 * Root configuration object for message pools.
 * Designed to be populated from YAML.
 */
public class MsgIoConfig {

    private PoolConfig pool = new PoolConfig();
    private BroadcastConfig broadcast = new BroadcastConfig();
    private RetryConfig retry = new RetryConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public PoolConfig getPool() { return pool; }
    public void setPool(PoolConfig pool) { this.pool = pool; }

    public BroadcastConfig getBroadcast() { return broadcast; }
    public void setBroadcast(BroadcastConfig broadcast) { this.broadcast = broadcast; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Queue sizing, cancellation latency and the default write policy.
     */
    public static class PoolConfig {
        private int readQueueCapacity = 10;
        private int writeQueueCapacity = 10;
        private long pollIntervalMs = 20;
        private long closeTimeoutMs = 5000;
        private String writePolicy = "load-balance";

        public int getReadQueueCapacity() { return readQueueCapacity; }
        public void setReadQueueCapacity(int readQueueCapacity) { this.readQueueCapacity = readQueueCapacity; }

        public int getWriteQueueCapacity() { return writeQueueCapacity; }
        public void setWriteQueueCapacity(int writeQueueCapacity) { this.writeQueueCapacity = writeQueueCapacity; }

        public long getPollIntervalMs() { return pollIntervalMs; }
        public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }

        public long getCloseTimeoutMs() { return closeTimeoutMs; }
        public void setCloseTimeoutMs(long closeTimeoutMs) { this.closeTimeoutMs = closeTimeoutMs; }

        public String getWritePolicy() { return writePolicy; }
        public void setWritePolicy(String writePolicy) { this.writePolicy = writePolicy; }
    }

    /**
     * Broadcast pool behavior.
     */
    public static class BroadcastConfig {
        private boolean evictFailedConnections = true;

        public boolean isEvictFailedConnections() { return evictFailedConnections; }
        public void setEvictFailedConnections(boolean evictFailedConnections) {
            this.evictFailedConnections = evictFailedConnections;
        }
    }

    /**
     * Load-balanced retry policy. Zero means unlimited.
     */
    public static class RetryConfig {
        private int maxAttempts = 0;
        private int evictionThreshold = 0;
        private long backoffMs = 0;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public int getEvictionThreshold() { return evictionThreshold; }
        public void setEvictionThreshold(int evictionThreshold) { this.evictionThreshold = evictionThreshold; }

        public long getBackoffMs() { return backoffMs; }
        public void setBackoffMs(long backoffMs) { this.backoffMs = backoffMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "zmq_msgio";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
