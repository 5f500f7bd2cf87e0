package fr.lapetina.zmq.msgio.pool;

import fr.lapetina.zmq.msgio.infrastructure.config.MsgIoConfig;

import java.time.Duration;

/**
 * Immutable tuning shared by all pool kinds.
 */
public final class PoolOptions {

    static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(20);

    private final int readQueueCapacity;
    private final int writeQueueCapacity;
    private final Duration pollInterval;
    private final Duration closeTimeout;
    private final boolean evictFailedConnections;
    private final RetryPolicy retryPolicy;

    private PoolOptions(Builder builder) {
        this.readQueueCapacity = builder.readQueueCapacity;
        this.writeQueueCapacity = builder.writeQueueCapacity;
        this.pollInterval = builder.pollInterval;
        this.closeTimeout = builder.closeTimeout;
        this.evictFailedConnections = builder.evictFailedConnections;
        this.retryPolicy = builder.retryPolicy;
    }

    public static PoolOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getReadQueueCapacity() {
        return readQueueCapacity;
    }

    public int getWriteQueueCapacity() {
        return writeQueueCapacity;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public Duration getCloseTimeout() {
        return closeTimeout;
    }

    public boolean isEvictFailedConnections() {
        return evictFailedConnections;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    @Override
    public String toString() {
        return "PoolOptions{" +
                "readQueueCapacity=" + readQueueCapacity +
                ", writeQueueCapacity=" + writeQueueCapacity +
                ", pollInterval=" + pollInterval +
                ", closeTimeout=" + closeTimeout +
                ", evictFailedConnections=" + evictFailedConnections +
                ", retryPolicy=" + retryPolicy +
                '}';
    }

    /**
     * Builder for PoolOptions.
     */
    public static final class Builder {
        private int readQueueCapacity = 10;
        private int writeQueueCapacity = 10;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private Duration closeTimeout = Duration.ofSeconds(5);
        private boolean evictFailedConnections = true;
        private RetryPolicy retryPolicy = RetryPolicy.unbounded();

        public Builder readQueueCapacity(int capacity) {
            this.readQueueCapacity = requirePositive(capacity, "readQueueCapacity");
            return this;
        }

        public Builder writeQueueCapacity(int capacity) {
            this.writeQueueCapacity = requirePositive(capacity, "writeQueueCapacity");
            return this;
        }

        public Builder pollInterval(Duration interval) {
            if (interval.isZero() || interval.isNegative()) {
                throw new IllegalArgumentException("pollInterval must be positive: " + interval);
            }
            this.pollInterval = interval;
            return this;
        }

        public Builder closeTimeout(Duration timeout) {
            this.closeTimeout = timeout;
            return this;
        }

        public Builder evictFailedConnections(boolean evict) {
            this.evictFailedConnections = evict;
            return this;
        }

        public Builder retryPolicy(RetryPolicy policy) {
            this.retryPolicy = policy;
            return this;
        }

        public Builder fromConfig(MsgIoConfig config) {
            MsgIoConfig.PoolConfig pool = config.getPool();
            MsgIoConfig.RetryConfig retry = config.getRetry();
            readQueueCapacity(pool.getReadQueueCapacity());
            writeQueueCapacity(pool.getWriteQueueCapacity());
            pollInterval(Duration.ofMillis(pool.getPollIntervalMs()));
            closeTimeout(Duration.ofMillis(pool.getCloseTimeoutMs()));
            this.evictFailedConnections = config.getBroadcast().isEvictFailedConnections();
            this.retryPolicy = RetryPolicy.of(
                    retry.getMaxAttempts(),
                    retry.getEvictionThreshold(),
                    Duration.ofMillis(retry.getBackoffMs())
            );
            return this;
        }

        public PoolOptions build() {
            return new PoolOptions(this);
        }

        private static int requirePositive(int value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive: " + value);
            }
            return value;
        }
    }
}
