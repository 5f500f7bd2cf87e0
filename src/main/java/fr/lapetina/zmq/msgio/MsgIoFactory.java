package fr.lapetina.zmq.msgio;

import fr.lapetina.zmq.msgio.domain.context.IoContext;
import fr.lapetina.zmq.msgio.domain.exception.MsgIoException;
import fr.lapetina.zmq.msgio.infrastructure.config.ConfigLoader;
import fr.lapetina.zmq.msgio.infrastructure.config.MsgIoConfig;
import fr.lapetina.zmq.msgio.infrastructure.metrics.PoolMetrics;
import fr.lapetina.zmq.msgio.pool.PoolFactory;
import fr.lapetina.zmq.msgio.pool.PoolOptions;
import fr.lapetina.zmq.msgio.pool.ReadPool;
import fr.lapetina.zmq.msgio.pool.WritePool;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;

/**
 * Factory for creating pools wired from configuration.
 * This is the primary entry point for obtaining configured read and write pools.
 *
 * <p>Usage:
 * <pre>{@code
 * try (MsgIoFactory factory = MsgIoFactory.create("msgio.yaml")) {
 *     WritePool out = factory.newWritePool(ctx, "push");
 *     out.addConn(new MsgWriter(conn));
 *     out.write(ctx, Msg.ofStrings("hello"));
 * }
 * }</pre>
 *
 * Closing the factory closes every pool it created that is still open.
 */
public class MsgIoFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MsgIoFactory.class);

    private final MsgIoConfig config;
    private final PoolOptions options;
    private final PoolMetrics metrics;
    private final List<TrackedPool> pools = new CopyOnWriteArrayList<>();

    protected MsgIoFactory(MsgIoConfig config, MeterRegistry registryOverride) {
        this.config = config;
        this.options = PoolOptions.builder().fromConfig(config).build();

        MsgIoConfig.MetricsConfig metricsConfig = config.getMetrics();
        if (registryOverride != null) {
            this.metrics = new PoolMetrics(metricsConfig.getPrefix(), registryOverride);
        } else if (metricsConfig.isEnabled()) {
            this.metrics = new PoolMetrics(metricsConfig.getPrefix());
        } else {
            this.metrics = PoolMetrics.noop();
        }

        log.info("MsgIoFactory initialized: writePolicy={}, options={}",
                config.getPool().getWritePolicy(), options);
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static MsgIoFactory create(String configPath) {
        log.info("Initializing MsgIoFactory from config: {}", configPath);
        return new MsgIoFactory(new ConfigLoader(configPath).load(), null);
    }

    /**
     * Creates a factory from an already loaded configuration.
     */
    public static MsgIoFactory create(MsgIoConfig config) {
        return new MsgIoFactory(config, null);
    }

    /**
     * Creates a factory from the default configuration (msgio.yaml).
     */
    public static MsgIoFactory create() {
        return create("msgio.yaml");
    }

    public ReadPool newReadPool(IoContext ctx, String name) {
        ReadPool pool = PoolFactory.createReadPool(name, ctx, options, metrics);
        return track(pool, pool::isClosed);
    }

    /**
     * Creates a write pool using the configured write policy.
     */
    public WritePool newWritePool(IoContext ctx, String name) {
        return newWritePool(ctx, name, config.getPool().getWritePolicy());
    }

    /**
     * Creates a write pool of the given kind.
     *
     * @throws IllegalArgumentException if the kind is not registered
     */
    public WritePool newWritePool(IoContext ctx, String name, String kind) {
        WritePool pool = PoolFactory.createWritePool(kind, name, ctx, options, metrics)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown write policy: " + kind + ", known: " + PoolFactory.registeredWriteKinds()));
        return track(pool, pool::isClosed);
    }

    // Pools closed by their owner are forgotten on the next creation
    private <T extends AutoCloseable> T track(T pool, BooleanSupplier closed) {
        pools.removeIf(TrackedPool::isClosed);
        pools.add(new TrackedPool(pool, closed));
        return pool;
    }

    /**
     * Returns the number of pools created by this factory that are still open.
     */
    public int openPools() {
        pools.removeIf(TrackedPool::isClosed);
        return pools.size();
    }

    public MsgIoConfig getConfig() {
        return config;
    }

    public PoolOptions getOptions() {
        return options;
    }

    public PoolMetrics getMetrics() {
        return metrics;
    }

    @Override
    public void close() {
        log.info("Shutting down MsgIoFactory...");

        List<TrackedPool> snapshot = new ArrayList<>(pools);
        pools.clear();
        for (TrackedPool tracked : snapshot) {
            try {
                tracked.pool().close();
            } catch (MsgIoException e) {
                log.warn("Error closing pool: errorType={}", e.getErrorType(), e);
            } catch (Exception e) {
                log.warn("Error closing pool", e);
            }
        }

        try {
            metrics.close();
        } catch (RuntimeException e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("MsgIoFactory shut down: closedPools={}", snapshot.size());
    }

    private record TrackedPool(AutoCloseable pool, BooleanSupplier closed) {

        boolean isClosed() {
            return closed.getAsBoolean();
        }
    }
}
