package fr.lapetina.zmq.msgio.pool;

import fr.lapetina.zmq.msgio.domain.context.IoContext;
import fr.lapetina.zmq.msgio.infrastructure.metrics.PoolMetrics;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates pools by kind name.
 *
 * Write pool kinds are looked up in a registry so that configuration can pick the
 * write policy, and applications can plug in their own.
 */
public final class PoolFactory {

    public static final String FAN_IN = "fan-in";
    public static final String BROADCAST = "broadcast";
    public static final String LOAD_BALANCE = "load-balance";

    /**
     * Builds a write pool of one kind.
     */
    @FunctionalInterface
    public interface WritePoolSupplier {
        WritePool create(String name, IoContext ctx, PoolOptions options, PoolMetrics metrics);
    }

    private static final Map<String, WritePoolSupplier> WRITE_REGISTRY = new ConcurrentHashMap<>();

    static {
        register(BROADCAST, BroadcastWritePool::new);
        register(LOAD_BALANCE, LoadBalancedWritePool::new);
    }

    private PoolFactory() {
        // Utility class
    }

    /**
     * Registers a write pool kind.
     *
     * @param kind Kind name (used in configuration)
     * @param supplier Factory for creating pools of that kind
     */
    public static void register(String kind, WritePoolSupplier supplier) {
        WRITE_REGISTRY.put(kind.toLowerCase(), supplier);
    }

    public static ReadPool createReadPool(String name, IoContext ctx, PoolOptions options, PoolMetrics metrics) {
        return new QueuedReadPool(name, ctx, options, metrics);
    }

    /**
     * Creates a write pool by kind.
     *
     * @return the pool, or empty if no such kind is registered
     */
    public static Optional<WritePool> createWritePool(
            String kind,
            String name,
            IoContext ctx,
            PoolOptions options,
            PoolMetrics metrics
    ) {
        WritePoolSupplier supplier = WRITE_REGISTRY.get(kind.toLowerCase());
        if (supplier == null) {
            return Optional.empty();
        }
        return Optional.of(supplier.create(name, ctx, options, metrics));
    }

    /**
     * Returns all registered write pool kinds, sorted.
     */
    public static Set<String> registeredWriteKinds() {
        return new TreeSet<>(WRITE_REGISTRY.keySet());
    }
}
