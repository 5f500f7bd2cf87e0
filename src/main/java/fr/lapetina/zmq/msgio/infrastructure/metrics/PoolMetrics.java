package fr.lapetina.zmq.msgio.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Centralized pool metrics using Micrometer.
 *
 * Provides, tagged by pool name:
 * - Messages received and sent
 * - Connection failures by operation
 * - Load-balance retries, drops and evictions
 * - Connection count and queue depth gauges
 * - Prometheus exposition
 */
public final class PoolMetrics implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PoolMetrics.class);

    private final MeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();

    // Gauges hold their pool strongly, so they are removed when the pool closes
    private final ConcurrentHashMap<String, List<Gauge>> gauges = new ConcurrentHashMap<>();

    public PoolMetrics(String prefix, MeterRegistry registry) {
        this.prefix = prefix;
        this.registry = registry;
        log.info("PoolMetrics initialized with prefix: {}", prefix);
    }

    public PoolMetrics(String prefix) {
        this(prefix, new PrometheusMeterRegistry(PrometheusConfig.DEFAULT));
    }

    public PoolMetrics() {
        this("zmq_msgio");
    }

    /**
     * Metrics that record nothing anyone reads. Used when metrics are disabled.
     */
    public static PoolMetrics noop() {
        return new PoolMetrics("zmq_msgio", new SimpleMeterRegistry());
    }

    public void incrementReceived(String pool) {
        counter("_messages_received_total", "Messages delivered to readers", pool, null).increment();
    }

    public void incrementSent(String pool) {
        counter("_messages_sent_total", "Messages written to a connection", pool, null).increment();
    }

    /**
     * Counts a connection failure; {@code op} is one of read, write, close.
     */
    public void incrementConnectionFailure(String pool, String op) {
        counter("_connection_failures_total", "Connection failures", pool, op).increment();
    }

    public void incrementRetry(String pool) {
        counter("_retries_total", "Messages requeued after a failed write", pool, null).increment();
    }

    public void incrementDropped(String pool) {
        counter("_messages_dropped_total", "Messages discarded without delivery", pool, null).increment();
    }

    public void incrementEviction(String pool) {
        counter("_evictions_total", "Connections removed after repeated failures", pool, null).increment();
    }

    /**
     * Registers a gauge for the number of connections of a pool.
     */
    public void registerConnections(String pool, Supplier<Number> valueSupplier) {
        gauge(prefix + "_connections", "Connections registered in the pool", pool, valueSupplier);
    }

    /**
     * Registers a gauge for the number of messages waiting in a pool queue.
     */
    public void registerQueueDepth(String pool, Supplier<Number> valueSupplier) {
        gauge(prefix + "_queue_depth", "Messages waiting in the pool queue", pool, valueSupplier);
    }

    /**
     * Removes the gauges of a pool, so that a later pool of the same name reports its
     * own values. Counters are kept.
     */
    public void unregister(String pool) {
        List<Gauge> removed = gauges.remove(pool);
        if (removed == null) {
            return;
        }
        for (Gauge gauge : removed) {
            registry.remove(gauge);
        }
        log.debug("Gauges removed: pool={}, count={}", pool, removed.size());
    }

    /**
     * Returns the current value of a counter, 0 if it was never incremented.
     */
    public double count(String name, String pool) {
        Counter counter = registry.find(prefix + name).tag("pool", pool).counter();
        return counter == null ? 0 : counter.count();
    }

    /**
     * Returns the Prometheus scrape output, or an empty string for other registries.
     */
    public String scrape() {
        if (registry instanceof PrometheusMeterRegistry prometheus) {
            return prometheus.scrape();
        }
        return "";
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    public String getPrefix() {
        return prefix;
    }

    private Counter counter(String name, String description, String pool, String op) {
        String key = name + ":" + pool + ":" + op;
        return counters.computeIfAbsent(key, k -> {
            Counter.Builder builder = Counter.builder(prefix + name)
                    .description(description)
                    .tag("pool", pool);
            if (op != null) {
                builder.tag("op", op);
            }
            return builder.register(registry);
        });
    }

    private void gauge(String name, String description, String pool, Supplier<Number> valueSupplier) {
        Gauge gauge = Gauge.builder(name, valueSupplier, s -> s.get().doubleValue())
                .description(description)
                .tag("pool", pool)
                .strongReference(true)
                .register(registry);
        gauges.computeIfAbsent(pool, k -> new CopyOnWriteArrayList<>()).add(gauge);
    }

    @Override
    public void close() {
        registry.close();
    }
}
