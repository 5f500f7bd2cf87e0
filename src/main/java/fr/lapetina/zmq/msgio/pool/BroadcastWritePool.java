package fr.lapetina.zmq.msgio.pool;

import fr.lapetina.zmq.msgio.domain.context.IoContext;
import fr.lapetina.zmq.msgio.domain.exception.ConnectionException;
import fr.lapetina.zmq.msgio.domain.exception.ContextCancelledException;
import fr.lapetina.zmq.msgio.domain.exception.MsgIoException;
import fr.lapetina.zmq.msgio.domain.model.Msg;
import fr.lapetina.zmq.msgio.infrastructure.metrics.PoolMetrics;
import fr.lapetina.zmq.msgio.transport.MsgWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fan-out write pool: every message goes to every registered connection.
 *
 * A write is issued concurrently on all connections and the call returns once all of
 * them finished, throwing the first failure. Delivery may be partial: connections
 * that succeeded keep the message even when the call fails because of another one.
 *
 * Writes are serialized, so each connection receives whole messages in call order.
 * {@link #close()} cancels a broadcast in progress; its caller gets POOL_CLOSED.
 * With {@link PoolOptions#isEvictFailedConnections()} a connection whose write failed
 * is removed and closed once the call completes.
 */
public final class BroadcastWritePool implements WritePool {

    private static final Logger log = LoggerFactory.getLogger(BroadcastWritePool.class);

    private final String name;
    private final IoContext poolCtx;
    private final PoolOptions options;
    private final PoolMetrics metrics;

    private final ReentrantLock lock = new ReentrantLock();
    private final List<MsgWriter> writers = new ArrayList<>();
    private final ReadinessGate gate;
    private final WorkerGroup workers;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    // Context of the broadcast holding the lock, cancelled by close()
    private volatile IoContext inflight;

    public BroadcastWritePool(String name, IoContext ctx, PoolOptions options, PoolMetrics metrics) {
        this.name = Objects.requireNonNull(name, "name");
        this.poolCtx = IoContext.withCancel(ctx);
        this.options = options;
        this.metrics = metrics;
        this.gate = new ReadinessGate(options.getPollInterval());
        this.workers = new WorkerGroup(name);

        metrics.registerConnections(name, this::connectionCount);

        log.info("Broadcast write pool created: pool={}, evictFailedConnections={}",
                name, options.isEvictFailedConnections());
    }

    public BroadcastWritePool(IoContext ctx) {
        this("fan-out", ctx, PoolOptions.defaults(), PoolMetrics.noop());
    }

    @Override
    public void addConn(MsgWriter writer) {
        Objects.requireNonNull(writer, "writer");
        lock.lock();
        try {
            if (closed.get()) {
                throw MsgIoException.poolClosed(name);
            }
            writers.add(writer);
            gate.enable();
        } finally {
            lock.unlock();
        }
        log.info("Connection added: pool={}, connectionId={}", name, writer.connectionId());
    }

    @Override
    public void rmConn(MsgWriter writer) {
        lock.lock();
        try {
            if (writers.remove(writer)) {
                log.info("Connection removed: pool={}, connectionId={}", name, writer.connectionId());
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void write(IoContext ctx, Msg msg) {
        if (closed.get()) {
            throw MsgIoException.poolClosed(name);
        }
        awaitReady(ctx);

        lock.lock();
        IoContext callCtx = IoContext.withCancel(ctx);
        inflight = callCtx;
        try {
            if (closed.get()) {
                throw MsgIoException.poolClosed(name);
            }
            ctx.throwIfDone();

            List<MsgWriter> targets = List.copyOf(writers);
            Set<MsgWriter> failed = ConcurrentHashMap.newKeySet();

            TaskGroup group = new TaskGroup(workers);
            for (MsgWriter writer : targets) {
                group.go(() -> {
                    try {
                        writer.write(callCtx, msg);
                        metrics.incrementSent(name);
                    } catch (ConnectionException e) {
                        failed.add(writer);
                        metrics.incrementConnectionFailure(name, "write");
                        log.warn("Connection write failed: pool={}, connectionId={}, error={}",
                                name, writer.connectionId(), e.getMessage());
                        throw e;
                    }
                });
            }
            RuntimeException failure = group.await();

            log.debug("Broadcast completed: pool={}, targets={}, failed={}",
                    name, targets.size(), failed.size());

            if (!failed.isEmpty() && options.isEvictFailedConnections()) {
                evict(failed);
            }
            if (failure instanceof ContextCancelledException && closed.get()) {
                throw MsgIoException.poolClosed(name);
            }
            if (failure != null) {
                throw failure;
            }
        } finally {
            inflight = null;
            callCtx.cancel();
            lock.unlock();
        }
    }

    private void awaitReady(IoContext ctx) {
        try {
            gate.lock(ctx, poolCtx);
        } catch (ContextCancelledException e) {
            if (closed.get()) {
                throw MsgIoException.poolClosed(name);
            }
            throw e;
        }
    }

    // Caller holds the lock
    private void evict(Set<MsgWriter> failed) {
        for (MsgWriter writer : failed) {
            writers.remove(writer);
            metrics.incrementEviction(name);
            log.warn("Connection evicted after write failure: pool={}, connectionId={}, remaining={}",
                    name, writer.connectionId(), writers.size());
            try {
                writer.close();
            } catch (ConnectionException e) {
                metrics.incrementConnectionFailure(name, "close");
                log.warn("Error closing evicted connection: pool={}, connectionId={}",
                        name, writer.connectionId(), e);
            }
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Closing broadcast write pool: pool={}", name);
        poolCtx.cancel();

        // A stalled destination must not keep close() waiting on the lock
        IoContext running = inflight;
        if (running != null) {
            running.cancel();
        }

        ConnectionException first = null;
        int count;
        lock.lock();
        try {
            count = writers.size();
            for (MsgWriter writer : writers) {
                try {
                    writer.close();
                } catch (ConnectionException e) {
                    metrics.incrementConnectionFailure(name, "close");
                    log.warn("Error closing connection: pool={}, connectionId={}",
                            name, writer.connectionId(), e);
                    if (first == null) {
                        first = e;
                    }
                }
            }
            writers.clear();
        } finally {
            lock.unlock();
        }

        workers.shutdown(options.getCloseTimeout());
        metrics.unregister(name);

        log.info("Broadcast write pool closed: pool={}, closedConnections={}", name, count);
        if (first != null) {
            throw first;
        }
    }

    public int connectionCount() {
        lock.lock();
        try {
            return writers.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isReady() {
        return gate.isReady();
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    public String getName() {
        return name;
    }
}
