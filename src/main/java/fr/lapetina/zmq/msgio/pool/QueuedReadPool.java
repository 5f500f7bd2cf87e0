package fr.lapetina.zmq.msgio.pool;

import fr.lapetina.zmq.msgio.domain.context.IoContext;
import fr.lapetina.zmq.msgio.domain.exception.ConnectionException;
import fr.lapetina.zmq.msgio.domain.exception.ContextCancelledException;
import fr.lapetina.zmq.msgio.domain.exception.MsgIoException;
import fr.lapetina.zmq.msgio.domain.model.Msg;
import fr.lapetina.zmq.msgio.infrastructure.metrics.PoolMetrics;
import fr.lapetina.zmq.msgio.transport.MsgReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fan-in read pool: merges every registered connection into one stream of messages.
 *
 * Each connection gets a worker thread that reads messages and pushes them into a
 * bounded queue shared by all connections; {@link #read(IoContext)} pops from that
 * queue. Messages appear in arrival order. Messages of one connection keep their
 * relative order, messages of different connections interleave freely.
 *
 * A connection that fails delivers its failure once, through one {@code read} call,
 * then its worker closes and deregisters it. The remaining connections keep serving.
 */
public final class QueuedReadPool implements ReadPool {

    private static final Logger log = LoggerFactory.getLogger(QueuedReadPool.class);

    private final String name;
    private final IoContext poolCtx;
    private final PoolOptions options;
    private final PoolMetrics metrics;

    private final ReentrantLock lock = new ReentrantLock();
    private final List<MsgReader> readers = new ArrayList<>();
    private final ReadinessGate gate;
    private final ContextQueue<Msg> queue;
    private final WorkerGroup workers;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public QueuedReadPool(String name, IoContext ctx, PoolOptions options, PoolMetrics metrics) {
        this.name = Objects.requireNonNull(name, "name");
        this.poolCtx = IoContext.withCancel(ctx);
        this.options = options;
        this.metrics = metrics;
        this.gate = new ReadinessGate(options.getPollInterval());
        this.queue = new ContextQueue<>(options.getReadQueueCapacity(), poolCtx, options.getPollInterval());
        this.workers = new WorkerGroup(name);

        metrics.registerConnections(name, this::connectionCount);
        metrics.registerQueueDepth(name, queue::size);

        log.info("Read pool created: pool={}, queueCapacity={}", name, options.getReadQueueCapacity());
    }

    public QueuedReadPool(IoContext ctx) {
        this("fan-in", ctx, PoolOptions.defaults(), PoolMetrics.noop());
    }

    @Override
    public void addConn(MsgReader reader) {
        Objects.requireNonNull(reader, "reader");
        lock.lock();
        try {
            if (closed.get()) {
                throw MsgIoException.poolClosed(name);
            }
            readers.add(reader);
            gate.enable();
        } finally {
            lock.unlock();
        }

        if (!workers.startWorker(() -> listen(reader))) {
            rmConn(reader);
            throw MsgIoException.poolClosed(name);
        }
        log.info("Connection added: pool={}, connectionId={}", name, reader.connectionId());
    }

    @Override
    public void rmConn(MsgReader reader) {
        lock.lock();
        try {
            if (readers.remove(reader)) {
                log.info("Connection removed: pool={}, connectionId={}", name, reader.connectionId());
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Msg read(IoContext ctx) {
        if (closed.get()) {
            throw MsgIoException.poolClosed(name);
        }
        Msg msg;
        try {
            gate.lock(ctx, poolCtx);
            msg = queue.take(ctx);
        } catch (ContextCancelledException e) {
            if (closed.get()) {
                throw MsgIoException.poolClosed(name);
            }
            throw e;
        }
        if (msg == null) {
            throw MsgIoException.poolClosed(name);
        }
        if (msg.isFailed()) {
            throw msg.error();
        }
        metrics.incrementReceived(name);
        return msg;
    }

    /**
     * Worker loop for one connection. Runs until the connection fails or the pool stops.
     */
    private void listen(MsgReader reader) {
        String connectionId = reader.connectionId();
        log.debug("Reader worker started: pool={}, connectionId={}", name, connectionId);
        try {
            while (true) {
                Msg msg = reader.read(poolCtx);
                if (poolCtx.isDone()) {
                    return;
                }
                if (!queue.put(poolCtx, msg)) {
                    return;
                }
                if (msg.isFailed()) {
                    metrics.incrementConnectionFailure(name, "read");
                    log.warn("Connection read failed: pool={}, connectionId={}, error={}",
                            name, connectionId, msg.error().getMessage());
                    return;
                }
            }
        } catch (ContextCancelledException e) {
            log.debug("Reader worker cancelled: pool={}, connectionId={}, reason={}",
                    name, connectionId, e.getReason());
        } catch (RuntimeException e) {
            log.error("Reader worker failed: pool={}, connectionId={}", name, connectionId, e);
        } finally {
            // On pool close the connections are closed by close()
            if (!closed.get()) {
                closeQuietly(reader);
            }
            rmConn(reader);
            log.debug("Reader worker stopped: pool={}, connectionId={}", name, connectionId);
        }
    }

    private void closeQuietly(MsgReader reader) {
        try {
            reader.close();
        } catch (ConnectionException e) {
            metrics.incrementConnectionFailure(name, "close");
            log.warn("Error closing connection: pool={}, connectionId={}", name, reader.connectionId(), e);
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Closing read pool: pool={}", name);

        // Refuse new messages before the connections start failing
        List<Msg> discarded = queue.close();
        poolCtx.cancel();

        List<MsgReader> snapshot;
        lock.lock();
        try {
            snapshot = new ArrayList<>(readers);
            readers.clear();
        } finally {
            lock.unlock();
        }

        TaskGroup group = new TaskGroup(workers);
        for (MsgReader reader : snapshot) {
            group.go(() -> {
                try {
                    reader.close();
                } catch (ConnectionException e) {
                    metrics.incrementConnectionFailure(name, "close");
                    log.warn("Error closing connection: pool={}, connectionId={}",
                            name, reader.connectionId(), e);
                    throw e;
                }
            });
        }
        RuntimeException failure = group.await();

        workers.shutdown(options.getCloseTimeout());
        metrics.unregister(name);

        log.info("Read pool closed: pool={}, closedConnections={}, discardedMessages={}",
                name, snapshot.size(), discarded.size());
        if (failure != null) {
            throw failure;
        }
    }

    public int connectionCount() {
        lock.lock();
        try {
            return readers.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the number of worker threads still running.
     */
    public int activeWorkers() {
        return workers.activeWorkers();
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
