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

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Load-balanced write pool: each message goes to exactly one live connection.
 *
 * {@link #write(IoContext, Msg)} only enqueues; every connection's worker pulls the
 * next message from the shared queue as soon as it is free, which spreads messages
 * across connections in turn. When a write fails the worker puts the same message
 * back at the tail of the queue so that any worker, possibly another connection, can
 * retry it.
 *
 * The {@link RetryPolicy} bounds this behavior. With the default unbounded policy a
 * message is never dropped: if its only connection keeps failing, it keeps being
 * retried until a working connection joins or the pool closes.
 *
 * Connections are tracked in an explicit registry; {@link #rmConn(MsgWriter)} stops
 * the connection's worker, which closes the connection.
 */
public final class LoadBalancedWritePool implements WritePool {

    private static final Logger log = LoggerFactory.getLogger(LoadBalancedWritePool.class);

    private final String name;
    private final IoContext poolCtx;
    private final PoolOptions options;
    private final RetryPolicy retryPolicy;
    private final PoolMetrics metrics;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<MsgWriter, Worker> registry = new LinkedHashMap<>();
    private final ReadinessGate gate;
    private final ContextQueue<Envelope> queue;
    private final WorkerGroup workers;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public LoadBalancedWritePool(String name, IoContext ctx, PoolOptions options, PoolMetrics metrics) {
        this.name = Objects.requireNonNull(name, "name");
        this.poolCtx = IoContext.withCancel(ctx);
        this.options = options;
        this.retryPolicy = options.getRetryPolicy();
        this.metrics = metrics;
        this.gate = new ReadinessGate(options.getPollInterval());
        this.queue = new ContextQueue<>(options.getWriteQueueCapacity(), poolCtx, options.getPollInterval());
        this.workers = new WorkerGroup(name);

        metrics.registerConnections(name, this::connectionCount);
        metrics.registerQueueDepth(name, queue::size);

        log.info("Load-balanced write pool created: pool={}, queueCapacity={}, retryPolicy={}",
                name, options.getWriteQueueCapacity(), retryPolicy);
    }

    public LoadBalancedWritePool(IoContext ctx) {
        this("load-balance", ctx, PoolOptions.defaults(), PoolMetrics.noop());
    }

    @Override
    public void addConn(MsgWriter writer) {
        Objects.requireNonNull(writer, "writer");
        Worker worker;
        lock.lock();
        try {
            if (closed.get()) {
                throw MsgIoException.poolClosed(name);
            }
            if (registry.containsKey(writer)) {
                return;
            }
            worker = new Worker(writer, IoContext.withCancel(poolCtx));
            registry.put(writer, worker);
            gate.enable();
        } finally {
            lock.unlock();
        }

        if (!workers.startWorker(worker)) {
            detach(writer);
            throw MsgIoException.poolClosed(name);
        }
        log.info("Connection added: pool={}, connectionId={}", name, writer.connectionId());
    }

    /**
     * Removes the connection and stops its worker. The worker closes the connection on
     * exit and puts back the message it was holding, if any.
     */
    @Override
    public void rmConn(MsgWriter writer) {
        if (detach(writer) != null) {
            log.info("Connection removed: pool={}, connectionId={}", name, writer.connectionId());
        }
    }

    @Override
    public void write(IoContext ctx, Msg msg) {
        if (closed.get()) {
            throw MsgIoException.poolClosed(name);
        }
        try {
            gate.lock(ctx, poolCtx);
            if (!queue.put(ctx, new Envelope(msg, 0))) {
                throw MsgIoException.poolClosed(name);
            }
        } catch (ContextCancelledException e) {
            if (closed.get()) {
                throw MsgIoException.poolClosed(name);
            }
            throw e;
        }
        log.debug("Message enqueued: pool={}, queueDepth={}", name, queue.size());
    }

    private Worker detach(MsgWriter writer) {
        Worker worker;
        lock.lock();
        try {
            worker = registry.remove(writer);
        } finally {
            lock.unlock();
        }
        if (worker != null) {
            worker.detached = true;
            worker.ctx.cancel();
        }
        return worker;
    }

    /**
     * Puts a message back for another attempt.
     *
     * @return false if the pool stopped and the message was dropped
     */
    private boolean requeue(Envelope envelope) {
        try {
            if (queue.put(poolCtx, envelope)) {
                return true;
            }
        } catch (ContextCancelledException e) {
            log.debug("Requeue abandoned: pool={}, reason={}", name, e.getReason());
        }
        metrics.incrementDropped(name);
        log.warn("Message dropped, pool stopped before retry: pool={}, attempts={}", name, envelope.attempts());
        return false;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Closing load-balanced write pool: pool={}", name);

        List<Envelope> pending = queue.close();
        poolCtx.cancel();
        if (!pending.isEmpty()) {
            pending.forEach(envelope -> metrics.incrementDropped(name));
            log.warn("Undelivered messages discarded: pool={}, count={}", name, pending.size());
        }

        List<MsgWriter> snapshot;
        lock.lock();
        try {
            snapshot = new ArrayList<>(registry.keySet());
            registry.clear();
        } finally {
            lock.unlock();
        }

        workers.shutdown(options.getCloseTimeout());
        metrics.unregister(name);

        ConnectionException first = null;
        for (MsgWriter writer : snapshot) {
            try {
                writer.close();
            } catch (ConnectionException e) {
                metrics.incrementConnectionFailure(name, "close");
                log.warn("Error closing connection: pool={}, connectionId={}", name, writer.connectionId(), e);
                if (first == null) {
                    first = e;
                }
            }
        }

        log.info("Load-balanced write pool closed: pool={}, closedConnections={}", name, snapshot.size());
        if (first != null) {
            throw first;
        }
    }

    public int connectionCount() {
        lock.lock();
        try {
            return registry.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the number of messages waiting for a connection.
     */
    public int pendingMessages() {
        return queue.size();
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

    /**
     * A queued message and the number of write attempts already spent on it.
     */
    private record Envelope(Msg msg, int attempts) {
    }

    /**
     * Worker loop for one connection.
     */
    private final class Worker implements Runnable {

        private final MsgWriter writer;
        private final IoContext ctx;
        private volatile boolean detached;
        private int consecutiveFailures;

        Worker(MsgWriter writer, IoContext ctx) {
            this.writer = writer;
            this.ctx = ctx;
        }

        @Override
        public void run() {
            String connectionId = writer.connectionId();
            log.debug("Writer worker started: pool={}, connectionId={}", name, connectionId);
            try {
                while (true) {
                    Envelope envelope = queue.take(ctx);
                    if (envelope == null) {
                        return;
                    }
                    if (!deliver(envelope)) {
                        return;
                    }
                }
            } catch (ContextCancelledException e) {
                log.debug("Writer worker cancelled: pool={}, connectionId={}, reason={}",
                        name, connectionId, e.getReason());
            } catch (RuntimeException e) {
                log.error("Writer worker failed: pool={}, connectionId={}", name, connectionId, e);
            } finally {
                // Connections still registered at pool close are closed by close()
                if (detached) {
                    closeQuietly();
                }
                log.debug("Writer worker stopped: pool={}, connectionId={}", name, connectionId);
            }
        }

        /**
         * Attempts one write.
         *
         * @return false if the worker must stop
         */
        private boolean deliver(Envelope envelope) {
            try {
                writer.write(ctx, envelope.msg());
                consecutiveFailures = 0;
                metrics.incrementSent(name);
                return true;
            } catch (ContextCancelledException e) {
                // Stopped mid-write: hand the message to the remaining connections
                if (!closed.get()) {
                    requeue(envelope);
                } else {
                    metrics.incrementDropped(name);
                    log.warn("In-flight message discarded on close: pool={}, connectionId={}",
                            name, writer.connectionId());
                }
                throw e;
            } catch (ConnectionException e) {
                consecutiveFailures++;
                metrics.incrementConnectionFailure(name, "write");
                onWriteFailure(envelope, e);
            }

            if (retryPolicy.shouldEvict(consecutiveFailures)) {
                evict();
                return false;
            }
            return backoff();
        }

        private void onWriteFailure(Envelope envelope, ConnectionException e) {
            int attempts = envelope.attempts() + 1;
            if (retryPolicy.isExhausted(attempts)) {
                metrics.incrementDropped(name);
                log.warn("Message dropped after {} attempts: pool={}, connectionId={}, error={}",
                        attempts, name, writer.connectionId(), e.getMessage());
                return;
            }
            log.debug("Connection write failed, requeueing: pool={}, connectionId={}, attempts={}, error={}",
                    name, writer.connectionId(), attempts, e.getMessage());
            if (requeue(new Envelope(envelope.msg(), attempts))) {
                metrics.incrementRetry(name);
            }
        }

        private void evict() {
            if (detach(writer) != null) {
                metrics.incrementEviction(name);
                log.warn("Connection evicted after {} consecutive failures: pool={}, connectionId={}",
                        consecutiveFailures, name, writer.connectionId());
            }
        }

        /**
         * @return false if the worker was stopped while backing off
         */
        private boolean backoff() {
            Duration delay = retryPolicy.getBackoff();
            if (delay.isZero()) {
                return true;
            }
            try {
                return !ctx.await(delay.toNanos(), TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }

        private void closeQuietly() {
            try {
                writer.close();
            } catch (ConnectionException e) {
                metrics.incrementConnectionFailure(name, "close");
                log.warn("Error closing connection: pool={}, connectionId={}", name, writer.connectionId(), e);
            }
        }
    }
}
