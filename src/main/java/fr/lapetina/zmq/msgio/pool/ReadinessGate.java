package fr.lapetina.zmq.msgio.pool;

import fr.lapetina.zmq.msgio.domain.context.IoContext;
import fr.lapetina.zmq.msgio.domain.exception.ContextCancelledException;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot latch that holds pool operations until the first connection is registered.
 *
 * Starts closed. {@link #enable()} opens it; further calls, concurrent or not, have no
 * effect. Once open, {@link #lock()} never blocks again.
 */
public final class ReadinessGate {

    private final CountDownLatch ready = new CountDownLatch(1);
    private final long pollNanos;

    public ReadinessGate(Duration pollInterval) {
        this.pollNanos = pollInterval.toNanos();
    }

    public ReadinessGate() {
        this(PoolOptions.DEFAULT_POLL_INTERVAL);
    }

    /**
     * Opens the gate. Idempotent.
     */
    public void enable() {
        ready.countDown();
    }

    /**
     * Blocks until the gate is open.
     *
     * @throws ContextCancelledException with reason INTERRUPTED if the thread is interrupted
     */
    public void lock() {
        try {
            ready.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ContextCancelledException(ContextCancelledException.Reason.INTERRUPTED, e);
        }
    }

    /**
     * Blocks until the gate is open or the context finishes.
     *
     * @throws ContextCancelledException if the context finished first
     */
    public void lock(IoContext ctx) {
        lock(ctx, IoContext.background());
    }

    /**
     * Blocks until the gate is open or either context finishes. Pools pass their own
     * lifetime context as {@code owner} so that waiters are released when the pool stops.
     *
     * @throws ContextCancelledException if a context finished first
     */
    public void lock(IoContext ctx, IoContext owner) {
        try {
            while (!ready.await(pollNanos, TimeUnit.NANOSECONDS)) {
                ctx.throwIfDone();
                owner.throwIfDone();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ContextCancelledException(ContextCancelledException.Reason.INTERRUPTED, e);
        }
    }

    public boolean isReady() {
        return ready.getCount() == 0;
    }
}
