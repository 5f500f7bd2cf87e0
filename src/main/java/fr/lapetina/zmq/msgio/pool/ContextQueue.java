package fr.lapetina.zmq.msgio.pool;

import fr.lapetina.zmq.msgio.domain.context.IoContext;
import fr.lapetina.zmq.msgio.domain.exception.ContextCancelledException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded hand-off queue whose blocking operations observe cancellation contexts.
 *
 * Every wait is cut into slices of the poll interval so that both the caller's context
 * and the owning pool's context are checked while blocked. Once closed, puts are
 * refused and takes return null on their next attempt.
 */
final class ContextQueue<E> {

    private final BlockingQueue<E> queue;
    private final IoContext owner;
    private final long pollNanos;
    private volatile boolean closed;

    ContextQueue(int capacity, IoContext owner, Duration pollInterval) {
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.owner = owner;
        this.pollNanos = pollInterval.toNanos();
    }

    /**
     * Blocks until the element is enqueued.
     *
     * @return false if the queue is closed
     * @throws ContextCancelledException if the caller's or the owner's context finished first
     */
    boolean put(IoContext ctx, E element) {
        try {
            while (true) {
                if (closed) {
                    return false;
                }
                ctx.throwIfDone();
                owner.throwIfDone();
                if (queue.offer(element, pollNanos, TimeUnit.NANOSECONDS)) {
                    // Closed meanwhile: either take it back, or close() already drained it
                    return !closed || !queue.remove(element);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ContextCancelledException(ContextCancelledException.Reason.INTERRUPTED, e);
        }
    }

    /**
     * Blocks until an element is available.
     *
     * @return the element, or null if the queue is closed
     * @throws ContextCancelledException if the caller's or the owner's context finished first
     */
    E take(IoContext ctx) {
        try {
            while (true) {
                if (closed) {
                    return null;
                }
                ctx.throwIfDone();
                owner.throwIfDone();
                E element = queue.poll(pollNanos, TimeUnit.NANOSECONDS);
                if (element != null) {
                    return element;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ContextCancelledException(ContextCancelledException.Reason.INTERRUPTED, e);
        }
    }

    /**
     * Closes the queue and returns what was still waiting in it.
     */
    List<E> close() {
        closed = true;
        List<E> pending = new ArrayList<>();
        queue.drainTo(pending);
        return pending;
    }

    boolean isClosed() {
        return closed;
    }

    int size() {
        return queue.size();
    }
}
