package fr.lapetina.zmq.msgio.domain.context;

import fr.lapetina.zmq.msgio.domain.exception.ContextCancelledException;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cancellation signal shared by every suspension point of a pool operation.
 *
 * Contexts form a tree: finishing a context finishes all of its descendants with the
 * same reason. A context finishes when it is cancelled, when its deadline passes, or
 * when its parent finishes. Once finished it stays finished.
 *
 * <pre>{@code
 * IoContext ctx = IoContext.withTimeout(IoContext.background(), Duration.ofSeconds(2));
 * Msg msg = readPool.read(ctx);
 * }</pre>
 *
 * Thread-safe.
 */
public final class IoContext {

    private static final ScheduledExecutorService TIMER = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "io-context-timer");
        t.setDaemon(true);
        return t;
    });

    private static final IoContext BACKGROUND = new IoContext(null, null);

    private final IoContext parent;
    private final Instant deadline;
    private final CountDownLatch doneLatch = new CountDownLatch(1);
    private final AtomicReference<ContextCancelledException.Reason> reason = new AtomicReference<>();
    private final Set<IoContext> children = ConcurrentHashMap.newKeySet();
    private volatile ScheduledFuture<?> timer;

    private IoContext(IoContext parent, Instant deadline) {
        this.parent = parent;
        this.deadline = deadline;
    }

    /**
     * Returns the root context. It is never cancelled and has no deadline.
     */
    public static IoContext background() {
        return BACKGROUND;
    }

    /**
     * Creates a child context that finishes when {@link #cancel()} is called or the parent finishes.
     */
    public static IoContext withCancel(IoContext parent) {
        IoContext child = new IoContext(parent, parent.deadline);
        parent.attach(child);
        return child;
    }

    /**
     * Creates a child context that additionally finishes once the timeout elapses.
     */
    public static IoContext withTimeout(IoContext parent, Duration timeout) {
        return withDeadline(parent, Instant.now().plus(timeout));
    }

    /**
     * Creates a child context that additionally finishes at the given instant.
     * The parent's deadline wins when it is earlier.
     */
    public static IoContext withDeadline(IoContext parent, Instant deadline) {
        if (parent.deadline != null && parent.deadline.isBefore(deadline)) {
            return withCancel(parent);
        }
        IoContext child = new IoContext(parent, deadline);
        parent.attach(child);

        long delayNanos = Duration.between(Instant.now(), deadline).toNanos();
        if (delayNanos <= 0) {
            child.finish(ContextCancelledException.Reason.DEADLINE_EXCEEDED);
        } else if (!child.isDone()) {
            child.timer = TIMER.schedule(
                    () -> child.finish(ContextCancelledException.Reason.DEADLINE_EXCEEDED),
                    delayNanos,
                    TimeUnit.NANOSECONDS);
            if (child.isDone()) {
                child.timer.cancel(false);
            }
        }
        return child;
    }

    /**
     * Cancels this context and all of its descendants. No effect on the background
     * context or on a context that already finished.
     */
    public void cancel() {
        if (this == BACKGROUND) {
            return;
        }
        finish(ContextCancelledException.Reason.CANCELED);
    }

    public boolean isDone() {
        return reason.get() != null;
    }

    /**
     * Returns the exception describing why this context finished, or null while it is live.
     */
    public ContextCancelledException err() {
        ContextCancelledException.Reason r = reason.get();
        return r == null ? null : new ContextCancelledException(r);
    }

    /**
     * Throws {@link ContextCancelledException} if this context finished.
     */
    public void throwIfDone() {
        ContextCancelledException.Reason r = reason.get();
        if (r != null) {
            throw new ContextCancelledException(r);
        }
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * Waits up to the given time for this context to finish.
     *
     * @return true if the context finished
     */
    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        return doneLatch.await(timeout, unit);
    }

    private void attach(IoContext child) {
        if (this == BACKGROUND) {
            return;
        }
        children.add(child);
        // Parent may have finished between the caller's check and the add
        ContextCancelledException.Reason r = reason.get();
        if (r != null) {
            children.remove(child);
            child.finish(r);
        }
    }

    private void finish(ContextCancelledException.Reason why) {
        if (!reason.compareAndSet(null, why)) {
            return;
        }
        doneLatch.countDown();

        ScheduledFuture<?> pending = timer;
        if (pending != null) {
            pending.cancel(false);
        }
        if (parent != null) {
            parent.children.remove(this);
        }
        for (IoContext child : children) {
            child.finish(why);
        }
        children.clear();
    }

    @Override
    public String toString() {
        if (this == BACKGROUND) {
            return "IoContext.background";
        }
        return "IoContext{" +
                "done=" + reason.get() +
                ", deadline=" + deadline +
                '}';
    }
}
