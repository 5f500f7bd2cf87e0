package fr.lapetina.zmq.msgio.pool;

import fr.lapetina.zmq.msgio.domain.exception.ContextCancelledException;
import fr.lapetina.zmq.msgio.domain.exception.MsgIoException;
import fr.lapetina.zmq.msgio.domain.model.ErrorType;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs a batch of tasks concurrently and joins them, keeping the first failure.
 *
 * Every task runs to completion regardless of the others' outcome.
 */
final class TaskGroup {

    private final Executor executor;
    private final List<CompletableFuture<Void>> tasks = new ArrayList<>();
    private final AtomicReference<RuntimeException> firstFailure = new AtomicReference<>();

    TaskGroup(Executor executor) {
        this.executor = executor;
    }

    void go(Runnable task) {
        tasks.add(CompletableFuture.runAsync(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                firstFailure.compareAndSet(null, e);
                throw e;
            }
        }, executor));
    }

    /**
     * Waits for every task.
     *
     * @return the first failure recorded, or null if all tasks succeeded
     */
    RuntimeException await() {
        try {
            CompletableFuture.allOf(tasks.toArray(new CompletableFuture<?>[0])).get();
        } catch (ExecutionException e) {
            // Runtime failures are already recorded in completion order; anything else is not
            firstFailure.compareAndSet(null,
                    new MsgIoException(ErrorType.INTERNAL_ERROR, "Task failed", e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ContextCancelledException(ContextCancelledException.Reason.INTERRUPTED, e);
        }
        return firstFailure.get();
    }
}
