package fr.lapetina.zmq.msgio.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Threads owned by one pool: one long-running worker per connection, plus short
 * tasks such as concurrent writes and closes.
 */
final class WorkerGroup implements Executor {

    private static final Logger log = LoggerFactory.getLogger(WorkerGroup.class);

    private final String poolName;
    private final ExecutorService executor;
    private final AtomicInteger activeWorkers = new AtomicInteger(0);

    WorkerGroup(String poolName) {
        this.poolName = poolName;
        this.executor = Executors.newCachedThreadPool(new WorkerThreadFactory("msgio-" + poolName));
    }

    /**
     * Starts a long-running worker.
     *
     * @return false if the group is shut down
     */
    boolean startWorker(Runnable worker) {
        activeWorkers.incrementAndGet();
        try {
            executor.execute(() -> {
                try {
                    worker.run();
                } finally {
                    activeWorkers.decrementAndGet();
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            activeWorkers.decrementAndGet();
            return false;
        }
    }

    /**
     * Runs a short task on the group's threads.
     */
    @Override
    public void execute(Runnable task) {
        executor.execute(task);
    }

    int activeWorkers() {
        return activeWorkers.get();
    }

    /**
     * Stops accepting work and waits for running workers, interrupting them after the timeout.
     */
    void shutdown(Duration timeout) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Workers did not stop in time, interrupting: pool={}, activeWorkers={}",
                        poolName, activeWorkers.get());
                executor.shutdownNow();
                if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.error("Workers still running after interrupt: pool={}, activeWorkers={}",
                            poolName, activeWorkers.get());
                }
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
