package fr.lapetina.zmq.msgio.pool;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry behavior of the load-balanced write pool.
 *
 * <ul>
 *   <li>{@code maxAttempts} - write attempts per message before it is dropped (0 = unbounded)</li>
 *   <li>{@code evictionThreshold} - consecutive failures after which a connection evicts itself (0 = never)</li>
 *   <li>{@code backoff} - pause of a worker after a failed write</li>
 * </ul>
 *
 * The default, {@link #unbounded()}, never drops a message and never evicts a connection:
 * a message whose only connection keeps failing is retried indefinitely.
 */
public final class RetryPolicy {

    private static final RetryPolicy UNBOUNDED = new RetryPolicy(0, 0, Duration.ZERO);

    private final int maxAttempts;
    private final int evictionThreshold;
    private final Duration backoff;

    private RetryPolicy(int maxAttempts, int evictionThreshold, Duration backoff) {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0: " + maxAttempts);
        }
        if (evictionThreshold < 0) {
            throw new IllegalArgumentException("evictionThreshold must be >= 0: " + evictionThreshold);
        }
        if (backoff.isNegative()) {
            throw new IllegalArgumentException("backoff must not be negative: " + backoff);
        }
        this.maxAttempts = maxAttempts;
        this.evictionThreshold = evictionThreshold;
        this.backoff = backoff;
    }

    public static RetryPolicy unbounded() {
        return UNBOUNDED;
    }

    public static RetryPolicy of(int maxAttempts, int evictionThreshold, Duration backoff) {
        return new RetryPolicy(maxAttempts, evictionThreshold, Objects.requireNonNull(backoff, "backoff"));
    }

    /**
     * Returns true once a message has used up its attempts.
     */
    public boolean isExhausted(int attempts) {
        return maxAttempts > 0 && attempts >= maxAttempts;
    }

    /**
     * Returns true once a connection has failed often enough in a row to be removed.
     */
    public boolean shouldEvict(int consecutiveFailures) {
        return evictionThreshold > 0 && consecutiveFailures >= evictionThreshold;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public int getEvictionThreshold() {
        return evictionThreshold;
    }

    public Duration getBackoff() {
        return backoff;
    }

    @Override
    public String toString() {
        return "RetryPolicy{" +
                "maxAttempts=" + maxAttempts +
                ", evictionThreshold=" + evictionThreshold +
                ", backoff=" + backoff +
                '}';
    }
}
