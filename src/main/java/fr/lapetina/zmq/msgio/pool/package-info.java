/**
 * Connection pools that turn many connections into one message stream.
 *
 * <h2>Pool Kinds</h2>
 * <ul>
 *   <li>{@code fan-in} ({@link fr.lapetina.zmq.msgio.pool.QueuedReadPool}) - Merges reads from
 *       all connections through a bounded queue</li>
 *   <li>{@code broadcast} ({@link fr.lapetina.zmq.msgio.pool.BroadcastWritePool}) - Writes every
 *       message to every connection</li>
 *   <li>{@code load-balance} ({@link fr.lapetina.zmq.msgio.pool.LoadBalancedWritePool}) - Writes
 *       each message to exactly one connection, requeueing on failure</li>
 * </ul>
 *
 * <h2>Readiness</h2>
 * <p>Every pool holds {@code read}/{@code write} callers on a
 * {@link fr.lapetina.zmq.msgio.pool.ReadinessGate} until the first connection is added.
 *
 * <h2>Thread Safety</h2>
 * <p>All pools are safe for concurrent use. Each connection is served by its own worker
 * thread; blocking operations honor an {@link fr.lapetina.zmq.msgio.domain.context.IoContext}
 * with a latency bounded by the configured poll interval.
 */
package fr.lapetina.zmq.msgio.pool;
