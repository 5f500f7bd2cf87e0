package fr.lapetina.zmq.msgio.pool;

import fr.lapetina.zmq.msgio.domain.context.IoContext;
import fr.lapetina.zmq.msgio.domain.model.Msg;
import fr.lapetina.zmq.msgio.transport.MsgWriter;

/**
 * Writes messages to a pool of connections according to a distribution policy.
 *
 * Implementations must be thread-safe.
 */
public interface WritePool extends AutoCloseable {

    /**
     * Registers a connection. The first registration releases waiting writers.
     */
    void addConn(MsgWriter writer);

    /**
     * Deregisters a connection.
     */
    void rmConn(MsgWriter writer);

    /**
     * Blocks until the message has been handed over according to the pool's policy.
     *
     * @throws fr.lapetina.zmq.msgio.domain.exception.ContextCancelledException if the context finished first
     * @throws fr.lapetina.zmq.msgio.domain.exception.MsgIoException with POOL_CLOSED after {@link #close()}
     */
    void write(IoContext ctx, Msg msg);

    /**
     * Closes every registered connection and stops the pool. Calling it again has no effect.
     */
    @Override
    void close();

    /**
     * Returns true once {@link #close()} was called.
     */
    boolean isClosed();
}
