package fr.lapetina.zmq.msgio.pool;

import fr.lapetina.zmq.msgio.domain.context.IoContext;
import fr.lapetina.zmq.msgio.domain.model.Msg;
import fr.lapetina.zmq.msgio.transport.MsgReader;

/**
 * Reads messages from a pool of connections as one stream.
 *
 * Implementations must be thread-safe.
 */
public interface ReadPool extends AutoCloseable {

    /**
     * Registers a connection. The first registration releases waiting readers.
     */
    void addConn(MsgReader reader);

    /**
     * Deregisters a connection without closing it.
     */
    void rmConn(MsgReader reader);

    /**
     * Blocks until a message is available from any connection.
     *
     * @throws fr.lapetina.zmq.msgio.domain.exception.ConnectionException if the next message is a connection failure
     * @throws fr.lapetina.zmq.msgio.domain.exception.ContextCancelledException if the context finished first
     * @throws fr.lapetina.zmq.msgio.domain.exception.MsgIoException with POOL_CLOSED after {@link #close()}
     */
    Msg read(IoContext ctx);

    /**
     * Closes every registered connection and stops the pool. Calling it again has no effect.
     *
     * @throws fr.lapetina.zmq.msgio.domain.exception.ConnectionException the first close failure, after all closes were tried
     */
    @Override
    void close();

    /**
     * Returns true once {@link #close()} was called.
     */
    boolean isClosed();
}
