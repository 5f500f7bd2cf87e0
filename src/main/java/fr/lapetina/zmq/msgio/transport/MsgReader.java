package fr.lapetina.zmq.msgio.transport;

import fr.lapetina.zmq.msgio.domain.context.IoContext;
import fr.lapetina.zmq.msgio.domain.exception.ConnectionException;
import fr.lapetina.zmq.msgio.domain.model.Msg;

import java.io.EOFException;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Reads complete messages from one connection.
 *
 * A transport failure does not escape as an exception: it comes back as a failed
 * {@link Msg} whose {@link Msg#error()} is a {@link ConnectionException}, so the
 * failure can travel through a pool queue like any other message.
 */
public final class MsgReader implements AutoCloseable {

    private final Conn conn;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public MsgReader(Conn conn) {
        this.conn = Objects.requireNonNull(conn, "conn");
    }

    /**
     * Reads exactly one message.
     *
     * @return the message, or a failed message if the connection failed
     * @throws fr.lapetina.zmq.msgio.domain.exception.ContextCancelledException if the context finished first
     */
    public Msg read(IoContext ctx) {
        try {
            return conn.read(ctx);
        } catch (EOFException e) {
            return Msg.failed(new ConnectionException(ConnectionException.Reason.PEER_CLOSED, conn.id(), e));
        } catch (IOException e) {
            return Msg.failed(new ConnectionException(ConnectionException.Reason.READ_FAILED, conn.id(), e));
        }
    }

    /**
     * Closes the underlying connection. Only the first call has an effect.
     *
     * @throws ConnectionException if the connection failed to close
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            conn.close();
        } catch (IOException e) {
            throw new ConnectionException(ConnectionException.Reason.CLOSE_FAILED, conn.id(), e);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    public String connectionId() {
        return conn.id();
    }

    @Override
    public String toString() {
        return "MsgReader{conn=" + conn.id() + '}';
    }
}
