package fr.lapetina.zmq.msgio.transport;

import fr.lapetina.zmq.msgio.domain.context.IoContext;
import fr.lapetina.zmq.msgio.domain.exception.ConnectionException;
import fr.lapetina.zmq.msgio.domain.model.Msg;

import java.io.EOFException;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Writes complete messages to one connection.
 */
public final class MsgWriter implements AutoCloseable {

    private final Conn conn;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public MsgWriter(Conn conn) {
        this.conn = Objects.requireNonNull(conn, "conn");
    }

    /**
     * Writes exactly one message.
     *
     * @throws ConnectionException if the connection failed
     * @throws fr.lapetina.zmq.msgio.domain.exception.ContextCancelledException if the context finished first
     */
    public void write(IoContext ctx, Msg msg) {
        try {
            conn.write(ctx, msg);
        } catch (EOFException e) {
            throw new ConnectionException(ConnectionException.Reason.PEER_CLOSED, conn.id(), e);
        } catch (IOException e) {
            throw new ConnectionException(ConnectionException.Reason.WRITE_FAILED, conn.id(), e);
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
        return "MsgWriter{conn=" + conn.id() + '}';
    }
}
