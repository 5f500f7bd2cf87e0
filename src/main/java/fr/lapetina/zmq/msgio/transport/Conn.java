package fr.lapetina.zmq.msgio.transport;

import fr.lapetina.zmq.msgio.domain.context.IoContext;
import fr.lapetina.zmq.msgio.domain.model.Msg;

import java.io.Closeable;
import java.io.IOException;

/**
 * A transport connection able to move one complete message at a time.
 *
 * Connections are supplied already handshaken by the transport layer. Framing and
 * security happen below this interface.
 *
 * Implementations must allow one concurrent reader and one concurrent writer.
 */
public interface Conn extends Closeable {

    /**
     * Returns an identifier for logs and metrics (typically the remote endpoint).
     */
    String id();

    /**
     * Blocks until one complete message has been read.
     *
     * @throws java.io.EOFException if the peer closed the connection
     * @throws IOException on any other transport failure
     */
    Msg read(IoContext ctx) throws IOException;

    /**
     * Blocks until one complete message has been written.
     *
     * @throws IOException on transport failure
     */
    void write(IoContext ctx, Msg msg) throws IOException;

    /**
     * Releases the connection. Pending reads and writes fail.
     */
    @Override
    void close() throws IOException;
}
