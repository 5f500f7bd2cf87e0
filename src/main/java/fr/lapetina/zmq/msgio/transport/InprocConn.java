package fr.lapetina.zmq.msgio.transport;

import fr.lapetina.zmq.msgio.domain.context.IoContext;
import fr.lapetina.zmq.msgio.domain.exception.ContextCancelledException;
import fr.lapetina.zmq.msgio.domain.model.Msg;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process connection: one end of a pipe whose other end lives in the same JVM.
 *
 * Messages written on one end are read, in order, on the other. Closing either end
 * makes the peer's reads fail with {@link EOFException} once it has drained what was
 * already delivered, and makes further writes on both ends fail.
 *
 * <pre>{@code
 * InprocConn.Pair pipe = InprocConn.pair("inproc://jobs");
 * writePool.addConn(new MsgWriter(pipe.left()));
 * readPool.addConn(new MsgReader(pipe.right()));
 * }</pre>
 */
public final class InprocConn implements Conn {

    private static final Logger log = LoggerFactory.getLogger(InprocConn.class);

    private static final Duration POLL_SLICE = Duration.ofMillis(20);

    // Identity marker enqueued to wake readers once an end closes
    private static final Msg EOF = Msg.of(new byte[0]);

    private final String id;
    private final BlockingQueue<Msg> inbound = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private InprocConn peer;

    private InprocConn(String id) {
        this.id = id;
    }

    /**
     * Creates a connected pair of in-process connections.
     */
    public static Pair pair(String endpoint) {
        InprocConn left = new InprocConn(endpoint + "#left");
        InprocConn right = new InprocConn(endpoint + "#right");
        left.peer = right;
        right.peer = left;
        return new Pair(left, right);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Msg read(IoContext ctx) throws IOException {
        while (true) {
            if (closed.get()) {
                throw new IOException("Connection closed: " + id);
            }
            ctx.throwIfDone();

            Msg msg;
            try {
                msg = inbound.poll(POLL_SLICE.toNanos(), TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ContextCancelledException(ContextCancelledException.Reason.INTERRUPTED, e);
            }

            if (msg == null) {
                continue;
            }
            if (msg == EOF) {
                // Leave the marker for any later read
                inbound.offer(EOF);
                if (closed.get()) {
                    throw new IOException("Connection closed: " + id);
                }
                throw new EOFException("Peer closed: " + peer.id);
            }
            return msg;
        }
    }

    @Override
    public void write(IoContext ctx, Msg msg) throws IOException {
        ctx.throwIfDone();
        if (closed.get()) {
            throw new IOException("Connection closed: " + id);
        }
        if (peer.closed.get()) {
            throw new EOFException("Peer closed: " + peer.id);
        }
        peer.inbound.offer(msg);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            inbound.offer(EOF);
            peer.inbound.offer(EOF);
            log.debug("Inproc connection closed: id={}", id);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public String toString() {
        return "InprocConn{id='" + id + "', closed=" + closed.get() + '}';
    }

    /**
     * Both ends of an in-process pipe.
     */
    public record Pair(InprocConn left, InprocConn right) {
    }
}
