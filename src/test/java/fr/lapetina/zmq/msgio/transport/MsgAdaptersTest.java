package fr.lapetina.zmq.msgio.transport;

import fr.lapetina.zmq.msgio.domain.context.IoContext;
import fr.lapetina.zmq.msgio.domain.exception.ConnectionException;
import fr.lapetina.zmq.msgio.domain.model.ErrorType;
import fr.lapetina.zmq.msgio.domain.model.Msg;
import fr.lapetina.zmq.msgio.support.ScriptedConn;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.EOFException;
import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Timeout(10)
class MsgAdaptersTest {

    private final IoContext ctx = IoContext.background();

    @Nested
    @DisplayName("MsgReader")
    class Reader {

        @Test
        @DisplayName("should return the message read from the connection")
        void shouldReturnMessage() {
            MsgReader reader = new MsgReader(new ScriptedConn("c1").thenRead("hello", "world"));

            assertThat(reader.read(ctx)).isEqualTo(Msg.ofStrings("hello", "world"));
        }

        @Test
        @DisplayName("should turn a transport failure into a failed message")
        void shouldReturnFailedMessage() {
            MsgReader reader = new MsgReader(new ScriptedConn("c1").thenFail(new IOException("reset")));

            Msg msg = reader.read(ctx);

            assertThat(msg.isFailed()).isTrue();
            assertThat(msg.error()).isInstanceOf(ConnectionException.class);
            ConnectionException error = (ConnectionException) msg.error();
            assertThat(error.getReason()).isEqualTo(ConnectionException.Reason.READ_FAILED);
            assertThat(error.getConnectionId()).isEqualTo("c1");
            assertThat(error.getErrorType()).isEqualTo(ErrorType.CONNECTION_ERROR);
        }

        @Test
        @DisplayName("should report a peer close")
        void shouldReportPeerClose() {
            MsgReader reader = new MsgReader(new ScriptedConn("c1").thenFail(new EOFException()));

            ConnectionException error = (ConnectionException) reader.read(ctx).error();

            assertThat(error.getReason()).isEqualTo(ConnectionException.Reason.PEER_CLOSED);
        }

        @Test
        @DisplayName("should close the connection only once")
        void shouldCloseOnce() {
            ScriptedConn conn = new ScriptedConn("c1");
            MsgReader reader = new MsgReader(conn);

            reader.close();
            reader.close();

            assertThat(conn.closeCalls()).isEqualTo(1);
            assertThat(reader.isClosed()).isTrue();
        }

        @Test
        @DisplayName("should report a close failure once")
        void shouldReportCloseFailure() {
            ScriptedConn conn = new ScriptedConn("c1").failClose(new IOException("busy"));
            MsgReader reader = new MsgReader(conn);

            assertThatThrownBy(reader::close)
                    .isInstanceOf(ConnectionException.class)
                    .satisfies(e -> assertThat(((ConnectionException) e).getErrorType())
                            .isEqualTo(ErrorType.CLOSE_ERROR));
            reader.close();

            assertThat(conn.closeCalls()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("MsgWriter")
    class Writer {

        @Test
        @DisplayName("should write the message to the connection")
        void shouldWriteMessage() {
            ScriptedConn conn = new ScriptedConn("c1");
            MsgWriter writer = new MsgWriter(conn);

            writer.write(ctx, Msg.ofStrings("x"));

            assertThat(conn.writtenStrings()).containsExactly("x");
            assertThat(writer.connectionId()).isEqualTo("c1");
        }

        @Test
        @DisplayName("should throw a connection exception on write failure")
        void shouldThrowOnWriteFailure() {
            MsgWriter writer = new MsgWriter(new ScriptedConn("c1").failWrites(true));

            assertThatThrownBy(() -> writer.write(ctx, Msg.ofStrings("x")))
                    .isInstanceOf(ConnectionException.class)
                    .extracting(e -> ((ConnectionException) e).getReason())
                    .isEqualTo(ConnectionException.Reason.WRITE_FAILED);
        }

        @Test
        @DisplayName("should report a closed peer")
        void shouldReportClosedPeer() {
            InprocConn.Pair pair = InprocConn.pair("inproc://w");
            MsgWriter writer = new MsgWriter(pair.left());
            pair.right().close();

            assertThatThrownBy(() -> writer.write(ctx, Msg.ofStrings("x")))
                    .isInstanceOf(ConnectionException.class)
                    .extracting(e -> ((ConnectionException) e).getReason())
                    .isEqualTo(ConnectionException.Reason.PEER_CLOSED);
        }

        @Test
        @DisplayName("should close the connection only once")
        void shouldCloseOnce() {
            ScriptedConn conn = new ScriptedConn("c1");
            MsgWriter writer = new MsgWriter(conn);

            writer.close();
            writer.close();

            assertThat(conn.closeCalls()).isEqualTo(1);
        }
    }
}
