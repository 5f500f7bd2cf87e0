package fr.lapetina.zmq.msgio.pool;

import fr.lapetina.zmq.msgio.domain.context.IoContext;
import fr.lapetina.zmq.msgio.domain.exception.ConnectionException;
import fr.lapetina.zmq.msgio.domain.exception.ContextCancelledException;
import fr.lapetina.zmq.msgio.domain.exception.MsgIoException;
import fr.lapetina.zmq.msgio.domain.model.ErrorType;
import fr.lapetina.zmq.msgio.domain.model.Msg;
import fr.lapetina.zmq.msgio.infrastructure.metrics.PoolMetrics;
import fr.lapetina.zmq.msgio.support.Await;
import fr.lapetina.zmq.msgio.support.ScriptedConn;
import fr.lapetina.zmq.msgio.transport.MsgWriter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Timeout(20)
class BroadcastWritePoolTest {

    private static final String POOL = "pub";

    private final IoContext ctx = IoContext.background();
    private PoolMetrics metrics;
    private BroadcastWritePool pool;

    @BeforeEach
    void setUp() {
        metrics = new PoolMetrics("zmq_msgio", new SimpleMeterRegistry());
        pool = newPool(true);
    }

    @AfterEach
    void tearDown() {
        pool.close();
    }

    private BroadcastWritePool newPool(boolean evict) {
        PoolOptions options = PoolOptions.builder()
                .pollInterval(Duration.ofMillis(5))
                .evictFailedConnections(evict)
                .build();
        return new BroadcastWritePool(POOL, ctx, options, metrics);
    }

    @Nested
    @DisplayName("Fan-out")
    class FanOut {

        @Test
        @DisplayName("should block write until the first connection is added")
        void shouldBlockUntilFirstConnection() throws Exception {
            ScriptedConn conn = new ScriptedConn("c1");
            CompletableFuture<Void> writer = CompletableFuture.runAsync(() -> pool.write(ctx, Msg.ofStrings("x")));

            Thread.sleep(100);
            assertThat(writer).isNotDone();

            pool.addConn(new MsgWriter(conn));

            writer.get(2, TimeUnit.SECONDS);
            assertThat(conn.writtenStrings()).containsExactly("x");
        }

        @Test
        @DisplayName("should deliver every message to every connection in order")
        void shouldDeliverToEveryConnection() {
            List<ScriptedConn> conns = List.of(new ScriptedConn("c1"), new ScriptedConn("c2"), new ScriptedConn("c3"));
            conns.forEach(conn -> pool.addConn(new MsgWriter(conn)));

            List<String> sent = IntStream.range(0, 20).mapToObj(i -> "m" + i).toList();
            sent.forEach(s -> pool.write(ctx, Msg.ofStrings(s)));

            for (ScriptedConn conn : conns) {
                assertThat(conn.writtenStrings()).containsExactlyElementsOf(sent);
            }
            assertThat(metrics.count("_messages_sent_total", POOL)).isEqualTo(60);
        }

        @Test
        @DisplayName("should succeed once ready even with no connection left")
        void shouldSucceedWithoutConnections() {
            MsgWriter writer = new MsgWriter(new ScriptedConn("c1"));
            pool.addConn(writer);
            pool.rmConn(writer);

            pool.write(ctx, Msg.ofStrings("nobody"));

            assertThat(pool.connectionCount()).isZero();
        }

        @Test
        @DisplayName("should honor a cancelled context")
        void shouldHonorCancelledContext() {
            ScriptedConn conn = new ScriptedConn("c1");
            pool.addConn(new MsgWriter(conn));
            IoContext cancelled = IoContext.withCancel(ctx);
            cancelled.cancel();

            assertThatThrownBy(() -> pool.write(cancelled, Msg.ofStrings("x")))
                    .isInstanceOf(ContextCancelledException.class);
            assertThat(conn.writtenStrings()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Partial failure")
    class PartialFailure {

        @Test
        @DisplayName("should return the failure and still deliver to healthy connections")
        void shouldDeliverToHealthyConnections() {
            ScriptedConn c1 = new ScriptedConn("c1");
            ScriptedConn c2 = new ScriptedConn("c2").failWrites(true);
            ScriptedConn c3 = new ScriptedConn("c3");
            pool.addConn(new MsgWriter(c1));
            pool.addConn(new MsgWriter(c2));
            pool.addConn(new MsgWriter(c3));

            assertThatThrownBy(() -> pool.write(ctx, Msg.ofStrings("x")))
                    .isInstanceOf(ConnectionException.class)
                    .satisfies(e -> assertThat(((ConnectionException) e).getConnectionId()).isEqualTo("c2"));

            assertThat(c1.writtenStrings()).containsExactly("x");
            assertThat(c3.writtenStrings()).containsExactly("x");
        }

        @Test
        @DisplayName("should evict and close the failed connection")
        void shouldEvictFailedConnection() {
            ScriptedConn c1 = new ScriptedConn("c1");
            ScriptedConn c2 = new ScriptedConn("c2").failWrites(true);
            pool.addConn(new MsgWriter(c1));
            pool.addConn(new MsgWriter(c2));

            assertThatThrownBy(() -> pool.write(ctx, Msg.ofStrings("x")))
                    .isInstanceOf(ConnectionException.class);

            assertThat(pool.connectionCount()).isEqualTo(1);
            assertThat(c2.isClosed()).isTrue();
            assertThat(metrics.count("_evictions_total", POOL)).isEqualTo(1);

            pool.write(ctx, Msg.ofStrings("y"));

            assertThat(c1.writtenStrings()).containsExactly("x", "y");
            assertThat(c2.writeAttempts()).isEqualTo(1);
        }

        @Test
        @DisplayName("should keep the failed connection when eviction is disabled")
        void shouldKeepFailedConnectionWithoutEviction() {
            pool.close();
            metrics = new PoolMetrics("zmq_msgio", new SimpleMeterRegistry());
            pool = newPool(false);
            ScriptedConn c1 = new ScriptedConn("c1").failWrites(true);
            pool.addConn(new MsgWriter(c1));

            assertThatThrownBy(() -> pool.write(ctx, Msg.ofStrings("x"))).isInstanceOf(ConnectionException.class);
            assertThatThrownBy(() -> pool.write(ctx, Msg.ofStrings("y"))).isInstanceOf(ConnectionException.class);

            assertThat(pool.connectionCount()).isEqualTo(1);
            assertThat(c1.writeAttempts()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Close")
    class Close {

        @Test
        @DisplayName("should close every connection once")
        void shouldCloseEveryConnection() {
            ScriptedConn c1 = new ScriptedConn("c1");
            ScriptedConn c2 = new ScriptedConn("c2");
            pool.addConn(new MsgWriter(c1));
            pool.addConn(new MsgWriter(c2));

            pool.close();
            pool.close();

            assertThat(c1.closeCalls()).isEqualTo(1);
            assertThat(c2.closeCalls()).isEqualTo(1);
            assertThat(pool.isClosed()).isTrue();
        }

        @Test
        @DisplayName("should reject writes after close")
        void shouldRejectWritesAfterClose() {
            pool.close();

            assertThatThrownBy(() -> pool.write(ctx, Msg.ofStrings("x")))
                    .isInstanceOf(MsgIoException.class)
                    .extracting(e -> ((MsgIoException) e).getErrorType())
                    .isEqualTo(ErrorType.POOL_CLOSED);
        }

        @Test
        @DisplayName("should release writers waiting for readiness")
        void shouldReleaseWaitingWriters() throws Exception {
            CompletableFuture<Throwable> writer = CompletableFuture.supplyAsync(() -> {
                try {
                    pool.write(ctx, Msg.ofStrings("x"));
                    return null;
                } catch (MsgIoException e) {
                    return e;
                }
            });
            Thread.sleep(50);

            pool.close();

            assertThat(writer.get(2, TimeUnit.SECONDS))
                    .isInstanceOf(MsgIoException.class)
                    .extracting(e -> ((MsgIoException) e).getErrorType())
                    .isEqualTo(ErrorType.POOL_CLOSED);
        }

        @Test
        @DisplayName("should not wait for a stalled write")
        void shouldNotWaitForStalledWrite() throws Exception {
            ScriptedConn stalled = new ScriptedConn("stalled").holdWrites();
            pool.addConn(new MsgWriter(stalled));
            CompletableFuture<Throwable> writer = CompletableFuture.supplyAsync(() -> {
                try {
                    pool.write(ctx, Msg.ofStrings("x"));
                    return null;
                } catch (MsgIoException e) {
                    return e;
                }
            });
            Await.until(() -> stalled.writeAttempts() == 1);

            CompletableFuture.runAsync(pool::close).get(3, TimeUnit.SECONDS);

            assertThat(stalled.isClosed()).isTrue();
            assertThat(stalled.writtenStrings()).isEmpty();
            assertThat(writer.get(2, TimeUnit.SECONDS))
                    .isInstanceOf(MsgIoException.class)
                    .extracting(e -> ((MsgIoException) e).getErrorType())
                    .isEqualTo(ErrorType.POOL_CLOSED);
        }
    }
}
