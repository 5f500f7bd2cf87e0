/**
 * Message I/O multiplexing for socket-like endpoints.
 *
 * <p>This library lets a socket hold many connections at once and expose them as a
 * single blocking message stream: reads are merged from all connections, writes are
 * either broadcast to every connection or load-balanced across them.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.zmq.msgio.MsgIoFactory} - Main entry point for creating
 *       pools from YAML configuration</li>
 *   <li>{@link fr.lapetina.zmq.msgio.pool.ReadPool} - Fan-in reading</li>
 *   <li>{@link fr.lapetina.zmq.msgio.pool.WritePool} - Broadcast or load-balanced writing</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * IoContext ctx = IoContext.background();
 * try (MsgIoFactory factory = MsgIoFactory.create("msgio.yaml")) {
 *     ReadPool in = factory.newReadPool(ctx, "pull");
 *     in.addConn(new MsgReader(conn));
 *     Msg msg = in.read(ctx);
 * }
 * }</pre>
 *
 * @see fr.lapetina.zmq.msgio.MsgIoFactory
 * @see fr.lapetina.zmq.msgio.pool.PoolFactory
 */
package fr.lapetina.zmq.msgio;
