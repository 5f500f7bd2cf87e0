/**
 * Connection capability and the per-connection adapters the pools consume.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.zmq.msgio.transport.Conn} - A handshaken connection moving whole messages</li>
 *   <li>{@link fr.lapetina.zmq.msgio.transport.MsgReader} - Read-side adapter, turns failures into failed messages</li>
 *   <li>{@link fr.lapetina.zmq.msgio.transport.MsgWriter} - Write-side adapter, turns failures into exceptions</li>
 *   <li>{@link fr.lapetina.zmq.msgio.transport.InprocConn} - In-process pipe connection</li>
 * </ul>
 *
 * <p>Each adapter wraps exactly one connection and owns it: closing the adapter closes the connection.
 */
package fr.lapetina.zmq.msgio.transport;
