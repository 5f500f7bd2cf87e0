/**
 * Exceptions surfaced by connections and pools.
 *
 * <p>All exceptions are unchecked and carry an {@link fr.lapetina.zmq.msgio.domain.model.ErrorType}.
 * {@link fr.lapetina.zmq.msgio.domain.exception.ConnectionException} reports a fault on one connection,
 * {@link fr.lapetina.zmq.msgio.domain.exception.ContextCancelledException} reports cancellation,
 * a deadline or an interrupt.
 */
package fr.lapetina.zmq.msgio.domain.exception;
