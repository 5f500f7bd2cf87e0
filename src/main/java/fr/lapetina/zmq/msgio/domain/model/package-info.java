/**
 * Domain model shared by connections and pools.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.zmq.msgio.domain.model.Msg} - Immutable multi-frame message, optionally carrying a read failure</li>
 *   <li>{@link fr.lapetina.zmq.msgio.domain.model.ErrorType} - Categorized error types for exceptions and metrics</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>{@code Msg} is immutable and may be handed between worker threads freely.
 */
package fr.lapetina.zmq.msgio.domain.model;
