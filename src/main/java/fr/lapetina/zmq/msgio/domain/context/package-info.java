/**
 * Cancellation contexts observed by every blocking pool operation.
 *
 * @see fr.lapetina.zmq.msgio.domain.context.IoContext
 */
package fr.lapetina.zmq.msgio.domain.context;
