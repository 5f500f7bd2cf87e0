package fr.lapetina.zmq.msgio.domain.model;

/**
 * Error taxonomy for pool and connection operations.
 * Provides clear categorization for error handling and metrics.
 */
public enum ErrorType {
    /** Read or write failure on a single connection (I/O error, peer closed) */
    CONNECTION_ERROR,

    /** The operation's context was cancelled */
    CANCELLED,

    /** The operation's context deadline expired */
    DEADLINE_EXCEEDED,

    /** One or more connections failed to close */
    CLOSE_ERROR,

    /** The pool was closed before or during the operation */
    POOL_CLOSED,

    /** Internal system error */
    INTERNAL_ERROR
}
