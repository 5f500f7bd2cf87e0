package fr.lapetina.zmq.msgio.domain.exception;

import fr.lapetina.zmq.msgio.domain.model.ErrorType;

/**
 * Base exception for every failure surfaced by the multiplexing pools.
 */
public class MsgIoException extends RuntimeException {

    private final ErrorType errorType;

    public MsgIoException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public MsgIoException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    /**
     * Creates the exception raised by operations on a closed pool.
     */
    public static MsgIoException poolClosed(String poolName) {
        return new MsgIoException(ErrorType.POOL_CLOSED, "Pool is closed: " + poolName);
    }
}
