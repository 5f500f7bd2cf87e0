package fr.lapetina.zmq.msgio.domain.exception;

import fr.lapetina.zmq.msgio.domain.model.ErrorType;

/**
 * Exception thrown when a single connection fails.
 *
 * This occurs when:
 * - Reading a complete message fails or the peer closed the stream
 * - Writing a complete message fails
 * - Releasing the underlying connection fails
 *
 * The failure is local to one connection; the pool it belongs to stays usable.
 */
public final class ConnectionException extends MsgIoException {

    private final Reason reason;
    private final String connectionId;

    public ConnectionException(Reason reason, String connectionId, Throwable cause) {
        super(reason.errorType(),
                "Connection failure: " + reason.getMessage() + " - connectionId=" + connectionId,
                cause);
        this.reason = reason;
        this.connectionId = connectionId;
    }

    public Reason getReason() {
        return reason;
    }

    public String getConnectionId() {
        return connectionId;
    }

    public enum Reason {
        READ_FAILED("Failed to read message"),
        WRITE_FAILED("Failed to write message"),
        PEER_CLOSED("Peer closed the connection"),
        CLOSE_FAILED("Failed to close connection");

        private final String message;

        Reason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }

        ErrorType errorType() {
            return this == CLOSE_FAILED ? ErrorType.CLOSE_ERROR : ErrorType.CONNECTION_ERROR;
        }
    }
}
