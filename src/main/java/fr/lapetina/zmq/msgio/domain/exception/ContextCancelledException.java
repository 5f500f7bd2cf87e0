package fr.lapetina.zmq.msgio.domain.exception;

import fr.lapetina.zmq.msgio.domain.model.ErrorType;

/**
 * Exception thrown when an operation's context finished before the operation completed.
 *
 * Distinct from {@link ConnectionException}: cancellation is never a connection fault,
 * and workers observing it exit without further side effects.
 */
public final class ContextCancelledException extends MsgIoException {

    private final Reason reason;

    public ContextCancelledException(Reason reason) {
        super(reason.errorType, "Context done: " + reason.getMessage());
        this.reason = reason;
    }

    public ContextCancelledException(Reason reason, Throwable cause) {
        super(reason.errorType, "Context done: " + reason.getMessage(), cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public enum Reason {
        CANCELED("context canceled", ErrorType.CANCELLED),
        DEADLINE_EXCEEDED("context deadline exceeded", ErrorType.DEADLINE_EXCEEDED),
        INTERRUPTED("thread interrupted", ErrorType.CANCELLED);

        private final String message;
        private final ErrorType errorType;

        Reason(String message, ErrorType errorType) {
            this.message = message;
            this.errorType = errorType;
        }

        public String getMessage() {
            return message;
        }
    }
}
