package fr.lapetina.search.transport.exception;

import fr.lapetina.search.transport.domain.model.ErrorKind;

/**
 * Raised when the calling thread is interrupted during an attempt.
 * Terminal: the interrupted attempt is not retried and its node is not marked dead.
 */
public class RequestCancelledException extends TransportException {

    public RequestCancelledException(String message, Throwable cause) {
        super(ErrorKind.CANCELLED, message, cause);
    }
}
