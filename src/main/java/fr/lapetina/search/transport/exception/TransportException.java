package fr.lapetina.search.transport.exception;

import fr.lapetina.search.transport.domain.model.ErrorKind;

/**
 * Base class for every failure raised by the transport.
 *
 * Callers branch on the concrete subclass or on {@link #getKind()}; the
 * message is for humans only.
 */
public abstract class TransportException extends RuntimeException {

    private final ErrorKind kind;

    protected TransportException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected TransportException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
