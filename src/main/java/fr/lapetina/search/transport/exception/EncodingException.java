package fr.lapetina.search.transport.exception;

import fr.lapetina.search.transport.domain.model.ErrorKind;

/**
 * Raised when a value has no defined wire representation.
 * Always a caller bug; never retried.
 */
public class EncodingException extends TransportException {

    private final transient Object offendingValue;

    public EncodingException(Object offendingValue, String message) {
        super(ErrorKind.ENCODING_ERROR, message);
        this.offendingValue = offendingValue;
    }

    public EncodingException(Object offendingValue, String message, Throwable cause) {
        super(ErrorKind.ENCODING_ERROR, message, cause);
        this.offendingValue = offendingValue;
    }

    public Object getOffendingValue() {
        return offendingValue;
    }
}
