package fr.lapetina.search.transport.exception;

import fr.lapetina.search.transport.domain.model.ErrorKind;
import fr.lapetina.search.transport.domain.model.SearchNode;

import java.util.List;

/**
 * A {@link ConnectionFailureException} whose last attempt exceeded the
 * per-attempt timeout rather than failing to connect.
 */
public class RequestTimeoutException extends ConnectionFailureException {

    public RequestTimeoutException(String message, List<SearchNode> nodesTried, Throwable cause) {
        super(ErrorKind.TIMEOUT, message, nodesTried, cause);
    }
}
