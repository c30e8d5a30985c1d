package fr.lapetina.search.transport.exception;

import fr.lapetina.search.transport.domain.model.ErrorKind;
import fr.lapetina.search.transport.domain.model.SearchNode;

import java.util.List;

/**
 * Raised when no attempt reached a live node within the retry budget.
 *
 * The cause is the transport exception of the last attempt; failures of
 * earlier attempts are attached as suppressed exceptions.
 */
public class ConnectionFailureException extends TransportException {

    private final List<SearchNode> nodesTried;

    public ConnectionFailureException(String message, List<SearchNode> nodesTried, Throwable cause) {
        this(ErrorKind.CONNECTION_FAILURE, message, nodesTried, cause);
    }

    protected ConnectionFailureException(ErrorKind kind, String message, List<SearchNode> nodesTried, Throwable cause) {
        super(kind, message, cause);
        this.nodesTried = List.copyOf(nodesTried);
    }

    /**
     * Returns the node of every attempt, in attempt order. A node appears more
     * than once when it was retried under total outage.
     */
    public List<SearchNode> getNodesTried() {
        return nodesTried;
    }
}
