package fr.lapetina.search.transport.infrastructure.http;

import fr.lapetina.search.transport.domain.model.HttpMethod;
import fr.lapetina.search.transport.domain.model.SearchNode;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * One physical HTTP round trip to one node: the fully resolved URL, the
 * encoded body (or {@code null}) and the deadline for this attempt.
 */
public record HttpAttempt(
        SearchNode node,
        HttpMethod method,
        URI uri,
        byte[] body,
        Duration timeout,
        int attemptNumber
) {
    public HttpAttempt {
        Objects.requireNonNull(node, "Node is required");
        Objects.requireNonNull(method, "Method is required");
        Objects.requireNonNull(uri, "URI is required");
        Objects.requireNonNull(timeout, "Timeout is required");
    }

    public boolean hasBody() {
        return body != null;
    }

    @Override
    public String toString() {
        return "HttpAttempt{" +
                "method=" + method +
                ", uri=" + uri +
                ", attempt=" + attemptNumber +
                ", timeoutMs=" + timeout.toMillis() +
                '}';
    }
}
