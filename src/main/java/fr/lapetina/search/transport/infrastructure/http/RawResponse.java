package fr.lapetina.search.transport.infrastructure.http;

import fr.lapetina.search.transport.domain.model.SearchNode;

/**
 * Status and undecoded body of one HTTP round trip. Lives only until the
 * decoder has classified it.
 */
public record RawResponse(SearchNode node, int statusCode, byte[] body) {

    public RawResponse {
        body = body != null ? body : new byte[0];
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    @Override
    public String toString() {
        return "RawResponse{" +
                "nodeId=" + node.getId() +
                ", status=" + statusCode +
                ", bytes=" + body.length +
                '}';
    }
}
