package fr.lapetina.search.transport.exception;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.search.transport.domain.model.ErrorKind;
import fr.lapetina.search.transport.domain.model.HttpMethod;
import fr.lapetina.search.transport.domain.model.SearchNode;

import java.util.Locale;

/**
 * Raised when a node answers with a non-2xx status and a JSON body.
 *
 * The node answered, so it is alive: this is an application-level rejection
 * and is never retried against another node.
 */
public class HttpErrorException extends TransportException {

    private final HttpMethod method;
    private final String url;
    private final SearchNode node;
    private final int statusCode;
    private final JsonNode body;

    public HttpErrorException(HttpMethod method, String url, SearchNode node, int statusCode, JsonNode body) {
        super(ErrorKind.HTTP_ERROR, buildMessage(method, url, statusCode, body));
        this.method = method;
        this.url = url;
        this.node = node;
        this.statusCode = statusCode;
        this.body = body;
    }

    private static String buildMessage(HttpMethod method, String url, int statusCode, JsonNode body) {
        return String.format(Locale.ROOT, "Non-OK response returned (%d): method [%s], URL [%s], error [%s]",
                statusCode, method, url, errorOf(body));
    }

    private static JsonNode errorOf(JsonNode body) {
        if (body != null && body.has("error")) {
            return body.get("error");
        }
        return body;
    }

    public HttpMethod getMethod() {
        return method;
    }

    public String getUrl() {
        return url;
    }

    public SearchNode getNode() {
        return node;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Returns the whole decoded response body.
     */
    public JsonNode getBody() {
        return body;
    }

    /**
     * Returns the {@code error} member of the body, or the whole body when it has none.
     */
    public JsonNode getError() {
        return errorOf(body);
    }
}
