package fr.lapetina.search.transport.exception;

import fr.lapetina.search.transport.domain.model.ErrorKind;
import fr.lapetina.search.transport.domain.model.SearchNode;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Raised when a response body is not valid JSON.
 *
 * Signals a protocol-level surprise (a proxy error page, a truncated body)
 * rather than an application-level rejection. Carries the raw bytes.
 */
public class MalformedResponseException extends TransportException {

    private static final int MAX_BODY_IN_MESSAGE = 256;

    private final String url;
    private final SearchNode node;
    private final int statusCode;
    private final byte[] rawBody;

    public MalformedResponseException(String url, SearchNode node, int statusCode, byte[] rawBody, Throwable cause) {
        super(ErrorKind.MALFORMED_RESPONSE, buildMessage(url, statusCode, rawBody), cause);
        this.url = url;
        this.node = node;
        this.statusCode = statusCode;
        this.rawBody = rawBody == null ? new byte[0] : rawBody.clone();
    }

    private static String buildMessage(String url, int statusCode, byte[] rawBody) {
        String body = rawBody == null ? "" : new String(rawBody, StandardCharsets.UTF_8);
        if (body.length() > MAX_BODY_IN_MESSAGE) {
            body = body.substring(0, MAX_BODY_IN_MESSAGE) + "...";
        }
        return String.format(Locale.ROOT, "Invalid JSON returned (%d) from URL [%s]: %s", statusCode, url, body);
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

    public byte[] getRawBody() {
        return rawBody.clone();
    }

    public String getRawBodyAsString() {
        return new String(rawBody, StandardCharsets.UTF_8);
    }
}
