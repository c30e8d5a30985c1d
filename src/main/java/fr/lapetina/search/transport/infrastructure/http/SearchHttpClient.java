package fr.lapetina.search.transport.infrastructure.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.concurrent.CompletableFuture;

/**
 * HTTP client for single round trips to search nodes.
 *
 * Uses java.net.http.HttpClient, which pools connections per node. Each call
 * reads the full body before returning, so no connection is held once an
 * attempt is over. Retries and node choice are the executor's job.
 *
 * Owns no resources of its own; {@link #close()} does nothing.
 */
public class SearchHttpClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SearchHttpClient.class);

    static final String CONTENT_TYPE_JSON = "application/json";

    private final HttpClient httpClient;
    private final String authorization;

    /**
     * @param connectTimeout Bound on establishing a TCP connection
     * @param username       Basic-auth user, or {@code null} for anonymous access
     * @param password       Basic-auth password
     */
    public SearchHttpClient(Duration connectTimeout, String username, String password) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
        this.authorization = username != null
                ? basicAuthorization(username, password == null ? "" : password)
                : null;
    }

    public SearchHttpClient(Duration connectTimeout) {
        this(connectTimeout, null, null);
    }

    public SearchHttpClient() {
        this(Duration.ofSeconds(60));
    }

    static String basicAuthorization(String username, String password) {
        String token = username + ":" + password;
        return "Basic " + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Performs one blocking round trip.
     *
     * @throws IOException          on connection failure, reset or timeout
     * @throws InterruptedException if the calling thread is interrupted
     */
    public RawResponse send(HttpAttempt attempt) throws IOException, InterruptedException {
        HttpResponse<byte[]> response = httpClient.send(buildHttpRequest(attempt), HttpResponse.BodyHandlers.ofByteArray());
        log.debug("Response received: nodeId={}, status={}, attempt={}",
                attempt.node().getId(), response.statusCode(), attempt.attemptNumber());
        return new RawResponse(attempt.node(), response.statusCode(), response.body());
    }

    /**
     * Performs one non-blocking round trip. Cancelling the returned future
     * aborts the exchange.
     */
    public CompletableFuture<RawResponse> sendAsync(HttpAttempt attempt) {
        return httpClient.sendAsync(buildHttpRequest(attempt), HttpResponse.BodyHandlers.ofByteArray())
                .thenApply(response -> {
                    log.debug("Response received: nodeId={}, status={}, attempt={}",
                            attempt.node().getId(), response.statusCode(), attempt.attemptNumber());
                    return new RawResponse(attempt.node(), response.statusCode(), response.body());
                });
    }

    HttpRequest buildHttpRequest(HttpAttempt attempt) {
        HttpRequest.BodyPublisher publisher = attempt.hasBody()
                ? HttpRequest.BodyPublishers.ofByteArray(attempt.body())
                : HttpRequest.BodyPublishers.noBody();

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(attempt.uri())
                .timeout(attempt.timeout())
                .header("Accept", CONTENT_TYPE_JSON)
                .method(attempt.method().name(), publisher);

        if (attempt.hasBody()) {
            builder.header("Content-Type", CONTENT_TYPE_JSON);
        }
        if (authorization != null) {
            builder.header("Authorization", authorization);
        }
        return builder.build();
    }

    public boolean hasCredentials() {
        return authorization != null;
    }

    @Override
    public void close() {
        // HttpClient has no close() before Java 21; its connections are released with it
    }
}
