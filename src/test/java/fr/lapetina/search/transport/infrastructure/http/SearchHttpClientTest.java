package fr.lapetina.search.transport.infrastructure.http;

import fr.lapetina.search.transport.domain.model.HttpMethod;
import fr.lapetina.search.transport.domain.model.SearchNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class SearchHttpClientTest {

    private static final SearchNode NODE = SearchNode.of("http://a:9200");

    private static HttpAttempt attempt(HttpMethod method, byte[] body) {
        return new HttpAttempt(NODE, method, URI.create("http://a:9200/idx/_search"), body, Duration.ofSeconds(3), 1);
    }

    @Test
    @DisplayName("should send JSON content type and the attempt timeout when a body is present")
    void shouldSetJsonHeaders() {
        SearchHttpClient client = new SearchHttpClient(Duration.ofSeconds(1));

        HttpRequest request = client.buildHttpRequest(
                attempt(HttpMethod.POST, "{}".getBytes(StandardCharsets.UTF_8)));

        assertThat(request.method()).isEqualTo("POST");
        assertThat(request.headers().firstValue("Content-Type")).contains("application/json");
        assertThat(request.timeout()).contains(Duration.ofSeconds(3));
        assertThat(request.bodyPublisher()).hasValueSatisfying(publisher ->
                assertThat(publisher.contentLength()).isEqualTo(2));
    }

    @Test
    @DisplayName("should omit the content type without a body")
    void shouldOmitContentTypeWithoutBody() {
        SearchHttpClient client = new SearchHttpClient(Duration.ofSeconds(1));

        HttpRequest request = client.buildHttpRequest(attempt(HttpMethod.GET, null));

        assertThat(request.headers().firstValue("Content-Type")).isEmpty();
        assertThat(request.headers().firstValue("Authorization")).isEmpty();
        assertThat(client.hasCredentials()).isFalse();
    }

    @Test
    @DisplayName("should send basic credentials on every request")
    void shouldSendBasicAuth() {
        SearchHttpClient client = new SearchHttpClient(Duration.ofSeconds(1), "elastic", "s3cret");

        HttpRequest request = client.buildHttpRequest(attempt(HttpMethod.DELETE, null));

        // base64("elastic:s3cret")
        assertThat(request.headers().firstValue("Authorization")).contains("Basic ZWxhc3RpYzpzM2NyZXQ=");
        assertThat(request.method()).isEqualTo("DELETE");
    }
}
