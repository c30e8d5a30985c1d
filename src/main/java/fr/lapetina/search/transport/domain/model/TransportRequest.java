package fr.lapetina.search.transport.domain.model;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Describes one logical operation against the cluster.
 * Immutable and thread-safe; built fresh per call.
 *
 * <p>At most one of {@code body} and {@code rawBody} is set. A structured body
 * is encoded to JSON by the executor; a raw body (for newline-delimited
 * payloads) is sent as-is.
 */
public record TransportRequest(
        HttpMethod method,
        List<String> pathSegments,
        JsonValue body,
        byte[] rawBody,
        Map<String, String> queryParams,
        Duration timeout
) {
    public TransportRequest {
        Objects.requireNonNull(method, "Method is required");
        if (body != null && rawBody != null) {
            throw new IllegalArgumentException("A request carries either a JSON body or a raw body, not both");
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeout);
        }
        pathSegments = pathSegments != null ? List.copyOf(pathSegments) : List.of();
        rawBody = rawBody != null ? rawBody.clone() : null;
        queryParams = queryParams != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(queryParams))
                : Map.of();
    }

    /**
     * Returns a copy of the raw body, or {@code null} if there is none.
     */
    @Override
    public byte[] rawBody() {
        return rawBody != null ? rawBody.clone() : null;
    }

    public boolean hasBody() {
        return body != null || rawBody != null;
    }

    /**
     * Joins the path segments with "/", skipping empty ones, escaping each
     * segment and always starting with "/".
     */
    public String path() {
        StringBuilder path = new StringBuilder();
        for (String segment : pathSegments) {
            if (segment == null || segment.isEmpty()) {
                continue;
            }
            path.append('/').append(escapePathSegment(segment));
        }
        return path.length() == 0 ? "/" : path.toString();
    }

    /**
     * Returns the escaped path followed by the form-encoded query string, if any.
     */
    public String pathAndQuery() {
        if (queryParams.isEmpty()) {
            return path();
        }
        StringJoiner query = new StringJoiner("&");
        for (Map.Entry<String, String> param : queryParams.entrySet()) {
            query.add(URLEncoder.encode(param.getKey(), StandardCharsets.UTF_8)
                    + "=" + URLEncoder.encode(param.getValue(), StandardCharsets.UTF_8));
        }
        return path() + "?" + query;
    }

    /**
     * Percent-encodes a single path segment. Unreserved characters and commas
     * (index lists) stay literal; "/" is escaped.
     */
    static String escapePathSegment(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("*", "%2A")
                .replace("%7E", "~")
                .replace("%2C", ",");
    }

    @Override
    public String toString() {
        return "TransportRequest{" +
                "method=" + method +
                ", path=" + pathAndQuery() +
                ", hasBody=" + hasBody() +
                ", timeout=" + timeout +
                '}';
    }

    public static Builder builder(HttpMethod method) {
        return new Builder(method);
    }

    public static final class Builder {
        private final HttpMethod method;
        private final List<String> pathSegments = new ArrayList<>();
        private JsonValue body;
        private byte[] rawBody;
        private final Map<String, String> queryParams = new LinkedHashMap<>();
        private Duration timeout;

        private Builder(HttpMethod method) {
            this.method = method;
        }

        /**
         * Appends path segments. {@code null} segments are skipped so optional
         * parts (an absent document id, an unspecified index) can be passed through.
         */
        public Builder path(Object... segments) {
            for (Object segment : segments) {
                if (segment != null) {
                    pathSegments.add(segment.toString());
                }
            }
            return this;
        }

        public Builder path(List<String> segments) {
            pathSegments.addAll(segments);
            return this;
        }

        /**
         * Sets a structured body, converted eagerly so that unsupported values
         * fail before any node is contacted.
         */
        public Builder body(Object body) {
            this.body = body == null ? null : JsonValue.of(body);
            return this;
        }

        public Builder rawBody(String rawBody) {
            this.rawBody = rawBody == null ? null : rawBody.getBytes(StandardCharsets.UTF_8);
            return this;
        }

        public Builder rawBody(byte[] rawBody) {
            this.rawBody = rawBody;
            return this;
        }

        public Builder queryParam(String name, String value) {
            this.queryParams.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder queryParams(Map<String, String> params) {
            params.forEach(this::queryParam);
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public TransportRequest build() {
            return new TransportRequest(method, pathSegments, body, rawBody, queryParams, timeout);
        }
    }
}
