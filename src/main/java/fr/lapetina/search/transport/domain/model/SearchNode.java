package fr.lapetina.search.transport.domain.model;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;

/**
 * A search node in the cluster, addressed by its base URL.
 *
 * Immutable. Identity is the normalized base address (scheme, host, port and
 * optional path prefix, without trailing slash). Liveness is tracked by the
 * node pool, never by the node itself.
 */
public final class SearchNode {
    private final String id;
    private final URI baseUrl;

    private SearchNode(String id, URI baseUrl) {
        this.id = id;
        this.baseUrl = baseUrl;
    }

    /**
     * Creates a node from a base URL such as {@code http://search-1.example.com:9200/}.
     *
     * @throws IllegalArgumentException if the URL is not an absolute http(s) URL
     */
    public static SearchNode of(String url) {
        Objects.requireNonNull(url, "Node URL is required");
        String normalized = url.trim();
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Node URL must not be empty");
        }

        URI uri;
        try {
            uri = URI.create(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid node URL: " + url, e);
        }

        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new IllegalArgumentException("Node URL must use http or https: " + url);
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("Node URL has no host: " + url);
        }
        if (uri.getQuery() != null || uri.getFragment() != null) {
            throw new IllegalArgumentException("Node URL must not carry a query or fragment: " + url);
        }
        return new SearchNode(normalized, uri);
    }

    public String getId() {
        return id;
    }

    public URI getBaseUrl() {
        return baseUrl;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SearchNode that = (SearchNode) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return id;
    }
}
