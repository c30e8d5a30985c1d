package fr.lapetina.search.transport.api;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.search.transport.SearchTransport;
import fr.lapetina.search.transport.domain.model.HttpMethod;
import fr.lapetina.search.transport.domain.model.TransportRequest;
import fr.lapetina.search.transport.infrastructure.json.JsonSerializer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Endpoint wrappers over a {@link SearchTransport}.
 *
 * <p>Each method maps one REST endpoint to a path and a set of recognized
 * query options, then hands off to the transport. Failures surface as the
 * transport's exceptions: a missing document is a
 * {@link fr.lapetina.search.transport.exception.ResourceNotFoundException},
 * an index that exists already a
 * {@link fr.lapetina.search.transport.exception.ResourceAlreadyExistsException}.
 *
 * <p>Index and type arguments accept several names; they are comma-joined
 * and {@code _all} is dropped, so {@code null} or an empty list means "all".
 *
 * Thread-safe; does not own the transport.
 */
public final class SearchClient {

    static final Set<String> INDEX_OPTIONS = Set.of(
            "routing", "parent", "timestamp", "ttl", "percolate", "consistency", "replication", "refresh", "timeout");
    static final Set<String> BULK_OPTIONS = Set.of("consistency", "refresh");
    static final Set<String> DELETE_OPTIONS = Set.of("routing", "parent", "replication", "consistency", "refresh");
    static final Set<String> GET_OPTIONS = Set.of("realtime", "fields", "routing", "preference", "refresh");
    static final Set<String> SEARCH_OPTIONS = Set.of("routing");
    static final Set<String> COUNT_OPTIONS = Set.of("df", "analyzer", "default_operator", "source", "routing");
    static final Set<String> HEALTH_OPTIONS = Set.of(
            "level", "wait_for_status", "wait_for_relocating_shards", "wait_for_nodes", "timeout");
    static final Set<String> NO_OPTIONS = Set.of();

    private final SearchTransport transport;

    public SearchClient(SearchTransport transport) {
        this.transport = Objects.requireNonNull(transport, "Transport is required");
    }

    public SearchTransport getTransport() {
        return transport;
    }

    /**
     * Stores a document. Without an id the server assigns one.
     *
     * @param forceInsert fail with a conflict instead of overwriting an existing document
     */
    public JsonNode index(String index, String docType, Object doc, String id, boolean forceInsert,
                          QueryParameters params) {
        requireName(index, "index");
        requireName(docType, "docType");
        Map<String, Object> query = params.resolve("index", INDEX_OPTIONS);
        if (forceInsert) {
            putReserved(query, "op_type", "create");
        }
        HttpMethod method = id == null ? HttpMethod.POST : HttpMethod.PUT;
        return transport.execute(method, segments(index, docType, id), doc, query);
    }

    public JsonNode index(String index, String docType, Object doc, String id) {
        return index(index, docType, doc, id, false, QueryParameters.none());
    }

    /**
     * Indexes several documents in one bulk call. Each document is preceded
     * by an {@code index} action line; the body is newline-delimited JSON
     * ending with a newline.
     *
     * @param idField field holding each document's id; documents where it is
     *                missing or empty get a server-assigned id
     * @throws IllegalArgumentException if {@code docs} is empty
     */
    public JsonNode bulkIndex(String index, String docType, List<? extends Map<String, ?>> docs, String idField,
                              QueryParameters params) {
        requireName(index, "index");
        requireName(docType, "docType");
        if (docs == null || docs.isEmpty()) {
            throw new IllegalArgumentException("No documents provided for bulk indexing");
        }
        Map<String, Object> query = params.resolve("bulkIndex", BULK_OPTIONS);
        putReserved(query, "op_type", "create");

        JsonSerializer serializer = transport.getSerializer();
        StringBuilder body = new StringBuilder();
        for (Map<String, ?> doc : docs) {
            Map<String, Object> target = new LinkedHashMap<>();
            target.put("_index", index);
            target.put("_type", docType);
            Object id = idField != null ? doc.get(idField) : null;
            if (id != null && !"".equals(id)) {
                target.put("_id", id);
            }
            body.append(serializer.encodeBodyAsString(Map.of("index", target))).append('\n');
            body.append(serializer.encodeBodyAsString(doc)).append('\n');
        }

        return transport.execute(TransportRequest.builder(HttpMethod.POST)
                .path(List.of(index, "_bulk"))
                .rawBody(body.toString())
                .queryParams(transport.encodeQuery(query))
                .build());
    }

    public JsonNode bulkIndex(String index, String docType, List<? extends Map<String, ?>> docs) {
        return bulkIndex(index, docType, docs, "id", QueryParameters.none());
    }

    public JsonNode get(String index, String docType, String id, QueryParameters params) {
        requireName(id, "id");
        return transport.execute(HttpMethod.GET, segments(index, docType, id), null,
                params.resolve("get", GET_OPTIONS));
    }

    public JsonNode get(String index, String docType, String id) {
        return get(index, docType, id, QueryParameters.none());
    }

    public JsonNode delete(String index, String docType, String id, QueryParameters params) {
        requireName(id, "id");
        return transport.execute(HttpMethod.DELETE, segments(index, docType, id), null,
                params.resolve("delete", DELETE_OPTIONS));
    }

    public JsonNode delete(String index, String docType, String id) {
        return delete(index, docType, id, QueryParameters.none());
    }

    /**
     * Runs a search. A string query is sent as the {@code q} parameter;
     * anything else is sent as the query DSL body.
     *
     * @param indexes  indexes to search, or {@code null} for all
     * @param docTypes document types to search, or {@code null} for all
     */
    public JsonNode search(Object query, List<String> indexes, List<String> docTypes, QueryParameters params) {
        return searchOrCount("_search", query, indexes, docTypes, params.resolve("search", SEARCH_OPTIONS));
    }

    public JsonNode search(Object query, String... indexes) {
        return search(query, Arrays.asList(indexes), null, QueryParameters.none());
    }

    /**
     * Counts the documents a query matches. Takes the same query forms as {@link #search}.
     */
    public JsonNode count(Object query, List<String> indexes, List<String> docTypes, QueryParameters params) {
        return searchOrCount("_count", query, indexes, docTypes, params.resolve("count", COUNT_OPTIONS));
    }

    public JsonNode count(Object query, String... indexes) {
        return count(query, Arrays.asList(indexes), null, QueryParameters.none());
    }

    private JsonNode searchOrCount(String kind, Object query, List<String> indexes, List<String> docTypes,
                                   Map<String, Object> queryParams) {
        Objects.requireNonNull(query, "Query is required");
        Object body = null;
        if (query instanceof CharSequence) {
            putReserved(queryParams, "q", query.toString());
        } else {
            body = query;
        }
        return transport.execute(HttpMethod.GET, segments(concat(indexes), concat(docTypes), kind), body,
                queryParams);
    }

    /**
     * Creates an index, with optional settings and mappings.
     */
    public JsonNode createIndex(String index, Object settings, QueryParameters params) {
        requireName(index, "index");
        return transport.execute(HttpMethod.PUT, segments(index), settings,
                params.resolve("createIndex", NO_OPTIONS));
    }

    public JsonNode createIndex(String index) {
        return createIndex(index, null, QueryParameters.none());
    }

    /**
     * Deletes the named indexes. An empty list is refused rather than read
     * as "all"; use {@link #deleteAllIndexes()} for that.
     */
    public JsonNode deleteIndex(List<String> indexes, QueryParameters params) {
        String joined = concat(indexes);
        if (joined.isEmpty()) {
            throw new IllegalArgumentException("No indexes specified. To delete all indexes, use deleteAllIndexes().");
        }
        return transport.execute(HttpMethod.DELETE, segments(joined), null,
                params.resolve("deleteIndex", NO_OPTIONS));
    }

    public JsonNode deleteIndex(String... indexes) {
        return deleteIndex(Arrays.asList(indexes), QueryParameters.none());
    }

    public JsonNode deleteAllIndexes() {
        return transport.execute(HttpMethod.DELETE, segments("_all"), null, Map.of());
    }

    public JsonNode refresh(List<String> indexes, QueryParameters params) {
        return transport.execute(HttpMethod.POST, segments(concat(indexes), "_refresh"), null,
                params.resolve("refresh", NO_OPTIONS));
    }

    public JsonNode refresh(String... indexes) {
        return refresh(Arrays.asList(indexes), QueryParameters.none());
    }

    /**
     * Reports cluster health, or the health of the given indexes.
     */
    public JsonNode health(List<String> indexes, QueryParameters params) {
        return transport.execute(HttpMethod.GET, segments("_cluster", "health", concat(indexes)), null,
                params.resolve("health", HEALTH_OPTIONS));
    }

    public JsonNode health(String... indexes) {
        return health(Arrays.asList(indexes), QueryParameters.none());
    }

    /**
     * Calls an endpoint that has no wrapper. Query values are encoded like
     * any other option.
     */
    public JsonNode sendRequest(HttpMethod method, List<String> pathSegments, Object body, Map<String, ?> queryParams) {
        return transport.execute(method, pathSegments, body, queryParams);
    }

    /**
     * Comma-joins names, dropping {@code _all}. Returns an empty string for
     * {@code null} or when nothing is left.
     */
    static String concat(List<String> names) {
        if (names == null) {
            return "";
        }
        StringJoiner joined = new StringJoiner(",");
        for (String name : names) {
            if (name != null && !name.isEmpty() && !"_all".equals(name)) {
                joined.add(name);
            }
        }
        return joined.toString();
    }

    private static List<String> segments(String... parts) {
        List<String> segments = new ArrayList<>(parts.length);
        for (String part : parts) {
            if (part != null) {
                segments.add(part);
            }
        }
        return segments;
    }

    private static void putReserved(Map<String, Object> query, String name, Object value) {
        if (query.containsKey(name)) {
            throw new IllegalArgumentException("Parameter '" + name + "' is set by the endpoint itself");
        }
        query.put(name, value);
    }

    private static void requireName(String value, String what) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException(what + " is required");
        }
    }
}
