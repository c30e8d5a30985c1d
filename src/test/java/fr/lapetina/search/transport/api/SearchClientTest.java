package fr.lapetina.search.transport.api;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.search.transport.SearchTransport;
import fr.lapetina.search.transport.domain.model.HttpMethod;
import fr.lapetina.search.transport.exception.ResourceAlreadyExistsException;
import fr.lapetina.search.transport.exception.ResourceNotFoundException;
import fr.lapetina.search.transport.infrastructure.http.HttpAttempt;
import fr.lapetina.search.transport.support.FirstCandidateStrategy;
import fr.lapetina.search.transport.support.StubHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SearchClientTest {

    private static final String NODE = "http://es1.test:9200";

    private StubHttpClient stub;
    private SearchTransport transport;
    private SearchClient client;

    @BeforeEach
    void setUp() {
        stub = new StubHttpClient();
        transport = SearchTransport.builder()
                .nodes(NODE)
                .httpClient(stub)
                .strategy(new FirstCandidateStrategy())
                .build();
        client = new SearchClient(transport);
    }

    @AfterEach
    void tearDown() {
        transport.close();
    }

    private HttpAttempt last() {
        return stub.lastAttempt();
    }

    @Nested
    @DisplayName("Documents")
    class DocumentTests {

        @Test
        @DisplayName("index with an id should PUT to index/type/id")
        void indexWithId() {
            stub.otherwise(StubHttpClient.ok("{\"_id\":\"1\",\"created\":true}"));

            JsonNode result = client.index("tweets", "tweet", Map.of("user", "ann"), "1");

            assertThat(result.get("created").asBoolean()).isTrue();
            assertThat(last().method()).isEqualTo(HttpMethod.PUT);
            assertThat(last().uri().getRawPath()).isEqualTo("/tweets/tweet/1");
            assertThat(StubHttpClient.bodyOf(last())).isEqualTo("{\"user\":\"ann\"}");
        }

        @Test
        @DisplayName("index without an id should POST to index/type")
        void indexWithoutId() {
            client.index("tweets", "tweet", Map.of("user", "ann"), null);

            assertThat(last().method()).isEqualTo(HttpMethod.POST);
            assertThat(last().uri().getRawPath()).isEqualTo("/tweets/tweet");
            assertThat(last().uri().getRawQuery()).isNull();
        }

        @Test
        @DisplayName("forceInsert should add op_type=create after the options")
        void forceInsert() {
            client.index("tweets", "tweet", Map.of("user", "ann"), "1", true,
                    QueryParameters.create().option("refresh", true));

            assertThat(last().uri().getRawQuery()).isEqualTo("refresh=true&op_type=create");
        }

        @Test
        @DisplayName("forceInsert should refuse a caller-supplied op_type")
        void forceInsertConflict() {
            QueryParameters params = QueryParameters.create().extra("op_type", "index");

            assertThatThrownBy(() -> client.index("tweets", "tweet", Map.of(), "1", true, params))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("op_type");
            assertThat(stub.getAttempts()).isEmpty();
        }

        @Test
        @DisplayName("bulkIndex should POST newline-delimited actions and documents")
        void bulkIndex() {
            Map<String, Object> first = new LinkedHashMap<>();
            first.put("id", 1);
            first.put("user", "ann");
            Map<String, Object> second = new LinkedHashMap<>();
            second.put("id", "");
            second.put("user", "bob");

            client.bulkIndex("tweets", "tweet", List.of(first, second), "id",
                    QueryParameters.create().option("refresh", true));

            assertThat(last().method()).isEqualTo(HttpMethod.POST);
            assertThat(last().uri().getRawPath()).isEqualTo("/tweets/_bulk");
            assertThat(last().uri().getRawQuery()).isEqualTo("refresh=true&op_type=create");
            assertThat(StubHttpClient.bodyOf(last())).isEqualTo(
                    "{\"index\":{\"_index\":\"tweets\",\"_type\":\"tweet\",\"_id\":1}}\n"
                            + "{\"id\":1,\"user\":\"ann\"}\n"
                            + "{\"index\":{\"_index\":\"tweets\",\"_type\":\"tweet\"}}\n"
                            + "{\"id\":\"\",\"user\":\"bob\"}\n");
        }

        @Test
        @DisplayName("bulkIndex should refuse an empty document list before any attempt")
        void bulkIndexWithoutDocs() {
            assertThatThrownBy(() -> client.bulkIndex("tweets", "tweet", List.of()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("No documents");
            assertThat(stub.getAttempts()).isEmpty();
        }

        @Test
        @DisplayName("get should escape the id and pass options through")
        void getEscapesId() {
            client.get("tweets", "tweet", "a/b c", QueryParameters.create().option("routing", "ann"));

            assertThat(last().method()).isEqualTo(HttpMethod.GET);
            assertThat(last().uri().getRawPath()).isEqualTo("/tweets/tweet/a%2Fb%20c");
            assertThat(last().uri().getRawQuery()).isEqualTo("routing=ann");
            assertThat(last().hasBody()).isFalse();
        }

        @Test
        @DisplayName("get of a missing document should raise not found")
        void getMissing() {
            stub.otherwise(StubHttpClient.respond(404, "{\"_id\":\"9\",\"found\":false}"));

            assertThatThrownBy(() -> client.get("tweets", "tweet", "9"))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("delete should require an id")
        void deleteRequiresId() {
            assertThatThrownBy(() -> client.delete("tweets", "tweet", null))
                    .isInstanceOf(IllegalArgumentException.class);

            client.delete("tweets", "tweet", "1");
            assertThat(last().method()).isEqualTo(HttpMethod.DELETE);
            assertThat(last().uri().getRawPath()).isEqualTo("/tweets/tweet/1");
        }

        @Test
        @DisplayName("an unknown option should fail before any attempt")
        void unknownOption() {
            QueryParameters params = QueryParameters.create().option("version", 3);

            assertThatThrownBy(() -> client.get("tweets", "tweet", "1", params))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(stub.getAttempts()).isEmpty();
        }

        @Test
        @DisplayName("extras should reach the query string")
        void extraPassedThrough() {
            client.get("tweets", "tweet", "1", QueryParameters.create().extra("version", 3));

            assertThat(last().uri().getRawQuery()).isEqualTo("version=3");
        }
    }

    @Nested
    @DisplayName("Search and count")
    class SearchTests {

        @Test
        @DisplayName("a string query should be sent as q")
        void stringQuery() {
            client.search("user:ann", "tweets");

            assertThat(last().method()).isEqualTo(HttpMethod.GET);
            assertThat(last().uri().getRawPath()).isEqualTo("/tweets/_search");
            assertThat(last().uri().getRawQuery()).isEqualTo("q=user%3Aann");
            assertThat(last().hasBody()).isFalse();
        }

        @Test
        @DisplayName("a structured query should be sent as the body")
        void structuredQuery() {
            Map<String, Object> query = Map.of("query", Map.of("match_all", Map.of()));

            client.search(query, List.of("tweets"), List.of("tweet"), QueryParameters.none());

            assertThat(last().uri().getRawPath()).isEqualTo("/tweets/tweet/_search");
            assertThat(last().uri().getRawQuery()).isNull();
            assertThat(StubHttpClient.bodyOf(last())).isEqualTo("{\"query\":{\"match_all\":{}}}");
        }

        @Test
        @DisplayName("_all should be dropped from index lists")
        void dropsAll() {
            client.search("x", "a", "_all", "b");

            assertThat(last().uri().getRawPath()).isEqualTo("/a,b/_search");
        }

        @Test
        @DisplayName("no indexes should search everything")
        void searchEverything() {
            client.search("x");

            assertThat(last().uri().getRawPath()).isEqualTo("/_search");
        }

        @Test
        @DisplayName("q set by the caller should conflict with a string query")
        void duplicateQ() {
            QueryParameters params = QueryParameters.create().extra("q", "other");

            assertThatThrownBy(() -> client.search("x", null, null, params))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(stub.getAttempts()).isEmpty();
        }

        @Test
        @DisplayName("count should hit _count with its own options")
        void count() {
            stub.otherwise(StubHttpClient.ok("{\"count\":42}"));

            JsonNode result = client.count("user:ann", List.of("tweets"), null,
                    QueryParameters.create().option("df", "user"));

            assertThat(result.get("count").asInt()).isEqualTo(42);
            assertThat(last().uri().getRawPath()).isEqualTo("/tweets/_count");
            assertThat(last().uri().getRawQuery()).isEqualTo("df=user&q=user%3Aann");
        }
    }

    @Nested
    @DisplayName("Index administration")
    class AdminTests {

        @Test
        @DisplayName("createIndex should PUT the settings")
        void createIndex() {
            client.createIndex("tweets", Map.of("settings", Map.of("number_of_shards", 1)), QueryParameters.none());

            assertThat(last().method()).isEqualTo(HttpMethod.PUT);
            assertThat(last().uri().getRawPath()).isEqualTo("/tweets");
            assertThat(StubHttpClient.bodyOf(last())).isEqualTo("{\"settings\":{\"number_of_shards\":1}}");
        }

        @Test
        @DisplayName("createIndex on an existing index should raise already exists")
        void createExisting() {
            stub.otherwise(StubHttpClient.respond(400,
                    "{\"error\":\"IndexAlreadyExistsException[[tweets] Already exists]\",\"status\":400}"));

            assertThatThrownBy(() -> client.createIndex("tweets"))
                    .isInstanceOf(ResourceAlreadyExistsException.class);
        }

        @Test
        @DisplayName("deleteIndex without names should fail before any attempt")
        void deleteIndexWithoutNames() {
            assertThatThrownBy(() -> client.deleteIndex())
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("deleteAllIndexes()");
            assertThatThrownBy(() -> client.deleteIndex("_all"))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(stub.getAttempts()).isEmpty();
        }

        @Test
        @DisplayName("deleteIndex should join names and deleteAllIndexes should target _all")
        void deleteIndexes() {
            client.deleteIndex("a", "b");
            assertThat(last().method()).isEqualTo(HttpMethod.DELETE);
            assertThat(last().uri().getRawPath()).isEqualTo("/a,b");

            client.deleteAllIndexes();
            assertThat(last().uri().getRawPath()).isEqualTo("/_all");
        }

        @Test
        @DisplayName("refresh without names should POST /_refresh")
        void refreshAll() {
            client.refresh();

            assertThat(last().method()).isEqualTo(HttpMethod.POST);
            assertThat(last().uri().getRawPath()).isEqualTo("/_refresh");
        }

        @Test
        @DisplayName("health should pass its options")
        void health() {
            stub.otherwise(StubHttpClient.ok("{\"status\":\"green\"}"));

            JsonNode result = client.health(List.of("tweets"),
                    QueryParameters.create().option("wait_for_status", "yellow"));

            assertThat(result.get("status").asText()).isEqualTo("green");
            assertThat(last().uri().getRawPath()).isEqualTo("/_cluster/health/tweets");
            assertThat(last().uri().getRawQuery()).isEqualTo("wait_for_status=yellow");
        }
    }

    @Test
    @DisplayName("sendRequest should encode query values like the endpoints do")
    void sendRequest() {
        client.sendRequest(HttpMethod.GET, List.of("_nodes", "stats"), null, Map.of("human", true));

        assertThat(last().uri().getRawPath()).isEqualTo("/_nodes/stats");
        assertThat(last().uri().getRawQuery()).isEqualTo("human=true");
    }

    @Test
    @DisplayName("concat should skip null, empty and _all")
    void concat() {
        assertThat(SearchClient.concat(null)).isEmpty();
        assertThat(SearchClient.concat(Arrays.asList("a", null, "", "_all", "b"))).isEqualTo("a,b");
    }
}
