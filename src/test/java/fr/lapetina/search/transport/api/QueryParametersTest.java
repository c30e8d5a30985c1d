package fr.lapetina.search.transport.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryParametersTest {

    private static final Set<String> RECOGNIZED = Set.of("routing", "refresh");

    @Test
    @DisplayName("should merge options and extras in insertion order")
    void shouldMerge() {
        Map<String, Object> resolved = QueryParameters.create()
                .option("routing", "user1")
                .extra("version", 3)
                .option("refresh", true)
                .resolve("index", RECOGNIZED);

        assertThat(resolved).containsExactly(
                Map.entry("routing", "user1"),
                Map.entry("refresh", true),
                Map.entry("version", 3));
    }

    @Test
    @DisplayName("should reject an option the endpoint does not know")
    void shouldRejectUnknownOption() {
        QueryParameters params = QueryParameters.create().option("rooting", "x");

        assertThatThrownBy(() -> params.resolve("index", RECOGNIZED))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown option 'rooting'");
    }

    @Test
    @DisplayName("should reject an extra named like a recognized option")
    void shouldRejectShadowingExtra() {
        QueryParameters params = QueryParameters.create().extra("routing", "x");

        assertThatThrownBy(() -> params.resolve("index", RECOGNIZED))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("shadows a recognized option");
    }

    @Test
    @DisplayName("should reject blank names and null values")
    void shouldRejectBadArguments() {
        assertThatThrownBy(() -> QueryParameters.create().option(" ", 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> QueryParameters.create().extra("version", null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("none() should resolve to an empty map for any endpoint")
    void noneIsEmpty() {
        assertThat(QueryParameters.none().isEmpty()).isTrue();
        assertThat(QueryParameters.none().resolve("get", Set.of())).isEmpty();
    }
}
