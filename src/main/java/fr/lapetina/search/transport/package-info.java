/**
 * Search Node Transport - HTTP transport for a cluster of search nodes.
 *
 * <p>This library sends JSON requests to a fixed set of interchangeable nodes,
 * steering away from nodes that recently failed and retrying connection-level
 * failures on other nodes.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.search.transport.SearchTransport} - Main entry point, built in code or
 *       from YAML configuration</li>
 *   <li>{@link fr.lapetina.search.transport.api.SearchClient} - Wrappers for common REST endpoints</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (SearchTransport transport = SearchTransport.fromConfig("transport.yaml")) {
 *     SearchClient client = new SearchClient(transport);
 *
 *     client.index("tweets", "tweet", Map.of("user", "ann", "text", "hi"), "1");
 *     JsonNode hits = client.search("user:ann", "tweets");
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Dead-node tracking with lazy revival after a configurable delay</li>
 *   <li>Bounded retries of transport failures, never of HTTP errors</li>
 *   <li>Strict JSON and query-string encoding with lossless decimals</li>
 *   <li>Typed failures: connection, timeout, HTTP error, malformed response, encoding</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.search.transport.SearchTransport
 * @see fr.lapetina.search.transport.infrastructure.http.RequestExecutor
 */
package fr.lapetina.search.transport;
