/**
 * Domain model classes shared by the node pool, the executor and the serializer.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.search.transport.domain.model.SearchNode} - Immutable node address; identity is the base URL</li>
 *   <li>{@link fr.lapetina.search.transport.domain.model.TransportRequest} - Immutable request descriptor</li>
 *   <li>{@link fr.lapetina.search.transport.domain.model.JsonValue} - Closed value model for request bodies</li>
 *   <li>{@link fr.lapetina.search.transport.domain.model.ErrorKind} - Categorized failure kinds</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Everything in this package is immutable and may be shared freely between threads.
 * Node liveness lives in {@link fr.lapetina.search.transport.infrastructure.health.NodePool}.
 */
package fr.lapetina.search.transport.domain.model;
