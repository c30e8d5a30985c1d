/**
 * HTTP round trips, retries and response classification.
 *
 * <p>{@link fr.lapetina.search.transport.infrastructure.http.SearchHttpClient} performs one
 * attempt against one node. {@link fr.lapetina.search.transport.infrastructure.http.RequestExecutor}
 * drives attempts against the pool. {@link fr.lapetina.search.transport.infrastructure.http.ResponseDecoder}
 * turns each answer into a JSON tree or a typed failure.
 */
package fr.lapetina.search.transport.infrastructure.http;
