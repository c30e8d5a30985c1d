/**
 * Wire encoding of request bodies and query-string values.
 *
 * <p>{@link fr.lapetina.search.transport.infrastructure.json.JsonSerializer} is a total function over
 * {@link fr.lapetina.search.transport.domain.model.JsonValue}. Anything outside the value model fails
 * with {@link fr.lapetina.search.transport.exception.EncodingException}; nothing is stringified implicitly.
 */
package fr.lapetina.search.transport.infrastructure.json;
