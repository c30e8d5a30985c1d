package fr.lapetina.search.transport.domain.model;

/**
 * HTTP methods understood by the search nodes' REST API.
 *
 * <p>Every call is decoded as JSON, so methods whose responses carry no
 * body (HEAD) are not offered.
 */
public enum HttpMethod {
    GET,
    POST,
    PUT,
    DELETE
}
