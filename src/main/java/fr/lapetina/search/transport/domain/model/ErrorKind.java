package fr.lapetina.search.transport.domain.model;

/**
 * Error taxonomy for transport operations.
 * Lets callers and metrics branch on the failure without inspecting messages.
 */
public enum ErrorKind {
    /** No attempt reached a live node within the retry budget */
    CONNECTION_FAILURE,

    /** Like CONNECTION_FAILURE, but the last attempt exceeded its deadline */
    TIMEOUT,

    /** A node answered with a non-2xx status and a JSON error body */
    HTTP_ERROR,

    /** A node answered with a body that is not valid JSON */
    MALFORMED_RESPONSE,

    /** A value has no defined wire representation */
    ENCODING_ERROR,

    /** The caller cancelled or interrupted the operation */
    CANCELLED
}
