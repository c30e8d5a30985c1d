package fr.lapetina.search.transport.exception;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.search.transport.domain.model.HttpMethod;
import fr.lapetina.search.transport.domain.model.SearchNode;

/**
 * Raised on an attempt to create a resource (typically an index) that already exists.
 */
public class ResourceAlreadyExistsException extends HttpErrorException {

    public ResourceAlreadyExistsException(HttpMethod method, String url, SearchNode node, int statusCode, JsonNode body) {
        super(method, url, node, statusCode, body);
    }
}
