package fr.lapetina.search.transport.exception;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.search.transport.domain.model.HttpMethod;
import fr.lapetina.search.transport.domain.model.SearchNode;

/**
 * Raised when a node answers 404: the index, document or other resource does not exist.
 */
public class ResourceNotFoundException extends HttpErrorException {

    public ResourceNotFoundException(HttpMethod method, String url, SearchNode node, int statusCode, JsonNode body) {
        super(method, url, node, statusCode, body);
    }
}
