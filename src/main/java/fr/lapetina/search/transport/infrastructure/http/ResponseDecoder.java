package fr.lapetina.search.transport.infrastructure.http;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import fr.lapetina.search.transport.exception.HttpErrorException;
import fr.lapetina.search.transport.exception.MalformedResponseException;
import fr.lapetina.search.transport.exception.ResourceAlreadyExistsException;
import fr.lapetina.search.transport.exception.ResourceNotFoundException;

import java.io.IOException;
import java.util.Locale;

/**
 * Turns a raw response into a decoded JSON tree or a typed failure.
 *
 * <ul>
 *   <li>2xx with a JSON body: the decoded tree</li>
 *   <li>any status with a body that is not JSON (or no body): {@link MalformedResponseException}</li>
 *   <li>404 with a JSON body: {@link ResourceNotFoundException}</li>
 *   <li>other non-2xx whose error names an existing resource: {@link ResourceAlreadyExistsException}</li>
 *   <li>any other non-2xx with a JSON body: {@link HttpErrorException}</li>
 * </ul>
 *
 * Floating-point numbers decode as {@link java.math.BigDecimal} with their scale intact.
 */
public final class ResponseDecoder {

    private final ObjectMapper objectMapper;

    public ResponseDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false);
    }

    public ResponseDecoder() {
        this(new ObjectMapper());
    }

    /**
     * @throws HttpErrorException         (or a subclass) for a non-2xx status with a JSON body
     * @throws MalformedResponseException when the body is not a single JSON document
     */
    public JsonNode decode(HttpAttempt attempt, RawResponse response) {
        JsonNode json = parse(attempt, response);
        if (response.isSuccess()) {
            return json;
        }
        throw classify(attempt, response, json);
    }

    private JsonNode parse(HttpAttempt attempt, RawResponse response) {
        String url = attempt.uri().toString();
        if (response.body().length == 0) {
            throw new MalformedResponseException(url, attempt.node(), response.statusCode(), response.body(), null);
        }
        JsonNode json;
        try {
            json = objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new MalformedResponseException(url, attempt.node(), response.statusCode(), response.body(), e);
        }
        if (json == null || json.isMissingNode()) {
            throw new MalformedResponseException(url, attempt.node(), response.statusCode(), response.body(), null);
        }
        return json;
    }

    private static HttpErrorException classify(HttpAttempt attempt, RawResponse response, JsonNode body) {
        String url = attempt.uri().toString();
        int status = response.statusCode();
        if (status == 404) {
            return new ResourceNotFoundException(attempt.method(), url, attempt.node(), status, body);
        }
        if (namesExistingResource(body)) {
            return new ResourceAlreadyExistsException(attempt.method(), url, attempt.node(), status, body);
        }
        return new HttpErrorException(attempt.method(), url, attempt.node(), status, body);
    }

    /**
     * Recognizes both error shapes servers use: a plain string such as
     * {@code IndexAlreadyExistsException[[x] Already exists]}, and a structured
     * object whose {@code type} is {@code resource_already_exists_exception}.
     */
    static boolean namesExistingResource(JsonNode body) {
        JsonNode error = body.get("error");
        if (error == null) {
            return false;
        }
        if (error.isTextual()) {
            return mentionsAlreadyExists(error.asText());
        }
        if (error.isObject()) {
            JsonNode type = error.get("type");
            return type != null && type.isTextual() && mentionsAlreadyExists(type.asText());
        }
        return false;
    }

    private static boolean mentionsAlreadyExists(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        return lower.contains("alreadyexists")
                || lower.contains("already_exists")
                || lower.contains("already exists");
    }
}
