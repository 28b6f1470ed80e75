package in.kirim.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.PathTemplateMatch;
import io.undertow.util.StatusCodes;

import java.nio.charset.StandardCharsets;
import java.util.Deque;

/**
 * Response and request helpers shared by the HTTP handlers.
 */
final class HttpResponses {
    static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    static final String JSON_SUCCESS = "success";
    static final String JSON_ERROR = "error";

    private HttpResponses() {}

    static String pathParam(HttpServerExchange exchange, String name) {
        return exchange.getAttachment(PathTemplateMatch.ATTACHMENT_KEY).getParameters().get(name);
    }

    static String queryParam(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        return values == null || values.isEmpty() ? null : values.getFirst();
    }

    /**
     * Parse a request body. An empty body reads as an empty object.
     *
     * @throws JsonProcessingException on malformed JSON
     */
    static JsonNode readBody(String body) throws JsonProcessingException {
        if (body == null || body.isBlank()) {
            return MAPPER.createObjectNode();
        }
        return MAPPER.readTree(body);
    }

    static ObjectNode success() {
        return MAPPER.createObjectNode().put(JSON_SUCCESS, true);
    }

    static void sendJson(HttpServerExchange exchange, int status, JsonNode body) {
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(body.toString(), StandardCharsets.UTF_8);
    }

    static void sendOk(HttpServerExchange exchange, JsonNode body) {
        sendJson(exchange, StatusCodes.OK, body);
    }

    static void sendText(HttpServerExchange exchange, String text) {
        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
        exchange.getResponseSender().send(text, StandardCharsets.UTF_8);
    }

    static void sendError(HttpServerExchange exchange, int status, String message) {
        sendJson(exchange, status, MAPPER.createObjectNode().put(JSON_ERROR, message));
    }

    static void badRequest(HttpServerExchange exchange, String message) {
        sendError(exchange, StatusCodes.BAD_REQUEST, message);
    }

    static void notFound(HttpServerExchange exchange, String message) {
        sendError(exchange, StatusCodes.NOT_FOUND, message);
    }
}
