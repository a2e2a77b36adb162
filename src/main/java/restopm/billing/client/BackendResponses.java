package restopm.billing.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.ClientResponse;
import reactor.core.publisher.Mono;
import restopm.billing.context.OperatorContext;
import restopm.billing.exception.BillingBackendException;

/**
 * Response handling shared by the backend clients: envelope unwrapping,
 * verbatim error extraction and bearer token relay.
 */
final class BackendResponses {

    private BackendResponses() {}

    static void relayOperatorToken(HttpHeaders headers) {
        String token = OperatorContext.getBearerToken();
        if (token != null) {
            headers.setBearerAuth(token);
        }
    }

    static Mono<BillingBackendException> toBackendException(ClientResponse response, ObjectMapper objectMapper) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> new BillingBackendException(status, extractErrorMessage(body, status, objectMapper)));
    }

    /**
     * Pulls the human readable message out of the backend's error body. Understands
     * {success:false, error:{message}}, {error:"..."} and {message:"..."}.
     */
    static String extractErrorMessage(String body, int status, ObjectMapper objectMapper) {
        String fallback = "Error del servidor de facturación (HTTP " + status + ")";
        if (body == null || body.isBlank()) {
            return fallback;
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode error = root.path("error");
            if (error.isObject() && error.path("message").isTextual()) {
                return error.path("message").asText();
            }
            if (error.isTextual() && !error.asText().isBlank()) {
                return error.asText();
            }
            if (root.path("message").isTextual() && !root.path("message").asText().isBlank()) {
                return root.path("message").asText();
            }
            return fallback;
        } catch (JsonProcessingException e) {
            // plain text bodies are already the message
            return body.length() > 500 ? body.substring(0, 500) : body;
        }
    }

    /**
     * Unwraps {success:true, data:…}; any other shape is returned as is.
     */
    static JsonNode unwrap(JsonNode node) {
        if (node != null && node.path("success").asBoolean(false) && node.has("data")) {
            return node.get("data");
        }
        return node;
    }

    static <T> T read(JsonNode node, Class<T> type, ObjectMapper objectMapper, String operation) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new BillingBackendException(0, "Respuesta vacía del servidor de facturación (" + operation + ")");
        }
        try {
            return objectMapper.convertValue(unwrap(node), type);
        } catch (IllegalArgumentException e) {
            throw new BillingBackendException(0, "Respuesta inesperada del servidor de facturación (" + operation + "): " + e.getMessage());
        }
    }

    static <T> T read(JsonNode node, TypeReference<T> type, ObjectMapper objectMapper, String operation) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new BillingBackendException(0, "Respuesta vacía del servidor de facturación (" + operation + ")");
        }
        try {
            return objectMapper.convertValue(unwrap(node), type);
        } catch (IllegalArgumentException e) {
            throw new BillingBackendException(0, "Respuesta inesperada del servidor de facturación (" + operation + "): " + e.getMessage());
        }
    }
}
