package restopm.billing.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import restopm.billing.client.dto.RestaurantConfigDTO;
import restopm.billing.exception.BillingBackendException;

/**
 * Client for the restaurant configuration aggregate (issuer data, sequences, tax rate).
 */
@Component
@RequiredArgsConstructor
public class RestaurantConfigClient {

    private static final Logger logger = LoggerFactory.getLogger(RestaurantConfigClient.class);

    private final WebClient billingBackendWebClient;
    private final ObjectMapper objectMapper;

    public RestaurantConfigDTO fetchConfig() {
        logger.debug("Fetching restaurant configuration");
        try {
            JsonNode body = billingBackendWebClient.get()
                    .uri("/config")
                    .headers(BackendResponses::relayOperatorToken)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response -> BackendResponses.toBackendException(response, objectMapper))
                    .bodyToMono(JsonNode.class)
                    .block();
            return BackendResponses.read(body, RestaurantConfigDTO.class, objectMapper, "config");
        } catch (WebClientRequestException e) {
            throw BillingBackendException.transport("config", e);
        }
    }

    /**
     * Replaces the whole configuration. Callers merge partial edits beforehand.
     *
     * @return the configuration as stored by the backend
     */
    public RestaurantConfigDTO updateConfig(RestaurantConfigDTO config) {
        logger.info("Updating restaurant configuration");
        try {
            JsonNode body = billingBackendWebClient.put()
                    .uri("/config")
                    .headers(BackendResponses::relayOperatorToken)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(config)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response -> BackendResponses.toBackendException(response, objectMapper))
                    .bodyToMono(JsonNode.class)
                    .block();
            if (body == null || body.isNull() || BackendResponses.unwrap(body).path("ruc").isMissingNode()
                    && BackendResponses.unwrap(body).path("billing").isMissingNode()) {
                // some backend versions answer {success:true} only
                return config;
            }
            return BackendResponses.read(body, RestaurantConfigDTO.class, objectMapper, "config update");
        } catch (WebClientRequestException e) {
            throw BillingBackendException.transport("config update", e);
        }
    }
}
