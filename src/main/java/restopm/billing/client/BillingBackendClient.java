package restopm.billing.client;

import com.fasterxml.jackson.core.type.TypeReference;
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
import org.springframework.web.util.UriBuilder;
import restopm.billing.client.dto.BillDTO;
import restopm.billing.client.dto.BillQuery;
import restopm.billing.client.dto.CreditNoteBackendRequest;
import restopm.billing.client.dto.CreditNoteDTO;
import restopm.billing.client.dto.GenerateInvoiceRequest;
import restopm.billing.client.dto.GenerateInvoiceResponse;
import restopm.billing.client.dto.PageResponse;
import restopm.billing.client.dto.StatusCheckResponse;
import restopm.billing.exception.BillingBackendException;

import java.net.URI;
import java.util.Map;

/**
 * Client for the billing backend, which owns XML generation, signing, SRI submission,
 * persistence of bills and credit notes, and sequence assignment.
 * Propagates the operator's bearer token with every request.
 */
@Component
@RequiredArgsConstructor
public class BillingBackendClient {

    private static final Logger logger = LoggerFactory.getLogger(BillingBackendClient.class);

    private static final TypeReference<PageResponse<BillDTO>> BILL_PAGE = new TypeReference<>() {};
    private static final TypeReference<PageResponse<CreditNoteDTO>> CREDIT_NOTE_PAGE = new TypeReference<>() {};

    private final WebClient billingBackendWebClient;
    private final ObjectMapper objectMapper;

    /**
     * Generate, sign and submit an invoice. Blocks until the backend answers, which
     * includes its own wait for the SRI authorization.
     *
     * @param onDispatched invoked once the request is handed to the transport
     * @throws BillingBackendException with the backend's message on any failure
     */
    public GenerateInvoiceResponse generateInvoice(GenerateInvoiceRequest request, Runnable onDispatched) {
        String orderId = request.getOrder() != null ? request.getOrder().getId() : null;
        logger.info("Submitting invoice for order {} to billing backend", orderId);
        try {
            JsonNode body = billingBackendWebClient.post()
                    .uri("/billing/generate-xml")
                    .headers(BackendResponses::relayOperatorToken)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(request)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response -> BackendResponses.toBackendException(response, objectMapper))
                    .bodyToMono(JsonNode.class)
                    .doOnSubscribe(subscription -> onDispatched.run())
                    .block();
            return BackendResponses.read(body, GenerateInvoiceResponse.class, objectMapper, "generate-xml");
        } catch (WebClientRequestException e) {
            logger.error("No response from billing backend for order {}: {}", orderId, e.getMessage());
            throw BillingBackendException.transport("generate-xml", e);
        }
    }

    /**
     * Ask the backend to re-query the SRI for an invoice's authorization.
     */
    public StatusCheckResponse checkInvoiceStatus(String accessKey) {
        logger.debug("Checking SRI status for access key {}", accessKey);
        try {
            JsonNode body = billingBackendWebClient.post()
                    .uri("/billing/check-status/{accessKey}", accessKey)
                    .headers(BackendResponses::relayOperatorToken)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of())
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response -> BackendResponses.toBackendException(response, objectMapper))
                    .bodyToMono(JsonNode.class)
                    .block();
            return BackendResponses.read(body, StatusCheckResponse.class, objectMapper, "check-status");
        } catch (WebClientRequestException e) {
            throw BillingBackendException.transport("check-status", e);
        }
    }

    /**
     * @return the credit note as stored by the backend, or null when it only acknowledged
     */
    public CreditNoteDTO generateCreditNote(CreditNoteBackendRequest request) {
        logger.info("Submitting credit note for bill {} with reason {}", request.getBillId(), request.getReason());
        try {
            JsonNode body = billingBackendWebClient.post()
                    .uri("/credit-notes")
                    .headers(BackendResponses::relayOperatorToken)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(request)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response -> BackendResponses.toBackendException(response, objectMapper))
                    .bodyToMono(JsonNode.class)
                    .block();
            if (body == null || !BackendResponses.unwrap(body).isObject()) {
                return null;
            }
            return BackendResponses.read(body, CreditNoteDTO.class, objectMapper, "credit-notes");
        } catch (WebClientRequestException e) {
            throw BillingBackendException.transport("credit-notes", e);
        }
    }

    public StatusCheckResponse checkCreditNoteStatus(String accessKey) {
        try {
            JsonNode body = billingBackendWebClient.post()
                    .uri("/credit-notes/check-status")
                    .headers(BackendResponses::relayOperatorToken)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("accessKey", accessKey))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response -> BackendResponses.toBackendException(response, objectMapper))
                    .bodyToMono(JsonNode.class)
                    .block();
            return BackendResponses.read(body, StatusCheckResponse.class, objectMapper, "credit-note check-status");
        } catch (WebClientRequestException e) {
            throw BillingBackendException.transport("credit-note check-status", e);
        }
    }

    public PageResponse<BillDTO> getBills(BillQuery query) {
        try {
            JsonNode body = billingBackendWebClient.get()
                    .uri(builder -> withQuery(builder.path("/bills"), query))
                    .headers(BackendResponses::relayOperatorToken)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response -> BackendResponses.toBackendException(response, objectMapper))
                    .bodyToMono(JsonNode.class)
                    .block();
            return BackendResponses.read(body, BILL_PAGE, objectMapper, "bills");
        } catch (WebClientRequestException e) {
            throw BillingBackendException.transport("bills", e);
        }
    }

    public PageResponse<CreditNoteDTO> getCreditNotes(BillQuery query) {
        try {
            JsonNode body = billingBackendWebClient.get()
                    .uri(builder -> withQuery(builder.path("/credit-notes"), query))
                    .headers(BackendResponses::relayOperatorToken)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response -> BackendResponses.toBackendException(response, objectMapper))
                    .bodyToMono(JsonNode.class)
                    .block();
            return BackendResponses.read(body, CREDIT_NOTE_PAGE, objectMapper, "credit-notes");
        } catch (WebClientRequestException e) {
            throw BillingBackendException.transport("credit-notes", e);
        }
    }

    /**
     * RIDE of a stored bill, as A4 PDF or as 80mm ticket.
     */
    public byte[] downloadBillPdf(String billId, String format) {
        try {
            return billingBackendWebClient.get()
                    .uri(builder -> {
                        builder.path("/bills/{id}/pdf");
                        if (format != null && !format.isBlank()) {
                            builder.queryParam("format", format);
                        }
                        return builder.build(billId);
                    })
                    .headers(BackendResponses::relayOperatorToken)
                    .accept(MediaType.APPLICATION_PDF)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response -> BackendResponses.toBackendException(response, objectMapper))
                    .bodyToMono(byte[].class)
                    .block();
        } catch (WebClientRequestException e) {
            throw BillingBackendException.transport("bill pdf", e);
        }
    }

    /**
     * Destructive: purges bills and credit notes, zeroes the sequences and unmarks billed orders.
     */
    public void resetBillingSystem() {
        logger.warn("Requesting full billing system reset");
        try {
            billingBackendWebClient.post()
                    .uri("/bills/reset")
                    .headers(BackendResponses::relayOperatorToken)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of())
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response -> BackendResponses.toBackendException(response, objectMapper))
                    .toBodilessEntity()
                    .block();
        } catch (WebClientRequestException e) {
            throw BillingBackendException.transport("bills reset", e);
        }
    }

    private static URI withQuery(UriBuilder builder, BillQuery query) {
        if (query != null) {
            addParam(builder, "page", query.getPage());
            addParam(builder, "limit", query.getLimit());
            addParam(builder, "documentNumber", query.getDocumentNumber());
            addParam(builder, "customerIdentification", query.getCustomerIdentification());
            addParam(builder, "documentType", query.getDocumentType());
            addParam(builder, "billId", query.getBillId());
            addParam(builder, "reason", query.getReason());
        }
        return builder.build();
    }

    private static void addParam(UriBuilder builder, String name, Object value) {
        if (value != null && !value.toString().isBlank()) {
            builder.queryParam(name, value);
        }
    }
}
