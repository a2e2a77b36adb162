package restopm.billing.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import restopm.billing.exception.BillingBackendException;
import restopm.billing.exception.IssuanceInProgressException;
import restopm.billing.exception.IssuanceWarningsException;
import restopm.billing.exception.ResourceNotFoundException;
import restopm.billing.model.BillingState;
import restopm.billing.model.IssuanceSnapshot;
import restopm.billing.model.IssuanceWarning;
import restopm.billing.service.InvoiceIssuanceService;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(IssuanceController.class)
class IssuanceControllerTest {

    private static final String ISSUE_BODY = """
            {
              "order": {
                "id": "order-1",
                "status": "Completado",
                "items": [{"name": "Churrasco", "quantity": 1, "price": 22.50, "prepared": true}]
              },
              "client": {"identification": "1710034065", "name": "Ana Pérez", "email": "ana@correo.ec"},
              "confirmWarnings": false
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private InvoiceIssuanceService issuanceService;

    @Test
    void issueReturnsFinishedSnapshot() throws Exception {
        when(issuanceService.issue(any())).thenReturn(IssuanceSnapshot.builder()
                .orderId("order-1")
                .state(BillingState.AUTHORIZED)
                .message(BillingState.AUTHORIZED.getDisplayMessage())
                .dismissible(true)
                .accessKey("1910202601179001167400110010010000000121234567811")
                .warnings(List.of())
                .build());

        mockMvc.perform(post("/api/issuances").contentType(MediaType.APPLICATION_JSON).content(ISSUE_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("AUTHORIZED"))
                .andExpect(jsonPath("$.dismissible").value(true));
    }

    @Test
    void unconfirmedWarningsAreAConflict() throws Exception {
        when(issuanceService.issue(any())).thenThrow(new IssuanceWarningsException(List.of(
                new IssuanceWarning(IssuanceWarning.Code.NO_EMAIL_DELIVERY, "sin email"))));

        mockMvc.perform(post("/api/issuances").contentType(MediaType.APPLICATION_JSON).content(ISSUE_BODY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.warnings[0].code").value("NO_EMAIL_DELIVERY"));
    }

    @Test
    void secondIssuanceIsAConflict() throws Exception {
        when(issuanceService.issue(any())).thenThrow(new IssuanceInProgressException("order-1", BillingState.PENDING));

        mockMvc.perform(post("/api/issuances").contentType(MediaType.APPLICATION_JSON).content(ISSUE_BODY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.state").value("PENDING"));
    }

    @Test
    void missingClientIsRejectedBeforeService() throws Exception {
        mockMvc.perform(post("/api/issuances").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"order\": {\"id\": \"order-1\"}}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(issuanceService);
    }

    @Test
    void backendMessageIsRelayedAsBadGateway() throws Exception {
        when(issuanceService.checkStatus("order-1"))
                .thenThrow(new BillingBackendException(500, "Servicio del SRI no disponible, intente más tarde"));

        mockMvc.perform(post("/api/issuances/order-1/check-status"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.message").value("Servicio del SRI no disponible, intente más tarde"));
    }

    @Test
    void unknownOrderIsNotFound() throws Exception {
        when(issuanceService.status("order-9")).thenThrow(new ResourceNotFoundException("No issuance found for order order-9"));

        mockMvc.perform(get("/api/issuances/order-9"))
                .andExpect(status().isNotFound());
    }

    @Test
    void precheckListsWarnings() throws Exception {
        when(issuanceService.precheck(any(), any())).thenReturn(List.of(
                new IssuanceWarning(IssuanceWarning.Code.FINAL_CONSUMER_LIMIT, "límite")));

        mockMvc.perform(post("/api/issuances/precheck").contentType(MediaType.APPLICATION_JSON).content(ISSUE_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.confirmationRequired").value(true))
                .andExpect(jsonPath("$.warnings[0].code").value("FINAL_CONSUMER_LIMIT"));
    }
}
