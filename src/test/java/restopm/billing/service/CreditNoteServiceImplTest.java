package restopm.billing.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import restopm.billing.client.BillingBackendClient;
import restopm.billing.client.dto.BillDTO;
import restopm.billing.client.dto.CreditNoteBackendRequest;
import restopm.billing.client.dto.CreditNoteDTO;
import restopm.billing.dto.CreditNoteEligibility;
import restopm.billing.dto.CreditNoteRequest;
import restopm.billing.exception.BillingBackendException;
import restopm.billing.exception.CreditNoteNotAllowedException;
import restopm.billing.exception.ResourceNotFoundException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CreditNoteServiceImplTest {

    private static final ZoneId GUAYAQUIL = ZoneId.of("America/Guayaquil");

    @Mock
    private BillHistoryService billHistoryService;
    @Mock
    private BillingBackendClient billingBackendClient;
    @Mock
    private RestaurantConfigCache configCache;

    private CreditNoteServiceImpl serviceAt(String localDateTime) {
        Clock clock = Clock.fixed(LocalDateTime.parse(localDateTime).atZone(GUAYAQUIL).toInstant(), GUAYAQUIL);
        IssuanceValidator validator =
                new IssuanceValidator(new IdentificationValidator(), "9999999999999", new BigDecimal("50.00"));
        return new CreditNoteServiceImpl(billHistoryService, billingBackendClient, validator, configCache,
                new AuthorizationClassifier(), clock);
    }

    @Test
    void authorizedBillWithinDeadlineIsEligible() {
        when(billHistoryService.requireBill("b-1")).thenReturn(bill());

        CreditNoteEligibility eligibility = serviceAt("2026-10-07T20:00:00").eligibility("b-1");

        assertThat(eligibility.isEligible()).isTrue();
        assertThat(eligibility.getReasons()).isEmpty();
        assertThat(eligibility.getDeadline()).isEqualTo(LocalDateTime.of(2026, 10, 7, 23, 59, 59));
    }

    @Test
    void deadlineIsSeventhOfFollowingMonth() {
        when(billHistoryService.requireBill("b-1")).thenReturn(bill());

        CreditNoteEligibility eligibility = serviceAt("2026-10-08T00:00:30").eligibility("b-1");

        assertThat(eligibility.isEligible()).isFalse();
        assertThat(eligibility.getReasons()).singleElement().asString().startsWith("Fuera de plazo");
    }

    @Test
    void isoTimestampsUseTheFiscalDay() {
        CreditNoteServiceImpl service = serviceAt("2026-10-01T10:00:00");

        assertThat(service.deadlineFor("2026-10-01T03:30:00.000Z")).isEqualTo(LocalDateTime.of(2026, 10, 7, 23, 59, 59));
        assertThat(service.deadlineFor("2026-10-01")).isEqualTo(LocalDateTime.of(2026, 11, 7, 23, 59, 59));
        assertThat(service.deadlineFor("31/12/2026")).isEqualTo(LocalDateTime.of(2027, 1, 7, 23, 59, 59));
        assertThat(service.deadlineFor("ayer")).isNull();
    }

    @Test
    void billWithCreditNoteIsRejectedWithoutCallingBackend() {
        BillDTO cancelled = bill();
        cancelled.setHasCreditNote(true);
        when(billHistoryService.requireBill("b-1")).thenReturn(cancelled);

        assertThatThrownBy(() -> serviceAt("2026-10-01T10:00:00").issueCreditNote(request("01")))
                .isInstanceOf(CreditNoteNotAllowedException.class)
                .hasMessageContaining("ya tiene una nota de crédito");
        verifyNoInteractions(billingBackendClient);
    }

    @Test
    void finalConsumerBillIsRejected() {
        BillDTO finalConsumer = bill();
        finalConsumer.setCustomerIdentification("9999999999999");
        when(billHistoryService.requireBill("b-1")).thenReturn(finalConsumer);

        assertThatThrownBy(() -> serviceAt("2026-10-01T10:00:00").issueCreditNote(request("01")))
                .isInstanceOf(CreditNoteNotAllowedException.class)
                .hasMessageContaining("CONSUMIDOR FINAL");
        verifyNoInteractions(billingBackendClient);
    }

    @Test
    void unauthorizedBillWithoutAccessKeyCollectsEveryReason() {
        BillDTO draft = bill();
        draft.setSriStatus("DEVUELTA");
        draft.setAccessKey(null);
        when(billHistoryService.requireBill("b-1")).thenReturn(draft);

        CreditNoteEligibility eligibility = serviceAt("2026-10-01T10:00:00").eligibility("b-1");

        assertThat(eligibility.getReasons()).hasSize(2);
    }

    @Test
    void issuesAndEvictsBill() {
        when(billHistoryService.requireBill("b-1")).thenReturn(bill());
        when(configCache.taxRate()).thenReturn(new BigDecimal("15"));
        when(billingBackendClient.generateCreditNote(any()))
                .thenReturn(CreditNoteDTO.builder().id("cn-1").billId("b-1").build());

        CreditNoteDTO created = serviceAt("2026-10-01T10:00:00").issueCreditNote(request("05"));

        ArgumentCaptor<CreditNoteBackendRequest> sent = ArgumentCaptor.forClass(CreditNoteBackendRequest.class);
        verify(billingBackendClient).generateCreditNote(sent.capture());
        assertThat(sent.getValue().getReason()).isEqualTo("05");
        assertThat(sent.getValue().getTaxRate()).isEqualByComparingTo("15");
        assertThat(sent.getValue().getCustomDescription()).isEqualTo("RUC mal digitado");
        assertThat(created.getId()).isEqualTo("cn-1");
        verify(billHistoryService).evict("b-1");
    }

    @Test
    void backendFailureKeepsSnapshot() {
        when(billHistoryService.requireBill("b-1")).thenReturn(bill());
        when(configCache.taxRate()).thenReturn(new BigDecimal("15"));
        when(billingBackendClient.generateCreditNote(any()))
                .thenThrow(new BillingBackendException(400, "Secuencial de nota de crédito duplicado"));

        assertThatThrownBy(() -> serviceAt("2026-10-01T10:00:00").issueCreditNote(request("01")))
                .isInstanceOf(BillingBackendException.class)
                .hasMessage("Secuencial de nota de crédito duplicado");
        verify(billHistoryService, never()).evict(any());
    }

    @Test
    void unknownBillIsNotFound() {
        when(billHistoryService.requireBill("b-9")).thenThrow(new ResourceNotFoundException("Bill b-9 is not in the current history"));

        assertThatThrownBy(() -> serviceAt("2026-10-01T10:00:00").eligibility("b-9"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void unknownReasonCodeIsRejected() {
        assertThatThrownBy(() -> serviceAt("2026-10-01T10:00:00").issueCreditNote(request("09")))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(billingBackendClient, billHistoryService);
    }

    private static CreditNoteRequest request(String reasonCode) {
        return CreditNoteRequest.builder()
                .billId("b-1")
                .reasonCode(reasonCode)
                .customDescription("RUC mal digitado")
                .build();
    }

    private static BillDTO bill() {
        return BillDTO.builder()
                .id("b-1")
                .documentNumber("001-001-000000012")
                .date("15/09/2026")
                .customerIdentification("1710034065")
                .customerName("Ana Pérez")
                .total(new BigDecimal("57.50"))
                .accessKey("1509202601179001167400110010010000000121234567811")
                .sriStatus("AUTORIZADO")
                .hasCreditNote(false)
                .build();
    }
}
