package restopm.billing.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import restopm.billing.client.BillingBackendClient;
import restopm.billing.client.dto.BillDTO;
import restopm.billing.client.dto.BillQuery;
import restopm.billing.client.dto.CreditNoteBackendRequest;
import restopm.billing.client.dto.CreditNoteDTO;
import restopm.billing.client.dto.PageResponse;
import restopm.billing.client.dto.StatusCheckResponse;
import restopm.billing.dto.CreditNoteEligibility;
import restopm.billing.dto.CreditNoteRequest;
import restopm.billing.dto.StatusCheckResult;
import restopm.billing.exception.CreditNoteNotAllowedException;
import restopm.billing.model.CreditNoteReason;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Implementation of CreditNoteService.
 * A credit note may only be issued for an authorized, not yet cancelled invoice of an
 * identified buyer, until 23:59:59 of the 7th day of the month after the invoice date.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CreditNoteServiceImpl implements CreditNoteService {

    private static final DateTimeFormatter SRI_DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy");
    private static final DateTimeFormatter DISPLAY = DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm:ss");
    private static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59);
    private static final int DEADLINE_DAY = 7;

    private final BillHistoryService billHistoryService;
    private final BillingBackendClient billingBackendClient;
    private final IssuanceValidator issuanceValidator;
    private final RestaurantConfigCache configCache;
    private final AuthorizationClassifier classifier;
    private final Clock billingClock;

    @Override
    public CreditNoteEligibility eligibility(String billId) {
        BillDTO bill = billHistoryService.requireBill(billId);
        LocalDateTime deadline = deadlineFor(bill.getDate());
        List<String> reasons = blockingReasons(bill, deadline);
        return CreditNoteEligibility.builder()
                .billId(billId)
                .documentNumber(bill.getDocumentNumber())
                .deadline(deadline)
                .reasons(reasons)
                .eligible(reasons.isEmpty())
                .build();
    }

    @Override
    public CreditNoteDTO issueCreditNote(CreditNoteRequest request) {
        CreditNoteReason reason = CreditNoteReason.fromCode(request.getReasonCode())
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown credit note reason code: " + request.getReasonCode()));
        BillDTO bill = billHistoryService.requireBill(request.getBillId());

        List<String> reasons = blockingReasons(bill, deadlineFor(bill.getDate()));
        if (!reasons.isEmpty()) {
            throw new CreditNoteNotAllowedException(bill.getId(), reasons);
        }

        BigDecimal taxRate = request.getTaxRate() != null ? request.getTaxRate() : configCache.taxRate();
        String description = request.getCustomDescription() != null && !request.getCustomDescription().isBlank()
                ? request.getCustomDescription().trim()
                : null;
        log.info("📝 Issuing credit note for bill {} ({}): {}", bill.getId(), bill.getDocumentNumber(),
                reason.describe(description));

        CreditNoteDTO created = billingBackendClient.generateCreditNote(CreditNoteBackendRequest.builder()
                .billId(bill.getId())
                .reason(reason.getCode())
                .customDescription(description)
                .taxRate(taxRate)
                .build());

        // the bill only shows as cancelled after the next listing
        billHistoryService.evict(bill.getId());
        log.info("✅ Credit note issued for bill {}", bill.getId());
        return created;
    }

    @Override
    public PageResponse<CreditNoteDTO> listCreditNotes(BillQuery query) {
        return billingBackendClient.getCreditNotes(query);
    }

    @Override
    public StatusCheckResult checkCreditNoteStatus(String accessKey) {
        StatusCheckResponse response = billingBackendClient.checkCreditNoteStatus(accessKey);
        AuthorizationClassifier.Verdict verdict = classifier.classify(response, accessKey);
        log.info("SRI status for credit note {}: {} ({})", accessKey, verdict.getState(), verdict.getStatus());
        return StatusCheckResult.builder()
                .accessKey(accessKey)
                .state(verdict.getState())
                .sriStatus(verdict.getStatus())
                .authorizationDate(response.getAuthorization() != null
                        ? response.getAuthorization().getFechaAutorizacion()
                        : null)
                .details(verdict.getDetails())
                .build();
    }

    List<String> blockingReasons(BillDTO bill, LocalDateTime deadline) {
        List<String> reasons = new ArrayList<>();
        String status = bill.getSriStatus() != null ? bill.getSriStatus().trim().toUpperCase(Locale.ROOT) : "";

        if ("CANCELLED".equals(status) || Boolean.TRUE.equals(bill.getHasCreditNote())) {
            reasons.add("La factura ya tiene una nota de crédito");
        } else if (!"AUTORIZADO".equals(status)) {
            reasons.add("Solo se pueden emitir notas de crédito para facturas AUTORIZADAS (estado: "
                    + (status.isEmpty() ? "desconocido" : status) + ")");
        }
        if (issuanceValidator.isFinalConsumer(bill.getCustomerIdentification())) {
            reasons.add("No se puede emitir una nota de crédito para facturas de CONSUMIDOR FINAL");
        }
        if (bill.getAccessKey() == null || bill.getAccessKey().isBlank()) {
            reasons.add("La factura no tiene clave de acceso");
        }
        if (deadline == null) {
            reasons.add("No se pudo determinar la fecha de emisión de la factura (" + bill.getDate() + ")");
        } else if (LocalDateTime.now(billingClock).isAfter(deadline)) {
            reasons.add("Fuera de plazo: las notas de crédito solo pueden emitirse hasta el "
                    + deadline.format(DISPLAY));
        }
        return reasons;
    }

    /**
     * 23:59:59 on the 7th of the month after the bill date, or null if the date is unreadable.
     */
    LocalDateTime deadlineFor(String billDate) {
        LocalDate issued = parseBillDate(billDate);
        if (issued == null) {
            return null;
        }
        return issued.plusMonths(1).withDayOfMonth(DEADLINE_DAY).atTime(END_OF_DAY);
    }

    private LocalDate parseBillDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = value.trim();
        try {
            if (text.contains("/")) {
                return LocalDate.parse(text.length() > 10 ? text.substring(0, 10) : text, SRI_DATE);
            }
            if (text.length() > 10) {
                // timestamps carry an offset; the fiscal day is the one in the restaurant's zone
                return OffsetDateTime.parse(text).atZoneSameInstant(billingClock.getZone()).toLocalDate();
            }
            return LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            try {
                return LocalDate.parse(text.substring(0, Math.min(10, text.length())));
            } catch (DateTimeException nested) {
                log.warn("Unreadable bill date '{}'", value);
                return null;
            }
        }
    }
}
