package restopm.billing.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import restopm.billing.client.BillingBackendClient;
import restopm.billing.client.dto.BillDTO;
import restopm.billing.client.dto.BillQuery;
import restopm.billing.client.dto.PageResponse;
import restopm.billing.client.dto.StatusCheckResponse;
import restopm.billing.dto.StatusCheckResult;
import restopm.billing.exception.ResourceNotFoundException;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Billing history as last listed by the operator. Credit note preconditions are
 * checked against this snapshot, so a bill must have been listed first.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BillHistoryService {

    private static final Set<String> PDF_FORMATS = Set.of("a4", "ticket");

    private final BillingBackendClient billingBackendClient;
    private final AuthorizationClassifier classifier;

    private final Map<String, BillDTO> snapshot = new ConcurrentHashMap<>();

    /**
     * Fetch a page of bills and remember every bill on it.
     */
    public PageResponse<BillDTO> listBills(BillQuery query) {
        PageResponse<BillDTO> page = billingBackendClient.getBills(query);
        if (page.getData() != null) {
            page.getData().stream()
                    .filter(bill -> bill.getId() != null)
                    .forEach(bill -> snapshot.put(bill.getId(), bill));
        }
        log.debug("Listed {} bill(s), {} in snapshot", page.getData() != null ? page.getData().size() : 0, snapshot.size());
        return page;
    }

    public Optional<BillDTO> findBill(String billId) {
        return Optional.ofNullable(snapshot.get(billId));
    }

    public BillDTO requireBill(String billId) {
        return findBill(billId).orElseThrow(() -> new ResourceNotFoundException(
                "Bill " + billId + " is not in the current history; refresh the bill list first"));
    }

    /**
     * Forget a bill whose backend state is known to have changed.
     */
    public void evict(String billId) {
        snapshot.remove(billId);
    }

    public void clear() {
        snapshot.clear();
    }

    /**
     * Re-query the authority for a stored invoice. The snapshot entry is evicted when
     * its status changes so the next listing shows the fresh state.
     */
    public StatusCheckResult checkStatus(String accessKey) {
        StatusCheckResponse response = billingBackendClient.checkInvoiceStatus(accessKey);
        AuthorizationClassifier.Verdict verdict = classifier.classify(response, accessKey);
        snapshot.values().removeIf(bill -> accessKey.equals(bill.getAccessKey())
                && !String.valueOf(verdict.getStatus()).equals(bill.getSriStatus()));
        log.info("SRI status for {}: {} ({})", accessKey, verdict.getState(), verdict.getStatus());
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

    public byte[] downloadPdf(String billId, String format) {
        String normalized = format != null ? format.trim().toLowerCase(Locale.ROOT) : "a4";
        if (!PDF_FORMATS.contains(normalized)) {
            throw new IllegalArgumentException("Unsupported PDF format: " + format + " (expected a4 or ticket)");
        }
        return billingBackendClient.downloadBillPdf(billId, normalized);
    }
}
