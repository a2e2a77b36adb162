package restopm.billing.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import restopm.billing.client.BillingBackendClient;
import restopm.billing.context.OperatorContext;
import restopm.billing.exception.ConfirmationPhraseMismatchException;

/**
 * Destructive maintenance of the billing data.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BillingAdminService {

    public static final String RESET_BILLING_PHRASE = "ELIMINAR TODO";

    private final BillingBackendClient billingBackendClient;
    private final IssuanceRegistry issuanceRegistry;
    private final BillHistoryService billHistoryService;
    private final RestaurantConfigCache configCache;

    /**
     * Purge every bill and credit note, zero the sequences and unmark billed orders.
     * Requires the exact phrase ELIMINAR TODO.
     */
    public void resetBillingSystem(String confirmation) {
        if (!RESET_BILLING_PHRASE.equals(confirmation)) {
            throw new ConfirmationPhraseMismatchException("billing reset");
        }
        log.warn("⚠️ Billing system reset requested by {}", OperatorContext.getOperator());
        billingBackendClient.resetBillingSystem();
        issuanceRegistry.clear();
        billHistoryService.clear();
        // the old snapshot carries pre-reset sequences
        configCache.invalidate();
        configCache.refresh();
        log.warn("Billing system reset completed");
    }
}
