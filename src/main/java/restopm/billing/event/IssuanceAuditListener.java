package restopm.billing.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import restopm.billing.model.BillingState;

/**
 * Writes the issuance audit trail to the log.
 */
@Component
@Slf4j
public class IssuanceAuditListener {

    @EventListener
    public void onStateChanged(IssuanceStateChangedEvent event) {
        if (event.getState() == BillingState.ERROR) {
            log.warn("❌ [{}] order {} {} -> {}: {}", event.getOperator(), event.getOrderId(),
                    event.getPreviousState(), event.getState(), event.getDetails());
        } else if (event.getState() == BillingState.AUTHORIZED) {
            log.info("✅ [{}] order {} authorized, access key {}", event.getOperator(), event.getOrderId(),
                    event.getAccessKey());
        } else {
            log.info("[{}] order {} {} -> {}", event.getOperator(), event.getOrderId(),
                    event.getPreviousState(), event.getState());
        }
    }
}
