package restopm.billing.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import restopm.billing.exception.IssuanceInProgressException;
import restopm.billing.exception.ResourceNotFoundException;
import restopm.billing.model.BillingState;
import restopm.billing.model.IssuanceProcess;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory processes by order id. At most one live issuance exists per order:
 * a new one is refused while the current one is processing, pending or authorized.
 */
@Component
@Slf4j
public class IssuanceRegistry {

    private final Map<String, IssuanceProcess> processes = new ConcurrentHashMap<>();

    /**
     * Registers a fresh process for the order, replacing an errored one.
     *
     * @throws IssuanceInProgressException if the order already has a live issuance
     */
    public IssuanceProcess begin(String orderId) {
        return processes.compute(orderId, (id, existing) -> {
            if (existing != null) {
                BillingState state = existing.getState();
                if (state.isProcessing() || state == BillingState.PENDING || state == BillingState.AUTHORIZED) {
                    throw new IssuanceInProgressException(id, state);
                }
                log.debug("Replacing {} issuance for order {}", state, id);
            }
            return new IssuanceProcess(id);
        });
    }

    public Optional<IssuanceProcess> find(String orderId) {
        return Optional.ofNullable(processes.get(orderId));
    }

    public IssuanceProcess require(String orderId) {
        return find(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("No issuance found for order " + orderId));
    }

    /**
     * Closes the operator's dialog. Errored processes are forgotten so the order can
     * be issued again; pending and authorized ones stay registered and keep blocking
     * a second issuance.
     *
     * @throws IllegalStateException while the process is still processing
     */
    public void dismiss(String orderId) {
        processes.compute(orderId, (id, existing) -> {
            if (existing == null) {
                throw new ResourceNotFoundException("No issuance found for order " + id);
            }
            BillingState state = existing.getState();
            if (!state.isDismissible()) {
                throw new IllegalStateException(
                        "Issuance for order " + id + " is " + state + " and cannot be dismissed yet");
            }
            if (state == BillingState.ERROR) {
                return null;
            }
            existing.markDismissed();
            log.debug("Keeping dismissed {} issuance for order {}", state, id);
            return existing;
        });
    }

    public void clear() {
        processes.clear();
    }
}
