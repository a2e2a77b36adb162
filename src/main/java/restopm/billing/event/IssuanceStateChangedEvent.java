package restopm.billing.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import restopm.billing.model.BillingState;

import java.time.Instant;

/**
 * Event published on every move of an issuance process.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IssuanceStateChangedEvent {

    private String orderId;

    private BillingState previousState;

    private BillingState state;

    /**
     * Backend or authority detail attached to the move, if any.
     */
    private String details;

    /**
     * Access key once the backend has assigned one.
     */
    private String accessKey;

    /**
     * Operator who triggered the issuance, as sent in X-Operator.
     */
    private String operator;

    private Instant occurredAt;
}
