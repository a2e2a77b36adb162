package restopm.billing.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Immutable view of an issuance process, as rendered by the progress dialog.
 */
@Value
@Builder
public class IssuanceSnapshot {
    String orderId;
    BillingState state;
    String message;
    String details;
    boolean dismissible;
    boolean dismissed;
    String sequential;
    String accessKey;
    String authorizationDate;
    TaxBreakdown amounts;
    PrintableReceipt receipt;
    List<IssuanceWarning> warnings;
    Instant updatedAt;
}
