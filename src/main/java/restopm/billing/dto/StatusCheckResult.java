package restopm.billing.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import restopm.billing.model.BillingState;

/**
 * SRI status of a stored document, classified the same way as a fresh issuance.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatusCheckResult {
    private String accessKey;
    private BillingState state;
    private String sriStatus;
    private String authorizationDate;
    private String details;
}
