package restopm.billing.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GenerateInvoiceResponse {
    private boolean success;
    private String invoiceId;       // sequential assigned by the backend
    private String accessKey;
    private SriResult sriResponse;  // reception verdict
    private SriResult authorization;
    private String error;

    /**
     * Authorization date wherever this backend version put it.
     */
    public String resolveAuthorizationDate() {
        if (authorization != null && authorization.getFechaAutorizacion() != null) {
            return authorization.getFechaAutorizacion();
        }
        if (sriResponse == null) {
            return null;
        }
        if (sriResponse.getFechaAutorizacion() != null) {
            return sriResponse.getFechaAutorizacion();
        }
        return sriResponse.getAuthResult() != null ? sriResponse.getAuthResult().getFechaAutorizacion() : null;
    }
}
