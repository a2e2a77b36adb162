package restopm.billing.client.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CreditNoteBackendRequest {
    private String billId;
    private String reason;              // SRI code 01..07
    private String customDescription;
    private BigDecimal taxRate;
}
