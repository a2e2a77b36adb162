package restopm.billing.client.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Filters accepted by the backend listings. Null fields are not sent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BillQuery {
    private Integer page;
    private Integer limit;
    private String documentNumber;
    private String customerIdentification;
    private String documentType;
    private String billId;      // credit notes only
    private String reason;      // credit notes only
}
