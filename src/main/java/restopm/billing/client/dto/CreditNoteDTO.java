package restopm.billing.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CreditNoteDTO {
    private String id;
    private String billId;
    private String documentNumber;
    private String originalDocumentNumber;
    private String reason;
    private String reasonDescription;
    private String customerName;
    private String customerIdentification;
    private BigDecimal total;
    private String accessKey;
    private String sriStatus;
    private String date;
}
