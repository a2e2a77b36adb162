package restopm.billing.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Data needed to print the RIDE of an authorized invoice.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrintableReceipt {
    private String sequential;
    private String documentNumber;      // establishment-emissionPoint-sequential
    private String accessKey;
    private String authorizationDate;
    private String environment;         // 1 = pruebas, 2 = producción
    private String issuerRuc;
    private String issuerBusinessName;
    private String customerIdentification;
    private String customerName;
    private String customerAddress;
    private String customerEmail;
    private List<OrderItem> items;
    private TaxBreakdown amounts;
    private String logoUrl;
}
