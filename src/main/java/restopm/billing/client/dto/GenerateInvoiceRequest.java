package restopm.billing.client.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import restopm.billing.model.ClientData;
import restopm.billing.model.Order;

import java.math.BigDecimal;

/**
 * Body of POST /billing/generate-xml. The backend builds, signs and sends the XML.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerateInvoiceRequest {
    private Order order;
    private ClientData client;
    private BigDecimal taxRate;
    private String logoUrl;
}
