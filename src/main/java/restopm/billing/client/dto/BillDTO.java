package restopm.billing.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Bill as stored by the backend. Dates are kept as strings because the backend
 * mixes the SRI format (dd/MM/yyyy) with ISO timestamps.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BillDTO {
    private String id;
    private String documentNumber;      // 001-001-000000001
    private String orderId;
    private String date;
    private String documentType;        // Factura, Nota de Venta
    private String customerName;
    private String customerIdentification;
    private String customerAddress;
    private String customerEmail;

    @Builder.Default
    private List<BillItemDTO> items = new ArrayList<>();

    private BigDecimal subtotal;
    private BigDecimal tax;
    private BigDecimal total;
    private String regime;
    private String accessKey;
    private String sriStatus;
    private String environment;
    private String authorizationDate;
    private Boolean hasCreditNote;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BillItemDTO {
        private String name;
        private BigDecimal quantity;
        private BigDecimal price;
        private BigDecimal total;
    }
}
