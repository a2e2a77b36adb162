package restopm.billing.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderItem {
    private String name;
    private int quantity;
    private BigDecimal price;     // unit price at the moment of ordering, tax included
    private Boolean prepared;

    public BigDecimal lineTotal() {
        BigDecimal unitPrice = price != null ? price : BigDecimal.ZERO;
        return unitPrice.multiply(BigDecimal.valueOf(quantity));
    }

    public boolean isPrepared() {
        return Boolean.TRUE.equals(prepared);
    }
}
