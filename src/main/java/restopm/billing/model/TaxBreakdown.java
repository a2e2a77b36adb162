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
public class TaxBreakdown {
    private BigDecimal taxRate;    // percentage, e.g. 15
    private BigDecimal subtotal;   // total without tax
    private BigDecimal tax;
    private BigDecimal total;      // tax included, as charged to the customer
}
