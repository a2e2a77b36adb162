package restopm.billing.service;

import org.springframework.stereotype.Component;
import restopm.billing.model.Order;
import restopm.billing.model.TaxBreakdown;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Splits a tax-included order total into subtotal and tax.
 * The subtotal is rounded to cents and the tax takes the remainder, so
 * subtotal + tax always equals the charged total.
 */
@Component
public class TaxCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public TaxBreakdown breakdown(Order order, BigDecimal taxRate) {
        return breakdown(order.total(), taxRate);
    }

    public TaxBreakdown breakdown(BigDecimal total, BigDecimal taxRate) {
        if (taxRate == null || taxRate.signum() < 0) {
            throw new IllegalArgumentException("Tax rate must be zero or positive, got " + taxRate);
        }
        BigDecimal charged = total.setScale(2, RoundingMode.HALF_UP);
        BigDecimal divisor = BigDecimal.ONE.add(taxRate.divide(HUNDRED, 10, RoundingMode.HALF_UP));
        BigDecimal subtotal = charged.divide(divisor, 2, RoundingMode.HALF_UP);
        BigDecimal tax = charged.subtract(subtotal);
        return TaxBreakdown.builder()
                .taxRate(taxRate)
                .subtotal(subtotal)
                .tax(tax)
                .total(charged)
                .build();
    }
}
