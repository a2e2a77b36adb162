package restopm.billing.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Order as sent by the POS. The billing flow reads it but never changes it:
 * the billed flag is only ever set by the backend after a successful issuance.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Order {

    private String id;
    private String customerName;
    private OrderType type;
    private OrderStatus status;

    @Builder.Default
    private List<OrderItem> items = new ArrayList<>();

    private String createdAt;     // ISO-8601 as produced by the backend
    private String orderNumber;
    private boolean billed;

    /**
     * Sum of price × quantity over all items.
     */
    public BigDecimal total() {
        if (items == null) {
            return BigDecimal.ZERO;
        }
        return items.stream()
                .map(OrderItem::lineTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public boolean hasItems() {
        return items != null && !items.isEmpty();
    }

    public boolean hasUnpreparedItems() {
        return hasItems() && items.stream().anyMatch(item -> !item.isPrepared());
    }

    /**
     * Moves the order one step around its status cycle.
     *
     * @throws IllegalStateException if the next status requires all items prepared and some are not
     */
    public OrderStatus advanceStatus() {
        OrderStatus current = status != null ? status : OrderStatus.NEW;
        OrderStatus next = current.next();
        if (next != OrderStatus.NEW && hasUnpreparedItems()) {
            throw new IllegalStateException(
                    "Order " + id + " has unprepared items and cannot move to " + next.getLabel());
        }
        status = next;
        return next;
    }
}
