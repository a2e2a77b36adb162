package restopm.billing.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kitchen status of an order. Operators move it around the cycle
 * New → Ready → Completed → New; only completed orders can be invoiced.
 */
public enum OrderStatus {
    NEW("Nuevo"),
    READY("Listo"),
    COMPLETED("Completado");

    private final String label;

    OrderStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public OrderStatus next() {
        return switch (this) {
            case NEW -> READY;
            case READY -> COMPLETED;
            case COMPLETED -> NEW;
        };
    }

    @JsonCreator
    public static OrderStatus fromLabel(String value) {
        for (OrderStatus status : values()) {
            if (status.label.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown order status: " + value);
    }
}
