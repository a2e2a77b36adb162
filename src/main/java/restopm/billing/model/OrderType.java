package restopm.billing.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum OrderType {
    DINE_IN("En Local"),
    DELIVERY("Delivery"),
    TAKEOUT("Para Llevar");

    private final String label;

    OrderType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static OrderType fromLabel(String value) {
        for (OrderType type : values()) {
            if (type.label.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown order type: " + value);
    }
}
