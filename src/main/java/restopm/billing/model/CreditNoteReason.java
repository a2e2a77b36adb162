package restopm.billing.model;

import java.util.Optional;

/**
 * Reason codes accepted by the SRI for a credit note.
 */
public enum CreditNoteReason {
    RETURN_OF_GOODS("01", "Devolución de mercancías"),
    DISCOUNT_GRANTED("02", "Descuento concedido"),
    RETURN_VOIDED_DOCUMENT("03", "Devolución por comprobante anulado"),
    DISCOUNT_VOIDED_DOCUMENT("04", "Descuento por comprobante anulado"),
    WRONG_RUC("05", "Error en el RUC"),
    WRONG_DESCRIPTION("06", "Error en descripción"),
    PRICE_CORRECTION("07", "Corrección de precio");

    private final String code;
    private final String label;

    CreditNoteReason(String code, String label) {
        this.code = code;
        this.label = label;
    }

    public String getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Regulator label followed by the operator's free text, if any.
     */
    public String describe(String customDescription) {
        if (customDescription == null || customDescription.isBlank()) {
            return label;
        }
        return label + " - " + customDescription.trim();
    }

    public static Optional<CreditNoteReason> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        for (CreditNoteReason reason : values()) {
            if (reason.code.equals(code.trim())) {
                return Optional.of(reason);
            }
        }
        return Optional.empty();
    }
}
