package restopm.billing.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of an electronic invoice issuance as seen by the operator.
 * <p>
 * The processing chain only moves forward:
 * VALIDATING → GENERATING → SIGNING → SENDING → WAITING_AUTHORIZATION,
 * and any processing state may fall into ERROR. WAITING_AUTHORIZATION resolves to
 * AUTHORIZED or PENDING; PENDING can only be re-entered into WAITING_AUTHORIZATION
 * by an explicit status check. AUTHORIZED and ERROR are final.
 */
public enum BillingState {
    IDLE("Listo para facturar"),
    VALIDATING("Validando datos del cliente"),
    GENERATING("Generando comprobante electrónico"),
    SIGNING("Firmando comprobante"),
    SENDING("Enviando al SRI"),
    WAITING_AUTHORIZATION("Esperando autorización del SRI"),
    AUTHORIZED("Factura autorizada"),
    PENDING("Factura recibida, autorización pendiente"),
    ERROR("No se pudo emitir la factura");

    private final String displayMessage;

    BillingState(String displayMessage) {
        this.displayMessage = displayMessage;
    }

    public String getDisplayMessage() {
        return displayMessage;
    }

    public Set<BillingState> successors() {
        return switch (this) {
            case IDLE -> EnumSet.of(VALIDATING);
            case VALIDATING -> EnumSet.of(GENERATING, ERROR);
            case GENERATING -> EnumSet.of(SIGNING, ERROR);
            case SIGNING -> EnumSet.of(SENDING, ERROR);
            case SENDING -> EnumSet.of(WAITING_AUTHORIZATION, ERROR);
            case WAITING_AUTHORIZATION -> EnumSet.of(AUTHORIZED, PENDING, ERROR);
            case PENDING -> EnumSet.of(WAITING_AUTHORIZATION);
            case AUTHORIZED, ERROR -> EnumSet.noneOf(BillingState.class);
        };
    }

    public boolean canTransitionTo(BillingState target) {
        return successors().contains(target);
    }

    /**
     * True while a request is on its way through the backend; the operator may not
     * dismiss the progress dialog nor trigger another issuance for the same order.
     */
    public boolean isProcessing() {
        return switch (this) {
            case VALIDATING, GENERATING, SIGNING, SENDING, WAITING_AUTHORIZATION -> true;
            case IDLE, AUTHORIZED, PENDING, ERROR -> false;
        };
    }

    public boolean isFinal() {
        return this == AUTHORIZED || this == ERROR;
    }

    public boolean isDismissible() {
        return !isProcessing();
    }
}
