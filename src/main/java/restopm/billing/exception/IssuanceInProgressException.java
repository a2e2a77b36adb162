package restopm.billing.exception;

import restopm.billing.model.BillingState;

public class IssuanceInProgressException extends RuntimeException {

    private final BillingState state;

    public IssuanceInProgressException(String orderId, BillingState state) {
        super("Order " + orderId + " already has an issuance in state " + state);
        this.state = state;
    }

    public BillingState getState() {
        return state;
    }
}
