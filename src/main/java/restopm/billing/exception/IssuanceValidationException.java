package restopm.billing.exception;

/**
 * Input rejected before anything is sent to the backend.
 */
public class IssuanceValidationException extends RuntimeException {
    public IssuanceValidationException(String message) {
        super(message);
    }
}
