package restopm.billing.exception;

/**
 * A destructive operation was requested without typing its exact confirmation phrase.
 */
public class ConfirmationPhraseMismatchException extends RuntimeException {
    public ConfirmationPhraseMismatchException(String operation) {
        super("Confirmation phrase does not match for " + operation);
    }
}
