package restopm.billing.exception;

import java.util.List;

public class CreditNoteNotAllowedException extends RuntimeException {

    private final List<String> reasons;

    public CreditNoteNotAllowedException(String billId, List<String> reasons) {
        super("Credit note not allowed for bill " + billId + ": " + String.join("; ", reasons));
        this.reasons = List.copyOf(reasons);
    }

    public List<String> getReasons() {
        return reasons;
    }
}
