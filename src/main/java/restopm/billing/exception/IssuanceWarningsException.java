package restopm.billing.exception;

import restopm.billing.model.IssuanceWarning;

import java.util.List;

/**
 * Raised when an issuance has unacknowledged warnings. The operator resubmits with
 * confirmWarnings=true to continue, or aborts.
 */
public class IssuanceWarningsException extends RuntimeException {

    private final transient List<IssuanceWarning> warnings;

    public IssuanceWarningsException(List<IssuanceWarning> warnings) {
        super("La emisión requiere confirmación: " + warnings.size() + " advertencia(s)");
        this.warnings = List.copyOf(warnings);
    }

    public List<IssuanceWarning> getWarnings() {
        return warnings;
    }
}
