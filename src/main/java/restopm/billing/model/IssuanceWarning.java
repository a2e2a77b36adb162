package restopm.billing.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Non-blocking finding the operator must acknowledge before an invoice is sent.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IssuanceWarning {

    private Code code;
    private String message;

    public enum Code {
        FINAL_CONSUMER_LIMIT,
        NO_EMAIL_DELIVERY,
        IDENTIFICATION_CHECK_DIGIT
    }
}
