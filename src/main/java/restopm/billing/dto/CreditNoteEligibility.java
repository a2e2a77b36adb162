package restopm.billing.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Outcome of the credit note preconditions for one bill.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreditNoteEligibility {
    private String billId;
    private String documentNumber;
    private boolean eligible;
    private List<String> reasons;
    private LocalDateTime deadline;   // null when the bill date could not be read
}
