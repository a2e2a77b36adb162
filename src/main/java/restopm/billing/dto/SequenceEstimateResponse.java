package restopm.billing.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Next document numbers as derived from the cached configuration. The backend
 * assigns the real ones, so these are always estimates.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SequenceEstimateResponse {
    private String nextInvoiceNumber;
    private String nextCreditNoteNumber;
    @Builder.Default
    private boolean estimate = true;
    private boolean fromBackend;
    private Instant refreshedAt;
}
