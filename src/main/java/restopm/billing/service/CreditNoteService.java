package restopm.billing.service;

import restopm.billing.client.dto.BillQuery;
import restopm.billing.client.dto.CreditNoteDTO;
import restopm.billing.client.dto.PageResponse;
import restopm.billing.dto.CreditNoteEligibility;
import restopm.billing.dto.CreditNoteRequest;
import restopm.billing.dto.StatusCheckResult;

/**
 * Service interface for credit notes cancelling authorized invoices.
 */
public interface CreditNoteService {

    /**
     * Evaluate every precondition for the bill without contacting the backend.
     *
     * @param billId Bill ID as listed in the history
     * @return Eligibility report with the reasons it fails, if any
     */
    CreditNoteEligibility eligibility(String billId);

    /**
     * Issue a credit note. Preconditions are enforced before the backend is called.
     *
     * @param request Bill, SRI reason code, optional description and tax rate
     * @return The credit note as stored by the backend, or null when it only acknowledged
     */
    CreditNoteDTO issueCreditNote(CreditNoteRequest request);

    PageResponse<CreditNoteDTO> listCreditNotes(BillQuery query);

    StatusCheckResult checkCreditNoteStatus(String accessKey);
}
