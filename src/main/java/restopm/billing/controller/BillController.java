package restopm.billing.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import restopm.billing.client.dto.BillDTO;
import restopm.billing.client.dto.BillQuery;
import restopm.billing.client.dto.PageResponse;
import restopm.billing.dto.CreditNoteEligibility;
import restopm.billing.dto.StatusCheckResult;
import restopm.billing.service.BillHistoryService;
import restopm.billing.service.CreditNoteService;

@RestController
@RequestMapping("/api/bills")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Bills", description = "Billing history endpoints")
public class BillController {

    private final BillHistoryService billHistoryService;
    private final CreditNoteService creditNoteService;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List bills", description = "Paged billing history; refreshes the bills known for credit notes")
    public ResponseEntity<PageResponse<BillDTO>> listBills(
            @RequestParam(required = false, defaultValue = "1") Integer page,
            @RequestParam(required = false, defaultValue = "20") Integer limit,
            @RequestParam(required = false) String documentNumber,
            @RequestParam(required = false) String customerIdentification,
            @RequestParam(required = false) String documentType) {
        BillQuery query = BillQuery.builder()
                .page(page)
                .limit(limit)
                .documentNumber(documentNumber)
                .customerIdentification(customerIdentification)
                .documentType(documentType)
                .build();
        return ResponseEntity.ok(billHistoryService.listBills(query));
    }

    @GetMapping(path = "/{billId}/credit-note-eligibility", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Credit note eligibility", description = "Which credit note preconditions the bill fails")
    public ResponseEntity<CreditNoteEligibility> creditNoteEligibility(@PathVariable String billId) {
        return ResponseEntity.ok(creditNoteService.eligibility(billId));
    }

    @PostMapping(path = "/check-status/{accessKey}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Update SRI status", description = "Re-query the SRI for a stored invoice")
    public ResponseEntity<StatusCheckResult> checkStatus(@PathVariable String accessKey) {
        log.info("SRI status check requested for {}", accessKey);
        return ResponseEntity.ok(billHistoryService.checkStatus(accessKey));
    }

    @GetMapping("/{billId}/pdf")
    @Operation(summary = "Download RIDE", description = "A4 RIDE or 80mm ticket of a stored bill")
    public ResponseEntity<byte[]> downloadPdf(@PathVariable String billId,
                                              @RequestParam(required = false, defaultValue = "a4") String format) {
        byte[] pdf = billHistoryService.downloadPdf(billId, format);
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_PDF)
                .header(HttpHeaders.CONTENT_DISPOSITION, "inline; filename=\"factura-" + billId + ".pdf\"")
                .body(pdf);
    }
}
