package restopm.billing.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import restopm.billing.client.dto.BillQuery;
import restopm.billing.client.dto.CreditNoteDTO;
import restopm.billing.client.dto.PageResponse;
import restopm.billing.dto.AccessKeyRequest;
import restopm.billing.dto.CreditNoteRequest;
import restopm.billing.dto.StatusCheckResult;
import restopm.billing.service.CreditNoteService;

@RestController
@RequestMapping(path = "/api/credit-notes", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Credit Notes", description = "Credit note endpoints")
public class CreditNoteController {

    private final CreditNoteService creditNoteService;

    @PostMapping
    @Operation(summary = "Issue credit note", description = "Cancel an authorized invoice with an SRI reason code")
    public ResponseEntity<CreditNoteDTO> issue(@Valid @RequestBody CreditNoteRequest request) {
        log.info("Credit note requested for bill {} with reason {}", request.getBillId(), request.getReasonCode());
        return ResponseEntity.status(HttpStatus.CREATED).body(creditNoteService.issueCreditNote(request));
    }

    @GetMapping
    @Operation(summary = "List credit notes", description = "Paged credit note history")
    public ResponseEntity<PageResponse<CreditNoteDTO>> list(
            @RequestParam(required = false, defaultValue = "1") Integer page,
            @RequestParam(required = false, defaultValue = "20") Integer limit,
            @RequestParam(required = false) String billId,
            @RequestParam(required = false) String reason) {
        return ResponseEntity.ok(creditNoteService.listCreditNotes(BillQuery.builder()
                .page(page)
                .limit(limit)
                .billId(billId)
                .reason(reason)
                .build()));
    }

    @PostMapping("/check-status")
    @Operation(summary = "Update credit note SRI status")
    public ResponseEntity<StatusCheckResult> checkStatus(@Valid @RequestBody AccessKeyRequest request) {
        return ResponseEntity.ok(creditNoteService.checkCreditNoteStatus(request.getAccessKey()));
    }
}
