package restopm.billing.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import restopm.billing.dto.IssueInvoiceRequest;
import restopm.billing.dto.PrecheckRequest;
import restopm.billing.dto.PrecheckResponse;
import restopm.billing.model.IssuanceSnapshot;
import restopm.billing.service.InvoiceIssuanceService;

/**
 * REST controller for invoice issuance.
 * The issuing request blocks until the process ends; the progress dialog polls the snapshot meanwhile.
 */
@RestController
@RequestMapping(path = "/api/issuances", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Issuances", description = "Electronic invoice issuance endpoints")
public class IssuanceController {

    private final InvoiceIssuanceService issuanceService;

    @PostMapping("/precheck")
    @Operation(summary = "Pre-check an issuance", description = "Warnings the operator must confirm; nothing is sent")
    public ResponseEntity<PrecheckResponse> precheck(@Valid @RequestBody PrecheckRequest request) {
        return ResponseEntity.ok(PrecheckResponse.of(
                issuanceService.precheck(request.getOrder(), request.getClient())));
    }

    @PostMapping
    @Operation(summary = "Issue invoice", description = "Validate, generate, sign and send the invoice of a completed order")
    public ResponseEntity<IssuanceSnapshot> issue(@Valid @RequestBody IssueInvoiceRequest request) {
        log.info("Issuance requested for order {}", request.getOrder().getId());
        return ResponseEntity.ok(issuanceService.issue(request));
    }

    @GetMapping("/{orderId}")
    @Operation(summary = "Get issuance status", description = "Current state, message and result of the order's issuance")
    public ResponseEntity<IssuanceSnapshot> status(@PathVariable String orderId) {
        return ResponseEntity.ok(issuanceService.status(orderId));
    }

    @PostMapping("/{orderId}/check-status")
    @Operation(summary = "Re-check pending authorization", description = "Ask the SRI again for a PENDING issuance")
    public ResponseEntity<IssuanceSnapshot> checkStatus(@PathVariable String orderId) {
        log.info("Status re-check requested for order {}", orderId);
        return ResponseEntity.ok(issuanceService.checkStatus(orderId));
    }

    @DeleteMapping("/{orderId}")
    @Operation(summary = "Dismiss issuance", description = "Close the progress dialog of a finished issuance")
    public ResponseEntity<Void> dismiss(@PathVariable String orderId) {
        issuanceService.dismiss(orderId);
        return ResponseEntity.noContent().build();
    }
}
