package restopm.billing.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(IssuanceValidationException.class)
    public ResponseEntity<Map<String, Object>> handleIssuanceValidation(IssuanceValidationException ex) {
        log.warn("Issuance rejected: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.BAD_REQUEST, "Invalid billing data", ex.getMessage());
    }

    @ExceptionHandler(IssuanceWarningsException.class)
    public ResponseEntity<Map<String, Object>> handleIssuanceWarnings(IssuanceWarningsException ex) {
        log.info("Issuance waiting for operator confirmation: {}", ex.getWarnings());
        Map<String, Object> body = errorBody(HttpStatus.CONFLICT, "Confirmation required", ex.getMessage());
        body.put("warnings", ex.getWarnings());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(IssuanceInProgressException.class)
    public ResponseEntity<Map<String, Object>> handleIssuanceInProgress(IssuanceInProgressException ex) {
        log.warn("Duplicate issuance blocked: {}", ex.getMessage());
        Map<String, Object> body = errorBody(HttpStatus.CONFLICT, "Issuance in progress", ex.getMessage());
        body.put("state", ex.getState());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(CreditNoteNotAllowedException.class)
    public ResponseEntity<Map<String, Object>> handleCreditNoteNotAllowed(CreditNoteNotAllowedException ex) {
        log.warn("Credit note rejected: {}", ex.getMessage());
        Map<String, Object> body = errorBody(HttpStatus.UNPROCESSABLE_ENTITY, "Credit note not allowed", ex.getMessage());
        body.put("reasons", ex.getReasons());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }

    @ExceptionHandler(ConfirmationPhraseMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleConfirmationMismatch(ConfirmationPhraseMismatchException ex) {
        log.warn("Destructive operation refused: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.BAD_REQUEST, "Confirmation phrase mismatch", ex.getMessage());
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ResourceNotFoundException ex) {
        log.warn("Not found: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.NOT_FOUND, "Resource not found", ex.getMessage());
    }

    @ExceptionHandler(BillingBackendException.class)
    public ResponseEntity<Map<String, Object>> handleBillingBackend(BillingBackendException ex) {
        if (ex.isTransportFailure()) {
            log.error("Billing backend unreachable: {}", ex.getMessage());
            return buildErrorResponse(HttpStatus.SERVICE_UNAVAILABLE, "Service unavailable", ex.getMessage());
        }
        log.error("Billing backend error ({}): {}", ex.getStatusCode(), ex.getMessage());
        // message is relayed verbatim, it may carry SRI remediation text
        return buildErrorResponse(HttpStatus.BAD_GATEWAY, "Billing backend error", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        log.error("Bad request: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.BAD_REQUEST, "Invalid request", ex.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalState(IllegalStateException ex) {
        log.error("Invalid state: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.CONFLICT, "Invalid state", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(MethodArgumentNotValidException ex) {
        log.error("Validation error: {}", ex.getMessage());
        StringBuilder errors = new StringBuilder();
        ex.getBindingResult().getFieldErrors().forEach(error ->
            errors.append(error.getField()).append(": ").append(error.getDefaultMessage()).append("; ")
        );
        return buildErrorResponse(HttpStatus.BAD_REQUEST, "Validation failed", errors.toString());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.error("Unreadable request body: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.BAD_REQUEST, "Malformed request", "Request body could not be read");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected error occurred", ex.getMessage());
    }

    private ResponseEntity<Map<String, Object>> buildErrorResponse(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(errorBody(status, error, message));
    }

    private Map<String, Object> errorBody(HttpStatus status, String error, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", error);
        body.put("message", message);
        return body;
    }
}
