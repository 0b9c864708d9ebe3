package decentralabs.settlement.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import decentralabs.settlement.util.LogSanitizer;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps the settlement error taxonomy onto HTTP.
 * Every error body is {@code {"success": false, "message": ..., "error": <code>}}.
 */
@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationExceptions(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });

        Map<String, Object> response = body("Validation failed", "INVALID_INPUT");
        response.put("errors", errors);

        log.warn("Validation error: {}", errors);
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<Map<String, Object>> handleMalformedRequest(Exception ex) {
        log.warn("Malformed request: {}", LogSanitizer.sanitize(ex.getMessage()));
        return ResponseEntity.badRequest().body(body("Malformed request", "INVALID_INPUT"));
    }

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidInput(InvalidInputException ex) {
        log.warn("Invalid input: {}", LogSanitizer.sanitize(ex.getMessage()));
        return ResponseEntity.badRequest().body(body(ex.getMessage(), "INVALID_INPUT"));
    }

    @ExceptionHandler(IntentNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(IntentNotFoundException ex) {
        log.debug("Intent not found: {}", LogSanitizer.sanitize(ex.getIntentId()));
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body(ex.getMessage(), "NOT_FOUND"));
    }

    @ExceptionHandler(InvalidIntentStateException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidState(InvalidIntentStateException ex) {
        Map<String, Object> response = body(ex.getMessage(), "INVALID_STATE");
        if (ex.getCurrentStatus() != null) {
            response.put("status", ex.getCurrentStatus().name());
        }
        log.info("Rejected transition for intent {}: {}", LogSanitizer.sanitize(ex.getIntentId()), ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
    }

    @ExceptionHandler(InvalidProofException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidProof(InvalidProofException ex) {
        return ResponseEntity.badRequest().body(body(ex.getMessage(), "INVALID_PROOF"));
    }

    @ExceptionHandler(VerifierUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleVerifierUnavailable(VerifierUnavailableException ex) {
        log.warn("Proof verifier unavailable: {}", LogSanitizer.sanitize(ex.getMessage()));
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body(ex.getMessage(), "VERIFIER_UNAVAILABLE"));
    }

    @ExceptionHandler(SettlementFailedException.class)
    public ResponseEntity<Map<String, Object>> handleSettlementFailed(SettlementFailedException ex) {
        Map<String, Object> response = body(ex.getMessage(), "SETTLEMENT_FAILED");
        response.put("reason", ex.getReason().name());
        if (ex.getTxRef() != null) {
            response.put("tx_ref", ex.getTxRef());
        }
        log.error("Target settlement failed [{}]: {}", ex.getReason(), LogSanitizer.sanitize(ex.getMessage()));
        return ResponseEntity.status(statusFor(ex.getReason())).body(response);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        // full stack trace stays in the log
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(body("An unexpected error occurred", "INTERNAL_ERROR"));
    }

    static HttpStatus statusFor(SettlementFailureReason reason) {
        return switch (reason) {
            case INSUFFICIENT_FUNDS -> HttpStatus.SERVICE_UNAVAILABLE;
            case CONFIRMATION_TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case ATTEMPT_SUPERSEDED -> HttpStatus.CONFLICT;
            default -> HttpStatus.BAD_GATEWAY;
        };
    }

    private static Map<String, Object> body(String message, String error) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("message", message);
        response.put("error", error);
        return response;
    }
}
