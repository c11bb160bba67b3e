package com.z254.watchtower.vigil.api.error;

import com.z254.watchtower.vigil.domain.exception.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

import java.util.List;

/**
 * Maps each error kind to its own status and stable error code.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    @ExceptionHandler(IncidentNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(IncidentNotFoundException ex, ServerWebExchange exchange) {
        log.warn("Incident not found: {}", ex.getMessage());
        return build(HttpStatus.NOT_FOUND, ex.getErrorCode(), ex.getMessage(), exchange, null);
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidTransition(InvalidTransitionException ex,
                                                                 ServerWebExchange exchange) {
        log.warn("Invalid transition: {}", ex.getMessage());
        return build(HttpStatus.CONFLICT, ex.getErrorCode(), ex.getMessage(), exchange, null);
    }

    @ExceptionHandler(ForbiddenOperationException.class)
    public ResponseEntity<ErrorResponse> handleForbidden(ForbiddenOperationException ex, ServerWebExchange exchange) {
        log.warn("Forbidden operation: {}", ex.getMessage());
        return build(HttpStatus.FORBIDDEN, ex.getErrorCode(), ex.getMessage(), exchange, null);
    }

    @ExceptionHandler(WebhookAuthenticationException.class)
    public ResponseEntity<ErrorResponse> handleWebhookAuth(WebhookAuthenticationException ex,
                                                           ServerWebExchange exchange) {
        log.warn("Webhook rejected: {}", ex.getMessage());
        return build(HttpStatus.UNAUTHORIZED, ex.getErrorCode(), ex.getMessage(), exchange, null);
    }

    @ExceptionHandler(RequestValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(RequestValidationException ex, ServerWebExchange exchange) {
        log.debug("Validation error: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage(), exchange, null);
    }

    @ExceptionHandler({ConcurrentIncidentUpdateException.class, AuditIntegrityException.class})
    public ResponseEntity<ErrorResponse> handleConflict(IncidentManagementException ex, ServerWebExchange exchange) {
        log.warn("Conflict: {}", ex.getMessage());
        return build(HttpStatus.CONFLICT, ex.getErrorCode(), ex.getMessage(), exchange, null);
    }

    /**
     * Version clashes detected at commit time rather than inside the state machine.
     */
    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLock(OptimisticLockingFailureException ex,
                                                              ServerWebExchange exchange) {
        log.warn("Optimistic lock failure: {}", ex.getMessage());
        return build(HttpStatus.CONFLICT, ConcurrentIncidentUpdateException.CODE,
                "Incident was modified concurrently, retry with fresh state", exchange, null);
    }

    /**
     * Unique keys hit by two writers at once, e.g. the same alert delivered twice in parallel.
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleIntegrityViolation(DataIntegrityViolationException ex,
                                                                  ServerWebExchange exchange) {
        log.warn("Integrity violation: {}", ex.getMostSpecificCause().getMessage());
        return build(HttpStatus.CONFLICT, ConcurrentIncidentUpdateException.CODE,
                "Conflicting concurrent write, retry the request", exchange, null);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleBindFailure(WebExchangeBindException ex, ServerWebExchange exchange) {
        List<ErrorResponse.FieldError> fieldErrors = ex.getFieldErrors().stream()
                .map(fe -> ErrorResponse.FieldError.builder()
                        .field(fe.getField())
                        .message(fe.getDefaultMessage())
                        .build())
                .toList();
        return build(HttpStatus.BAD_REQUEST, RequestValidationException.CODE, "Request validation failed",
                exchange, fieldErrors);
    }

    /**
     * Missing headers, malformed bodies and unconvertible parameters.
     */
    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleBadInput(ServerWebInputException ex, ServerWebExchange exchange) {
        String reason = ex.getReason() != null ? ex.getReason() : "Malformed request";
        return build(HttpStatus.BAD_REQUEST, RequestValidationException.CODE, reason, exchange, null);
    }

    /**
     * Framework rejections such as unknown routes or unsupported methods keep their status.
     */
    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleStatus(ResponseStatusException ex, ServerWebExchange exchange) {
        HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
        if (status == null) {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        String reason = ex.getReason() != null ? ex.getReason() : status.getReasonPhrase();
        return build(status, status.name(), reason, exchange, null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, ServerWebExchange exchange) {
        log.error("Unhandled error on {}", exchange.getRequest().getPath().value(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR, "Internal server error", exchange, null);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String errorCode, String message,
                                                ServerWebExchange exchange,
                                                List<ErrorResponse.FieldError> fieldErrors) {
        ErrorResponse error = ErrorResponse.builder()
                .errorCode(errorCode)
                .message(message)
                .status(status.value())
                .path(exchange.getRequest().getPath().value())
                .fieldErrors(fieldErrors)
                .build();
        return ResponseEntity.status(status).body(error);
    }
}
