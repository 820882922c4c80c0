package com.flagship.wage_ledger.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps the error kinds of the ledger and compensation engine onto HTTP responses.
 *
 * Every error body has the same {@link ErrorResponse} shape.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler({
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
    })
    public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Malformed request: " + e.getMessage(), null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", e.getMessage(), null);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        log.info("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Not Found", e.getMessage(), null);
    }

    @ExceptionHandler(InsufficientBalanceException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientBalance(InsufficientBalanceException e) {
        log.warn("Insufficient balance: {}", e.getMessage());

        Map<String, String> details = new LinkedHashMap<>();
        details.put("worker_id", e.getWorkerId().toString());
        details.put("balance", e.getBalance().toPlainString());
        details.put("requested", e.getRequested().toPlainString());

        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Insufficient Balance", e.getMessage(), details);
    }

    @ExceptionHandler(ExceedsEntitlementException.class)
    public ResponseEntity<ErrorResponse> handleExceedsEntitlement(ExceedsEntitlementException e) {
        log.warn("Exceeds entitlement: {}", e.getMessage());

        Map<String, String> details = new LinkedHashMap<>();
        details.put("draft_id", e.getDraftId().toString());
        details.put("entitlement", e.getEntitlement().toPlainString());
        details.put("requested", e.getRequested().toPlainString());

        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Exceeds Entitlement", e.getMessage(), details);
    }

    @ExceptionHandler(SettlementFailedException.class)
    public ResponseEntity<ErrorResponse> handleSettlementFailed(SettlementFailedException e) {
        log.warn("Settlement failed: {}", e.getMessage());

        Map<String, String> details = new LinkedHashMap<>();
        details.put("worker_id", e.getWorkerId().toString());
        details.put("worker_code", e.getWorkerCode());
        details.put("reason", e.getReason());

        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Settlement Failed", e.getMessage(), details);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        log.warn("Conflict: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Conflict", e.getMessage(), null);
    }

    @ExceptionHandler({DataIntegrityViolationException.class, OptimisticLockingFailureException.class})
    public ResponseEntity<ErrorResponse> handleStorageConflict(RuntimeException e) {
        log.warn("Storage conflict: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Conflict", "The record was changed or already exists", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred", null);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                  Map<String, String> details) {
        ErrorResponse body = ErrorResponse.builder()
            .error(error)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
