package com.transferengine.api.controller;

import com.transferengine.common.exception.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for REST APIs.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(AccountNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleAccountNotFound(AccountNotFoundException e) {
        return buildErrorResponse(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler({AccountClosedException.class, ConcurrencyConflictException.class})
    public ResponseEntity<Map<String, String>> handleConflict(TransferEngineException e) {
        return buildErrorResponse(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler({InsufficientFundsException.class, InvalidTransferException.class})
    public ResponseEntity<Map<String, String>> handleRejected(TransferEngineException e) {
        return buildErrorResponse(HttpStatus.UNPROCESSABLE_ENTITY, e);
    }

    @ExceptionHandler({RateUnavailableException.class, AccountStoreException.class})
    public ResponseEntity<Map<String, String>> handleUnavailable(TransferEngineException e) {
        return buildErrorResponse(HttpStatus.SERVICE_UNAVAILABLE, e);
    }

    @ExceptionHandler(AuditWriteFailureException.class)
    public ResponseEntity<Map<String, String>> handleAuditFailure(AuditWriteFailureException e) {
        log.error("Audit write failure", e);
        return buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidationErrors(MethodArgumentNotValidException e) {
        Map<String, String> errors = new HashMap<>();
        e.getBindingResult().getFieldErrors().forEach(error ->
            errors.put(error.getField(), error.getDefaultMessage())
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errors);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Map<String, String>> handleMissingHeader(MissingRequestHeaderException e) {
        return buildErrorResponse(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleIllegalArgument(IllegalArgumentException e) {
        return buildErrorResponse(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR,
            "An unexpected error occurred: " + e.getMessage());
    }

    private ResponseEntity<Map<String, String>> buildErrorResponse(HttpStatus status, TransferEngineException e) {
        ResponseEntity<Map<String, String>> response = buildErrorResponse(status, e.getMessage());
        Map<String, String> body = response.getBody();
        body.put("type", e.getClass().getSimpleName());
        body.put("retryable", String.valueOf(e.isRetryable()));
        if (e.getAccountId() != null) {
            body.put("accountId", e.getAccountId());
        }
        if (e.getAmount() != null) {
            body.put("amount", e.getAmount().toPlainString());
        }
        if (e.getStage() != null) {
            body.put("stage", e.getStage().name());
        }
        return response;
    }

    private ResponseEntity<Map<String, String>> buildErrorResponse(HttpStatus status, String message) {
        Map<String, String> error = new HashMap<>();
        error.put("error", message);
        error.put("status", String.valueOf(status.value()));
        return ResponseEntity.status(status).body(error);
    }
}
