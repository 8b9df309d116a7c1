package com.fintech.lightning.controller;

import com.fintech.lightning.exception.InvalidCheckingIdException;
import com.fintech.lightning.exception.NodeClientException;
import com.fintech.lightning.exception.NodeUnavailableException;
import com.fintech.lightning.exception.PaymentNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

/**
 * Centralized error handling for the wallet API. Malformed ids and "not found" map to
 * different status codes so callers can tell them apart.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidCheckingIdException.class)
    public ResponseEntity<Map<String, String>> handleInvalidCheckingId(InvalidCheckingIdException ex) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", "INVALID_CHECKING_ID", "message", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", "BAD_REQUEST", "message", getMessageOrCause(ex)));
    }

    @ExceptionHandler(PaymentNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(PaymentNotFoundException ex) {
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(Map.of("error", "PAYMENT_NOT_FOUND", "message", ex.getMessage()));
    }

    @ExceptionHandler(NodeUnavailableException.class)
    public ResponseEntity<Map<String, String>> handleNodeUnavailable(NodeUnavailableException ex) {
        log.warn("Rejected {} call: {}", ex.getOperation(), ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", "NODE_UNAVAILABLE", "message", ex.getMessage()));
    }

    @ExceptionHandler(NodeClientException.class)
    public ResponseEntity<Map<String, String>> handleNodeError(NodeClientException ex) {
        log.warn("Node call {} failed: {}", ex.getOperation(), getMessageOrCause(ex));
        return ResponseEntity
                .status(HttpStatus.BAD_GATEWAY)
                .body(Map.of(
                        "error", "NODE_ERROR",
                        "operation", ex.getOperation() != null ? ex.getOperation() : "unknown",
                        "message", getMessageOrCause(ex)));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, String>> handleResponseStatus(ResponseStatusException ex) {
        return ResponseEntity
                .status(ex.getStatusCode())
                .body(Map.of("error", ex.getStatusCode().toString(), "message", getMessageOrCause(ex)));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGeneric(Exception ex) {
        log.error("Unhandled error", ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "INTERNAL_ERROR", "message", getMessageOrCause(ex)));
    }

    private static String getMessageOrCause(Throwable ex) {
        Throwable t = ex;
        while (t != null) {
            if (t.getMessage() != null && !t.getMessage().isBlank()) {
                return t.getMessage();
            }
            t = t.getCause();
        }
        return ex.getClass().getSimpleName();
    }
}
