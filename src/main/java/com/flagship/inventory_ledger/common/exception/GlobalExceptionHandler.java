package com.flagship.inventory_ledger.common.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps inventory failures to HTTP responses with an {@link ApiError} body.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiError> handleValidation(ValidationException e) {
        log.warn("Validation failed: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e, null);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(NotFoundException e) {
        log.warn("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, e, null);
    }

    @ExceptionHandler(InsufficientStockException.class)
    public ResponseEntity<ApiError> handleInsufficientStock(InsufficientStockException e) {
        log.warn("Insufficient stock: productId={}, available={}, requested={}",
                e.getProductId(), e.getAvailable(), e.getRequested());

        Map<String, String> details = new LinkedHashMap<>();
        details.put("productId", String.valueOf(e.getProductId()));
        details.put("available", String.valueOf(e.getAvailable()));
        details.put("requested", String.valueOf(e.getRequested()));

        return respond(HttpStatus.CONFLICT, e, details);
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ApiError> handleConflict(ConflictException e) {
        log.warn("Conflict: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, e, null);
    }

    @ExceptionHandler(TransactionAbortedException.class)
    public ResponseEntity<ApiError> handleAborted(TransactionAbortedException e) {
        log.warn("Transaction aborted: {} (cause: {})", e.getMessage(),
                e.getCause() != null ? e.getCause().getClass().getSimpleName() : "none");
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e, Map.of("retryable", "true"));
    }

    @ExceptionHandler(ForbiddenOperationException.class)
    public ResponseEntity<ApiError> handleForbidden(ForbiddenOperationException e) {
        log.warn("Forbidden: {}", e.getMessage());
        return respond(HttpStatus.FORBIDDEN, e, null);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiError.builder()
            .error("Missing Required Header")
            .message("Required header '" + e.getHeaderName() + "' is missing")
            .timestamp(Instant.now())
            .build());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleInvalidBody(MethodArgumentNotValidException e) {
        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing,
                LinkedHashMap::new
            ));
        log.warn("Request validation failed: {}", errors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiError.builder()
            .error("Validation Failed")
            .message("Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleUnreadable(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiError.builder()
            .error("Invalid Request")
            .message("Malformed request parameter or body")
            .timestamp(Instant.now())
            .build());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception e) {
        log.error("Unexpected error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiError.builder()
            .error("Internal Server Error")
            .message("An unexpected error occurred")
            .timestamp(Instant.now())
            .build());
    }

    private ResponseEntity<ApiError> respond(HttpStatus status, InventoryException e, Map<String, String> details) {
        return ResponseEntity.status(status).body(ApiError.builder()
            .error(e.getErrorCode())
            .message(e.getMessage())
            .details(details)
            .timestamp(Instant.now())
            .build());
    }
}
