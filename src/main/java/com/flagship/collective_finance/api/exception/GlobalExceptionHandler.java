package com.flagship.collective_finance.api.exception;

import com.flagship.collective_finance.error.ErrorCode;
import com.flagship.collective_finance.error.MutationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps failures to {@link ApiError} responses.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MutationException.class)
    public ResponseEntity<ApiError> handleMutation(MutationException e) {
        if (e.getErrorCode().getStatus().is5xxServerError()) {
            log.error("Mutation failed: code={}, message={}", e.getErrorCode().getCode(), e.getMessage(), e);
        } else {
            log.warn("Mutation rejected: code={}, message={}", e.getErrorCode().getCode(), e.getMessage());
        }
        return respond(e.getErrorCode(), e.getMessage(), e.getDetails());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));
        return respond(ErrorCode.VALIDATION, "Request validation failed", errors);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleMalformedRequest(Exception e) {
        log.warn("Invalid request: {}", e.getMessage());
        return respond(ErrorCode.VALIDATION, e.getMessage(), Map.of());
    }

    /**
     * Optimistic lock failures, lock timeouts and unique-constraint races
     * all mean a concurrent request won. The caller may retry.
     */
    @ExceptionHandler({ConcurrencyFailureException.class, DataIntegrityViolationException.class})
    public ResponseEntity<ApiError> handleConflict(RuntimeException e) {
        log.warn("Concurrent modification detected: {}", e.getMessage());
        return respond(ErrorCode.CONFLICT, "The resource was modified concurrently, retry the request", Map.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        ApiError error = ApiError.builder()
            .error("internal-error")
            .category("INTERNAL")
            .message("An unexpected error occurred")
            .retryable(false)
            .details(Map.of())
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.internalServerError().body(error);
    }

    private static ResponseEntity<ApiError> respond(ErrorCode code, String message, Map<String, String> details) {
        ApiError error = ApiError.builder()
            .error(code.getCode())
            .category(code.getCategory().name())
            .message(message)
            .retryable(code.isRetryable())
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(code.getStatus()).body(error);
    }
}
