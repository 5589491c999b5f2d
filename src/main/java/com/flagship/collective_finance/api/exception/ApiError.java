package com.flagship.collective_finance.api.exception;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Error body returned by every endpoint. {@code error} is the stable
 * machine-readable code, {@code retryable} tells clients whether repeating
 * the same request may succeed.
 */
@Value
@Builder
public class ApiError {
    String error;
    String category;
    String message;
    boolean retryable;
    Map<String, String> details;
    Instant timestamp;
}
