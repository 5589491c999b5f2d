package com.flagship.collective_finance.error;

/**
 * Coarse grouping of error codes, exposed to callers so they can tell
 * retryable failures apart from terminal ones without knowing every code.
 */
public enum ErrorCategory {
    VALIDATION,
    AUTHORIZATION,
    NOT_FOUND,
    STATE,
    CONFLICT,
    DUPLICATE_ACTION,
    EXTERNAL_DEPENDENCY,
    INSUFFICIENT_FUNDS
}
