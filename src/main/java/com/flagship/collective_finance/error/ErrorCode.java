package com.flagship.collective_finance.error;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Every error a mutation can report, with its wire code, HTTP status and
 * whether the caller may retry the same request unchanged.
 */
@Getter
public enum ErrorCode {
    VALIDATION("validation", ErrorCategory.VALIDATION, HttpStatus.BAD_REQUEST, false),
    ARGUMENT_MISMATCH("argument-mismatch", ErrorCategory.VALIDATION, HttpStatus.BAD_REQUEST, false),
    ARGUMENT_CONFLICT("argument-conflict", ErrorCategory.VALIDATION, HttpStatus.BAD_REQUEST, false),
    INVALID_AMOUNT("invalid-amount", ErrorCategory.VALIDATION, HttpStatus.BAD_REQUEST, false),
    INVALID_CODE("invalid-code", ErrorCategory.VALIDATION, HttpStatus.BAD_REQUEST, false),

    UNAUTHENTICATED("unauthenticated", ErrorCategory.AUTHORIZATION, HttpStatus.UNAUTHORIZED, false),
    FORBIDDEN("forbidden", ErrorCategory.AUTHORIZATION, HttpStatus.FORBIDDEN, false),
    NOT_OWNER("not-owner", ErrorCategory.AUTHORIZATION, HttpStatus.FORBIDDEN, false),

    NOT_FOUND("not-found", ErrorCategory.NOT_FOUND, HttpStatus.NOT_FOUND, false),

    INVALID_STATE("invalid-state", ErrorCategory.STATE, HttpStatus.CONFLICT, false),
    INVALID_TRANSITION("invalid-transition", ErrorCategory.STATE, HttpStatus.CONFLICT, false),
    IN_USE("in-use", ErrorCategory.STATE, HttpStatus.CONFLICT, false),

    CONFLICT("conflict", ErrorCategory.CONFLICT, HttpStatus.CONFLICT, true),

    ALREADY_REFUNDED("already-refunded", ErrorCategory.DUPLICATE_ACTION, HttpStatus.CONFLICT, false),
    ALREADY_CLAIMED("already-claimed", ErrorCategory.DUPLICATE_ACTION, HttpStatus.CONFLICT, false),

    HOST_NOT_FOUND("host-not-found", ErrorCategory.EXTERNAL_DEPENDENCY, HttpStatus.FAILED_DEPENDENCY, false),
    EXTERNAL_DEPENDENCY("external-dependency", ErrorCategory.EXTERNAL_DEPENDENCY, HttpStatus.BAD_GATEWAY, false),

    INSUFFICIENT_FUNDS("insufficient-funds", ErrorCategory.INSUFFICIENT_FUNDS, HttpStatus.UNPROCESSABLE_ENTITY, false);

    private final String code;
    private final ErrorCategory category;
    private final HttpStatus status;
    private final boolean retryable;

    ErrorCode(String code, ErrorCategory category, HttpStatus status, boolean retryable) {
        this.code = code;
        this.category = category;
        this.status = status;
        this.retryable = retryable;
    }
}
