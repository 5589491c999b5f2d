package com.flagship.collective_finance.error;

import java.util.Map;

/**
 * Malformed, missing or mutually exclusive arguments. Always raised before
 * anything is written.
 */
public class ValidationException extends MutationException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION, message);
    }

    public ValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public ValidationException(ErrorCode errorCode, String message, Map<String, String> details) {
        super(errorCode, message, details, null);
    }

    public static ValidationException invalidAmount(String message) {
        return new ValidationException(ErrorCode.INVALID_AMOUNT, message);
    }
}
