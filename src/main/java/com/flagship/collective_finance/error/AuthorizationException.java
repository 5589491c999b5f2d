package com.flagship.collective_finance.error;

/**
 * Raised when the acting principal may not perform the requested action.
 */
public class AuthorizationException extends MutationException {

    public AuthorizationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
