package com.flagship.collective_finance.error;

/**
 * A collaborator outside this service failed or is missing: the payment
 * processor rejected a call, or a configured account does not exist.
 */
public class ExternalDependencyException extends MutationException {

    public ExternalDependencyException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public ExternalDependencyException(String message, Throwable cause) {
        super(ErrorCode.EXTERNAL_DEPENDENCY, message, null, cause);
    }
}
