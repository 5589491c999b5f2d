package com.flagship.collective_finance.error;

/**
 * An action that may happen at most once has already happened
 * (a refund, a card claim).
 */
public class DuplicateActionException extends MutationException {

    public DuplicateActionException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
