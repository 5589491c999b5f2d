package com.flagship.collective_finance.error;

/**
 * State machine violations and operations on entities in the wrong lifecycle
 * state. Detected inside the unit of work, so the whole mutation aborts.
 */
public class InvalidStateException extends MutationException {

    public InvalidStateException(String message) {
        super(ErrorCode.INVALID_STATE, message);
    }

    public InvalidStateException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public static InvalidStateException invalidTransition(Object from, Object to, Object id) {
        return new InvalidStateException(ErrorCode.INVALID_TRANSITION,
                String.format("Cannot move %s from %s to %s", id, from, to));
    }
}
