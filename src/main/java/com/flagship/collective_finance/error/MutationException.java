package com.flagship.collective_finance.error;

import lombok.Getter;

import java.util.Collections;
import java.util.Map;

/**
 * Base type for every failure a financial mutation reports to its caller.
 *
 * Subclasses fix the category; the {@link ErrorCode} narrows it down to the
 * exact reason. All are unchecked so that a throw anywhere inside a
 * {@code @Transactional} method rolls the whole unit of work back.
 */
@Getter
public abstract class MutationException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, String> details;

    protected MutationException(ErrorCode errorCode, String message) {
        this(errorCode, message, Collections.emptyMap(), null);
    }

    protected MutationException(ErrorCode errorCode, String message, Map<String, String> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details == null ? Collections.emptyMap() : Map.copyOf(details);
    }

    public boolean isRetryable() {
        return errorCode.isRetryable();
    }
}
