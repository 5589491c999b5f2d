package com.flagship.collective_finance.error;

import java.util.UUID;

public class NotFoundException extends MutationException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    public static NotFoundException of(String entity, UUID id) {
        return new NotFoundException(entity + " not found: " + id);
    }
}
