package com.flagship.collective_finance.error;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

public class InsufficientFundsException extends MutationException {

    public InsufficientFundsException(UUID accountId, BigDecimal available, BigDecimal requested) {
        super(ErrorCode.INSUFFICIENT_FUNDS,
                String.format("Account %s has %s available, %s requested", accountId, available, requested),
                Map.of("available", available.toPlainString(), "requested", requested.toPlainString()),
                null);
    }

    public InsufficientFundsException(String message) {
        super(ErrorCode.INSUFFICIENT_FUNDS, message);
    }
}
