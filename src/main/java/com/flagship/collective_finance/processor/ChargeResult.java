package com.flagship.collective_finance.processor;

import lombok.Value;

import java.util.UUID;

/**
 * Outcome of a successful charge.
 */
@Value
public class ChargeResult {
    /** Payment method the charge was requested on. */
    UUID paymentMethodId;
    /** Id assigned by the external processor; null for internal funds. */
    String processorChargeId;
    /**
     * The charge spent platform balance, which the caller must debit from
     * {@link #fundingAccountId} in the same unit of work.
     */
    boolean drawnFromAccountBalance;
    /** Owner of the method at the root of the chain. */
    UUID fundingAccountId;
}
