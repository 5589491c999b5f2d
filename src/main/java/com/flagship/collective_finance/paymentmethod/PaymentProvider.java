package com.flagship.collective_finance.paymentmethod;

/**
 * Who moves the money when a payment method is charged.
 */
public enum PaymentProvider {
    /** A third-party card processor. */
    EXTERNAL_PROCESSOR,
    /** Funds already held on the platform: allocations and virtual cards. */
    INTERNAL
}
