package com.flagship.collective_finance.processor;

import com.flagship.collective_finance.common.CurrencyCode;
import com.flagship.collective_finance.paymentmethod.PaymentMethodEntity;

import java.math.BigDecimal;

/**
 * Moves money for the root of a payment-method chain.
 *
 * <p>A processor either charges an outside party, returning the charge id it
 * was given, or spends money the paying account already holds on the
 * platform. In the second case nothing leaves or enters the platform, so the
 * caller has to debit the funding account's ledger balance itself.
 */
public interface PaymentProcessor {

    boolean supports(PaymentMethodEntity paymentMethod);

    /**
     * True when charges spend the funding account's platform balance instead
     * of an external instrument.
     */
    boolean drawsOnAccountBalance();

    /**
     * @return the processor's charge id; null exactly when
     *         {@link #drawsOnAccountBalance()} is true
     * @throws com.flagship.collective_finance.error.ExternalDependencyException
     *         when the processor rejects the charge
     */
    String charge(PaymentMethodEntity paymentMethod, ChargeRequest request);

    /**
     * Reverses what {@link #charge} did outside the ledger.
     *
     * @param processorChargeId id returned by {@link #charge}, null for
     *        processors that draw on the account balance
     */
    void refund(String processorChargeId, BigDecimal amount, CurrencyCode currency);
}
