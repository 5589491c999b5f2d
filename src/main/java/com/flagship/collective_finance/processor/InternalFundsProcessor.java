package com.flagship.collective_finance.processor;

import com.flagship.collective_finance.common.CurrencyCode;
import com.flagship.collective_finance.paymentmethod.PaymentMethodEntity;
import com.flagship.collective_finance.paymentmethod.PaymentProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Spends funds already on the platform, such as host allocations.
 *
 * Charging and refunding touch nothing outside the ledger; the debit and
 * credit legs recorded by the caller are the whole movement.
 */
@Component
@Slf4j
public class InternalFundsProcessor implements PaymentProcessor {

    @Override
    public boolean supports(PaymentMethodEntity paymentMethod) {
        return paymentMethod.getProvider() == PaymentProvider.INTERNAL;
    }

    @Override
    public boolean drawsOnAccountBalance() {
        return true;
    }

    @Override
    public String charge(PaymentMethodEntity paymentMethod, ChargeRequest request) {
        log.debug("Internal charge of {} {} on payment method {}",
                request.getAmount(), request.getCurrency(), paymentMethod.getId());
        return null;
    }

    @Override
    public void refund(String processorChargeId, BigDecimal amount, CurrencyCode currency) {
        log.debug("Internal refund of {} {}: ledger reversal only", amount, currency);
    }
}
