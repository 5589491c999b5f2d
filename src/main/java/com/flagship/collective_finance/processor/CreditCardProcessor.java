package com.flagship.collective_finance.processor;

import com.flagship.collective_finance.common.CurrencyCode;
import com.flagship.collective_finance.error.ErrorCode;
import com.flagship.collective_finance.error.ExternalDependencyException;
import com.flagship.collective_finance.paymentmethod.PaymentMethodEntity;
import com.flagship.collective_finance.paymentmethod.PaymentProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

@Component
@RequiredArgsConstructor
@Slf4j
public class CreditCardProcessor implements PaymentProcessor {

    private final ExternalProcessorClient client;

    @Override
    public boolean supports(PaymentMethodEntity paymentMethod) {
        return paymentMethod.getProvider() == PaymentProvider.EXTERNAL_PROCESSOR;
    }

    @Override
    public boolean drawsOnAccountBalance() {
        return false;
    }

    @Override
    public String charge(PaymentMethodEntity paymentMethod, ChargeRequest request) {
        if (paymentMethod.getProcessorCustomerId() == null) {
            throw new ExternalDependencyException(ErrorCode.EXTERNAL_DEPENDENCY,
                    "Payment method " + paymentMethod.getId() + " is not registered with the processor");
        }
        try {
            return client.charge(paymentMethod.getProcessorCustomerId(), request.getAmount(),
                    request.getCurrency(), request.getDescription());
        } catch (ProcessorRejectedException e) {
            log.warn("Processor declined charge on payment method {}: {}", paymentMethod.getId(), e.getMessage());
            throw new ExternalDependencyException("Payment processor declined the charge: " + e.getMessage(), e);
        }
    }

    @Override
    public void refund(String processorChargeId, BigDecimal amount, CurrencyCode currency) {
        if (processorChargeId == null) {
            throw new IllegalStateException("A card charge without a processor charge id cannot be refunded");
        }
        try {
            client.refund(processorChargeId, amount, currency);
        } catch (ProcessorRejectedException e) {
            throw new ExternalDependencyException("Payment processor refused the refund: " + e.getMessage(), e);
        }
    }
}
