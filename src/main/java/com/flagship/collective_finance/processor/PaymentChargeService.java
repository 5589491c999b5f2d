package com.flagship.collective_finance.processor;

import com.flagship.collective_finance.account.AccountEntity;
import com.flagship.collective_finance.common.CurrencyCode;
import com.flagship.collective_finance.error.InvalidStateException;
import com.flagship.collective_finance.error.NotFoundException;
import com.flagship.collective_finance.ledger.LedgerTransactionEntity;
import com.flagship.collective_finance.paymentmethod.PaymentMethodEntity;
import com.flagship.collective_finance.paymentmethod.PaymentMethodRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Charges a payment method, walking up to the method that actually funds it.
 *
 * <p>Every method on the chain from the requested one to its root is
 * row-locked and has its usage limits checked; the root's
 * {@link PaymentProcessor} performs the charge. Locking the chain makes
 * concurrent charges against one budget serialize, so two cards minted from
 * the same allocation cannot both spend its last funds.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentChargeService {

    private final PaymentMethodRepository paymentMethodRepository;
    private final UsageConstraintEvaluator constraintEvaluator;
    private final List<PaymentProcessor> processors;

    @Transactional(propagation = Propagation.MANDATORY)
    public ChargeResult charge(UUID paymentMethodId, AccountEntity destination, BigDecimal amount,
                               CurrencyCode currency, UUID orderId, String description) {
        PaymentMethodEntity current = lock(paymentMethodId);
        Set<UUID> visited = new HashSet<>();
        while (true) {
            if (!visited.add(current.getId())) {
                throw new InvalidStateException("Payment method chain of " + paymentMethodId + " contains a cycle");
            }
            constraintEvaluator.check(current, destination, amount, currency);
            if (current.getParentPaymentMethodId() == null) {
                break;
            }
            current = lock(current.getParentPaymentMethodId());
        }

        PaymentProcessor processor = processorFor(current);
        String chargeId = processor.charge(current, ChargeRequest.builder()
                .amount(amount)
                .currency(currency)
                .destinationAccountId(destination.getId())
                .orderId(orderId)
                .description(description)
                .build());

        log.debug("Charged {} {} on payment method {} (funded by {}), processorChargeId={}",
                amount, currency, paymentMethodId, current.getId(), chargeId);
        return new ChargeResult(paymentMethodId, chargeId, processor.drawsOnAccountBalance(), current.getAccountId());
    }

    /**
     * Hands a refunded transaction to the processor of the method that funded
     * it. Transactions recorded without a payment method, such as offline
     * payments, have nothing to reverse outside the ledger.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void refundCharge(LedgerTransactionEntity original) {
        if (original.getPaymentMethodId() == null) {
            return;
        }
        PaymentMethodEntity root = paymentMethodRepository.findById(original.getPaymentMethodId())
                .orElseThrow(() -> NotFoundException.of("Payment method", original.getPaymentMethodId()));
        while (root.getParentPaymentMethodId() != null) {
            UUID parentId = root.getParentPaymentMethodId();
            root = paymentMethodRepository.findById(parentId)
                    .orElseThrow(() -> NotFoundException.of("Payment method", parentId));
        }
        processorFor(root).refund(original.getProcessorChargeId(), original.getAmount().abs(), original.getCurrency());
    }

    private PaymentMethodEntity lock(UUID paymentMethodId) {
        return paymentMethodRepository.findByIdForUpdate(paymentMethodId)
                .orElseThrow(() -> NotFoundException.of("Payment method", paymentMethodId));
    }

    private PaymentProcessor processorFor(PaymentMethodEntity paymentMethod) {
        return processors.stream()
                .filter(p -> p.supports(paymentMethod))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException(
                        "No payment processor for provider " + paymentMethod.getProvider()));
    }
}
