package com.flagship.collective_finance.processor;

import com.flagship.collective_finance.account.AccountEntity;
import com.flagship.collective_finance.common.CurrencyCode;
import com.flagship.collective_finance.error.InsufficientFundsException;
import com.flagship.collective_finance.error.InvalidStateException;
import com.flagship.collective_finance.error.ValidationException;
import com.flagship.collective_finance.ledger.LedgerService;
import com.flagship.collective_finance.paymentmethod.PaymentMethodEntity;
import com.flagship.collective_finance.paymentmethod.PaymentMethodRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Checks a payment method's stored usage limits against one charge.
 *
 * <p>Checked in order: archived, expiry, currency, allowed collectives,
 * allowed hosts, allowed tags, monthly limit, remaining balance. Amounts
 * already charged are derived from the ledger and include every card minted
 * from the method.
 */
@Component
@RequiredArgsConstructor
public class UsageConstraintEvaluator {

    private final LedgerService ledgerService;
    private final PaymentMethodRepository paymentMethodRepository;
    private final Clock clock;

    public void check(PaymentMethodEntity paymentMethod, AccountEntity destination,
                      BigDecimal amount, CurrencyCode currency) {
        LocalDate today = LocalDate.now(clock);
        UUID id = paymentMethod.getId();

        if (paymentMethod.isArchived()) {
            throw new InvalidStateException("Payment method " + id + " has been removed");
        }
        if (paymentMethod.isExpired(today)) {
            throw new InvalidStateException("Payment method " + id + " expired on " + paymentMethod.getExpiryDate());
        }
        if (paymentMethod.getCurrency() != currency) {
            throw new ValidationException(String.format("Payment method %s is in %s, charge is in %s",
                    id, paymentMethod.getCurrency(), currency));
        }
        if (paymentMethod.getLimitedToCollectiveIds() != null
                && !paymentMethod.getLimitedToCollectiveIds().contains(destination.getId())) {
            throw new ValidationException("Payment method " + id + " cannot be used for " + destination.getSlug());
        }
        if (paymentMethod.getLimitedToHostCollectiveIds() != null
                && !paymentMethod.getLimitedToHostCollectiveIds().contains(destination.getHostAccountId())) {
            throw new ValidationException("Payment method " + id + " cannot be used for collectives of this host");
        }
        if (paymentMethod.getLimitedToTags() != null && !destination.hasAnyTag(paymentMethod.getLimitedToTags())) {
            throw new ValidationException("Payment method " + id + " is limited to collectives tagged "
                    + paymentMethod.getLimitedToTags());
        }

        if (paymentMethod.getMonthlyLimitPerMember() == null && paymentMethod.getInitialBalance() == null) {
            return;
        }
        Set<UUID> consumers = withDescendants(id);

        if (paymentMethod.getMonthlyLimitPerMember() != null) {
            BigDecimal thisMonth = ledgerService.chargedThroughSince(consumers,
                    today.withDayOfMonth(1).atStartOfDay().toInstant(ZoneOffset.UTC));
            BigDecimal remaining = paymentMethod.getMonthlyLimitPerMember().subtract(thisMonth);
            if (remaining.compareTo(amount) < 0) {
                throw new InsufficientFundsException(String.format(
                        "Monthly limit of payment method %s exceeded: %s remaining, %s requested", id, remaining, amount));
            }
        }
        if (paymentMethod.getInitialBalance() != null) {
            BigDecimal remaining = paymentMethod.getInitialBalance().subtract(ledgerService.chargedThrough(consumers));
            if (remaining.compareTo(amount) < 0) {
                throw new InsufficientFundsException(String.format(
                        "Payment method %s has %s left, %s requested", id, remaining, amount));
            }
        }
    }

    private Set<UUID> withDescendants(UUID rootId) {
        Set<UUID> ids = new LinkedHashSet<>();
        Deque<UUID> pending = new ArrayDeque<>();
        pending.push(rootId);
        while (!pending.isEmpty()) {
            UUID next = pending.pop();
            if (ids.add(next)) {
                paymentMethodRepository.findIdsByParentPaymentMethodId(next).forEach(pending::push);
            }
        }
        return ids;
    }
}
