package com.flagship.collective_finance.expense;

import com.flagship.collective_finance.common.CurrencyCode;
import com.flagship.collective_finance.common.FeeBreakdown;
import com.flagship.collective_finance.error.InvalidStateException;
import lombok.Value;
import lombok.With;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Expense domain object.
 *
 * Immutable: every transition returns a new instance, and a transition not
 * listed in {@link ExpenseStateTransitions} throws without producing one.
 */
@Value
@With
public class Expense {
    UUID id;
    UUID accountId;
    UUID submittedByUserId;
    BigDecimal amount;
    CurrencyCode currency;
    String description;
    String attachmentUrl;
    ExpenseStatus status;
    FeeBreakdown fees;
    Instant createdAt;
    Instant updatedAt;

    public static Expense submit(UUID accountId, UUID submittedByUserId, BigDecimal amount, CurrencyCode currency,
                                 String description, String attachmentUrl) {
        Instant now = Instant.now();
        return new Expense(UUID.randomUUID(), accountId, submittedByUserId, amount, currency,
                description, attachmentUrl, ExpenseStatus.PENDING, FeeBreakdown.none(), now, now);
    }

    public Expense approve() {
        return transitionTo(ExpenseStatus.APPROVED);
    }

    public Expense reject() {
        return transitionTo(ExpenseStatus.REJECTED);
    }

    /**
     * Marks the expense paid with the fees withheld from the payout.
     */
    public Expense pay(FeeBreakdown fees) {
        return transitionTo(ExpenseStatus.PAID).withFees(fees);
    }

    public Expense transitionTo(ExpenseStatus target) {
        if (!ExpenseStateTransitions.isAllowed(status, target)) {
            throw InvalidStateException.invalidTransition(status, target, "expense " + id);
        }
        return withStatus(target).withUpdatedAt(Instant.now());
    }

    /**
     * Amount actually paid out once fees are withheld.
     */
    public BigDecimal netPayout(FeeBreakdown fees) {
        return amount.subtract(fees.total());
    }

    public boolean isEditable() {
        return status == ExpenseStatus.PENDING;
    }
}
