package com.flagship.collective_finance.ledger;

import com.flagship.collective_finance.common.CurrencyCode;
import com.flagship.collective_finance.common.FeeBreakdown;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.UUID;

/**
 * One ledger entry to be recorded.
 *
 * Sign convention: positive amounts add to {@code accountId}'s balance,
 * negative amounts take from it. A contribution paid from platform funds is
 * two CONTRIBUTION legs in one group: the credit on the receiving account,
 * which carries the payment method, and the debit on the paying account.
 */
@Value
@Builder
public class TransactionRequest {
    TransactionType type;
    UUID accountId;
    UUID counterpartyAccountId;
    BigDecimal amount;
    CurrencyCode currency;
    @Builder.Default
    FeeBreakdown fees = FeeBreakdown.none();
    UUID orderId;
    UUID expenseId;
    UUID paymentMethodId;
    UUID refundOfTransactionId;
    UUID transactionGroup;
    String processorChargeId;
    String description;
    UUID createdByUserId;

    /**
     * Checks the sign and linkage rules of each transaction type.
     *
     * @throws IllegalArgumentException when the request is malformed
     */
    public void validate() {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(accountId, "accountId");
        Objects.requireNonNull(currency, "currency");
        Objects.requireNonNull(amount, "amount");
        if (amount.signum() == 0) {
            throw new IllegalArgumentException("Transaction amount must not be zero");
        }
        switch (type) {
            case CONTRIBUTION -> {
                // a debit is only legal as the paying leg of a contribution spent from platform funds
                if (amount.signum() < 0 && (transactionGroup == null || paymentMethodId != null)) {
                    throw new IllegalArgumentException(
                            "A contribution debit must share its credit's group and carry no payment method");
                }
            }
            case EXPENSE_PAYMENT -> {
                if (amount.signum() > 0) {
                    throw new IllegalArgumentException("Expense payments must debit the paying account");
                }
            }
            case REFUND -> {
                if (refundOfTransactionId == null) {
                    throw new IllegalArgumentException("A refund must reference the refunded transaction");
                }
            }
            case FUND_TRANSFER -> {
                if (transactionGroup == null) {
                    throw new IllegalArgumentException("Fund transfer legs must share a transaction group");
                }
            }
        }
        if (type != TransactionType.REFUND && refundOfTransactionId != null) {
            throw new IllegalArgumentException("Only refunds may reference another transaction");
        }
    }
}
