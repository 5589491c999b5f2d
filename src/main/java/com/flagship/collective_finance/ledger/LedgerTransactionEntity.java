package com.flagship.collective_finance.ledger;

import com.flagship.collective_finance.common.CurrencyCode;
import com.flagship.collective_finance.common.FeeBreakdown;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * An entry in the append-only ledger.
 *
 * <p>Rows are never updated: Hibernate treats the entity as {@link Immutable}
 * and every column is {@code updatable = false}. A reversal is a new row
 * pointing at the original through {@code refundOfTransactionId}, which is
 * unique so the database itself rejects a second refund.
 */
@Entity
@Immutable
@Table(
    name = "ledger_transactions",
    indexes = {
        @Index(name = "idx_ledger_transactions_account", columnList = "account_id"),
        @Index(name = "idx_ledger_transactions_payment_method", columnList = "payment_method_id"),
        @Index(name = "idx_ledger_transactions_group", columnList = "transaction_group")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LedgerTransactionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30, updatable = false)
    private TransactionType type;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Column(name = "counterparty_account_id", updatable = false)
    private UUID counterpartyAccountId;

    @Column(nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3, updatable = false)
    private CurrencyCode currency;

    @Column(name = "processor_fee", nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal processorFee;

    @Column(name = "host_fee", nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal hostFee;

    @Column(name = "platform_fee", nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal platformFee;

    @Column(name = "order_id", updatable = false)
    private UUID orderId;

    @Column(name = "expense_id", updatable = false)
    private UUID expenseId;

    @Column(name = "payment_method_id", updatable = false)
    private UUID paymentMethodId;

    @Column(name = "refund_of_transaction_id", unique = true, updatable = false)
    private UUID refundOfTransactionId;

    @Column(name = "transaction_group", nullable = false, updatable = false)
    private UUID transactionGroup;

    @Column(name = "processor_charge_id", updatable = false)
    private String processorChargeId;

    @Column(updatable = false)
    private String description;

    @Column(name = "created_by_user_id", updatable = false)
    private UUID createdByUserId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static LedgerTransactionEntity fromRequest(TransactionRequest request) {
        UUID id = UUID.randomUUID();
        FeeBreakdown fees = request.getFees() == null ? FeeBreakdown.none() : request.getFees();
        return new LedgerTransactionEntity(
            id,
            request.getType(),
            request.getAccountId(),
            request.getCounterpartyAccountId(),
            request.getAmount(),
            request.getCurrency(),
            fees.getProcessorFee(),
            fees.getHostFee(),
            fees.getPlatformFee(),
            request.getOrderId(),
            request.getExpenseId(),
            request.getPaymentMethodId(),
            request.getRefundOfTransactionId(),
            request.getTransactionGroup() != null ? request.getTransactionGroup() : id,
            request.getProcessorChargeId(),
            request.getDescription(),
            request.getCreatedByUserId(),
            null // set by @PrePersist
        );
    }

    public FeeBreakdown getFees() {
        return FeeBreakdown.of(processorFee, hostFee, platformFee);
    }

    public boolean isRefund() {
        return type == TransactionType.REFUND;
    }
}
