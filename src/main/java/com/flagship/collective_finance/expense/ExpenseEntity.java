package com.flagship.collective_finance.expense;

import com.flagship.collective_finance.common.CurrencyCode;
import com.flagship.collective_finance.common.FeeBreakdown;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Persistence form of {@link Expense}.
 *
 * <p>Only status, editable fields and fees are ever written back through
 * {@link #updateFromDomain}. {@code ledgerTransactionId} can be set exactly
 * once, when the expense is paid; a second payment attempt fails here even
 * if it slipped past every other check.
 */
@Entity
@Table(name = "expenses", indexes = @Index(name = "idx_expenses_account", columnList = "account_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ExpenseEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Column(name = "submitted_by_user_id", nullable = false, updatable = false)
    private UUID submittedByUserId;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3, updatable = false)
    private CurrencyCode currency;

    @Column(nullable = false, length = 1000)
    private String description;

    @Column(name = "attachment_url", length = 2000)
    private String attachmentUrl;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ExpenseStatus status;

    @Column(name = "processor_fee", nullable = false, precision = 19, scale = 2)
    private BigDecimal processorFee;

    @Column(name = "host_fee", nullable = false, precision = 19, scale = 2)
    private BigDecimal hostFee;

    @Column(name = "platform_fee", nullable = false, precision = 19, scale = 2)
    private BigDecimal platformFee;

    @Column(name = "ledger_transaction_id", unique = true)
    private UUID ledgerTransactionId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(nullable = false)
    private Long version;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static ExpenseEntity fromDomain(Expense expense) {
        FeeBreakdown fees = expense.getFees();
        return new ExpenseEntity(
            expense.getId(),
            expense.getAccountId(),
            expense.getSubmittedByUserId(),
            expense.getAmount(),
            expense.getCurrency(),
            expense.getDescription(),
            expense.getAttachmentUrl(),
            expense.getStatus(),
            fees.getProcessorFee(),
            fees.getHostFee(),
            fees.getPlatformFee(),
            null, // ledgerTransactionId, set on payment
            null, // createdAt, set by @PrePersist
            null, // updatedAt, set by @PrePersist
            null  // version, assigned on insert
        );
    }

    public Expense toDomain() {
        return new Expense(id, accountId, submittedByUserId, amount, currency, description, attachmentUrl,
                status, FeeBreakdown.of(processorFee, hostFee, platformFee), createdAt, updatedAt);
    }

    void updateFromDomain(Expense expense) {
        this.amount = expense.getAmount();
        this.description = expense.getDescription();
        this.attachmentUrl = expense.getAttachmentUrl();
        this.status = expense.getStatus();
        this.processorFee = expense.getFees().getProcessorFee();
        this.hostFee = expense.getFees().getHostFee();
        this.platformFee = expense.getFees().getPlatformFee();
    }

    void setLedgerTransactionId(UUID ledgerTransactionId) {
        if (this.ledgerTransactionId != null) {
            throw new IllegalStateException("Expense " + id + " already paid by transaction " + this.ledgerTransactionId);
        }
        if (this.status != ExpenseStatus.PAID) {
            throw new IllegalStateException("Expense " + id + " is " + status + ", must be PAID to link a transaction");
        }
        this.ledgerTransactionId = ledgerTransactionId;
    }
}
