package com.flagship.collective_finance.paymentmethod;

import com.flagship.collective_finance.common.CurrencyCode;
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
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A payment instrument owned by an account.
 *
 * <p>Usage limits ({@code limitedTo*}, {@code monthlyLimitPerMember},
 * {@code expiryDate}) are stored exactly as requested and only evaluated
 * when the method is charged. A virtual card points at the
 * {@code parentPaymentMethodId} it was minted from and consumes that
 * parent's budget.
 *
 * No setters: state changes go through the intent-named mutators below,
 * and {@link Version} turns concurrent edits into a conflict.
 */
@Entity
@Table(
    name = "payment_methods",
    indexes = {
        @Index(name = "idx_payment_methods_account", columnList = "account_id"),
        @Index(name = "idx_payment_methods_parent", columnList = "parent_payment_method_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PaymentMethodEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column
    private String name;

    @Column
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private PaymentMethodType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30, updatable = false)
    private PaymentProvider provider;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3, updatable = false)
    private CurrencyCode currency;

    /**
     * Current owner. Changes once, when a virtual card is claimed.
     */
    @Column(name = "account_id")
    private UUID accountId;

    @Column(name = "issuer_account_id", updatable = false)
    private UUID issuerAccountId;

    @Column(updatable = false)
    private String token;

    @Column(name = "processor_customer_id")
    private String processorCustomerId;

    @Column(name = "data", columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> data = new HashMap<>();

    @Column(name = "initial_balance", precision = 19, scale = 2)
    private BigDecimal initialBalance;

    @Column(name = "monthly_limit_per_member", precision = 19, scale = 2)
    private BigDecimal monthlyLimitPerMember;

    @Column(name = "limited_to_tags", columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private List<String> limitedToTags;

    @Column(name = "limited_to_collective_ids", columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private List<UUID> limitedToCollectiveIds;

    @Column(name = "limited_to_host_collective_ids", columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private List<UUID> limitedToHostCollectiveIds;

    @Column(name = "expiry_date")
    private LocalDate expiryDate;

    @Column(name = "parent_payment_method_id", updatable = false)
    private UUID parentPaymentMethodId;

    @Column(name = "recipient_email", updatable = false)
    private String recipientEmail;

    @Column(name = "claim_code", unique = true, length = 16, updatable = false)
    private String claimCode;

    @Column(name = "claimed_at")
    private Instant claimedAt;

    @Column(name = "claimed_by_account_id")
    private UUID claimedByAccountId;

    @Column(name = "created_by_user_id", updatable = false)
    private UUID createdByUserId;

    @Column(name = "archived_at")
    private Instant archivedAt;

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

    public static PaymentMethodEntity from(NewPaymentMethod attributes) {
        PaymentMethodEntity entity = new PaymentMethodEntity();
        entity.id = UUID.randomUUID();
        entity.name = attributes.getName();
        entity.description = attributes.getDescription();
        entity.type = attributes.getType();
        entity.provider = attributes.getProvider();
        entity.currency = attributes.getCurrency();
        entity.accountId = attributes.getAccountId();
        entity.issuerAccountId = attributes.getAccountId();
        entity.token = attributes.getToken();
        entity.processorCustomerId = attributes.getProcessorCustomerId();
        if (attributes.getData() != null) {
            entity.data = new HashMap<>(attributes.getData());
        }
        entity.initialBalance = attributes.getInitialBalance();
        entity.monthlyLimitPerMember = attributes.getMonthlyLimitPerMember();
        entity.limitedToTags = copyOrNull(attributes.getLimitedToTags());
        entity.limitedToCollectiveIds = copyOrNull(attributes.getLimitedToCollectiveIds());
        entity.limitedToHostCollectiveIds = copyOrNull(attributes.getLimitedToHostCollectiveIds());
        entity.expiryDate = attributes.getExpiryDate();
        entity.parentPaymentMethodId = attributes.getParentPaymentMethodId();
        entity.recipientEmail = attributes.getRecipientEmail();
        entity.claimCode = attributes.getClaimCode();
        entity.createdByUserId = attributes.getCreatedByUserId();
        return entity;
    }

    public boolean isArchived() {
        return archivedAt != null;
    }

    public boolean isExpired(LocalDate today) {
        return expiryDate != null && expiryDate.isBefore(today);
    }

    public boolean isClaimed() {
        return claimedAt != null;
    }

    public boolean isInternal() {
        return provider == PaymentProvider.INTERNAL;
    }

    void rename(String name) {
        this.name = name;
    }

    void changeMonthlyLimit(BigDecimal monthlyLimitPerMember) {
        this.monthlyLimitPerMember = monthlyLimitPerMember;
    }

    /**
     * Raises the budget of an allocation by a newly transferred amount.
     */
    public void topUp(BigDecimal amount) {
        this.initialBalance = (initialBalance == null ? BigDecimal.ZERO : initialBalance).add(amount);
    }

    void attachProcessorCustomer(String processorCustomerId) {
        this.processorCustomerId = processorCustomerId;
    }

    void claim(UUID claimingAccountId) {
        if (isClaimed()) {
            throw new IllegalStateException("Payment method " + id + " already claimed");
        }
        this.claimedAt = Instant.now();
        this.claimedByAccountId = claimingAccountId;
        this.accountId = claimingAccountId;
    }

    void archive() {
        if (archivedAt == null) {
            this.archivedAt = Instant.now();
        }
    }

    private static <T> List<T> copyOrNull(List<T> values) {
        return values == null || values.isEmpty() ? null : new ArrayList<>(values);
    }
}
