package com.flagship.collective_finance.order;

import com.flagship.collective_finance.common.CurrencyCode;
import com.flagship.collective_finance.error.InvalidStateException;
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

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A contribution from a source account to a destination account.
 *
 * Amount, currency and the two accounts are fixed at creation. Status only
 * moves along {@link OrderStatus#canTransitionTo}.
 */
@Entity
@Table(
    name = "orders",
    indexes = {
        @Index(name = "idx_orders_payment_method", columnList = "payment_method_id"),
        @Index(name = "idx_orders_destination", columnList = "destination_account_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3, updatable = false)
    private CurrencyCode currency;

    @Column(name = "source_account_id", nullable = false, updatable = false)
    private UUID sourceAccountId;

    @Column(name = "destination_account_id", nullable = false, updatable = false)
    private UUID destinationAccountId;

    @Enumerated(EnumType.STRING)
    @Column(name = "order_interval", nullable = false, length = 10, updatable = false)
    private OrderInterval interval;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private OrderStatus status;

    @Column(name = "payment_method_id")
    private UUID paymentMethodId;

    @Column(name = "subscription_id")
    private UUID subscriptionId;

    @Column(name = "public_message", length = 1000)
    private String publicMessage;

    @Column(length = 1000, updatable = false)
    private String description;

    @Column(name = "origin_ip", length = 64, updatable = false)
    private String originIp;

    @Column(name = "created_by_user_id", updatable = false)
    private UUID createdByUserId;

    @Column(name = "processed_at")
    private Instant processedAt;

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

    /**
     * Creates an order in PENDING status.
     */
    static OrderEntity place(BigDecimal amount, CurrencyCode currency, UUID sourceAccountId,
                             UUID destinationAccountId, OrderInterval interval, UUID paymentMethodId,
                             String publicMessage, String description, String originIp, UUID createdByUserId) {
        OrderEntity order = new OrderEntity();
        order.id = UUID.randomUUID();
        order.amount = amount;
        order.currency = currency;
        order.sourceAccountId = sourceAccountId;
        order.destinationAccountId = destinationAccountId;
        order.interval = interval;
        order.status = OrderStatus.PENDING;
        order.paymentMethodId = paymentMethodId;
        order.publicMessage = publicMessage;
        order.description = description;
        order.originIp = originIp;
        order.createdByUserId = createdByUserId;
        return order;
    }

    public boolean isPledge() {
        return status == OrderStatus.PENDING;
    }

    void transitionTo(OrderStatus target) {
        if (!status.canTransitionTo(target)) {
            throw InvalidStateException.invalidTransition(status, target, "order " + id);
        }
        if (target == OrderStatus.PAID || target == OrderStatus.ACTIVE) {
            this.processedAt = Instant.now();
        }
        this.status = target;
    }

    void attachPaymentMethod(UUID paymentMethodId) {
        this.paymentMethodId = paymentMethodId;
    }

    void attachSubscription(UUID subscriptionId) {
        if (this.subscriptionId != null) {
            throw new IllegalStateException("Order " + id + " already has subscription " + this.subscriptionId);
        }
        this.subscriptionId = subscriptionId;
    }

    void updatePublicMessage(String publicMessage) {
        this.publicMessage = publicMessage;
    }
}
