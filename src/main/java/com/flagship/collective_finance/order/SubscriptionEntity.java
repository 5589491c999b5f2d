package com.flagship.collective_finance.order;

import com.flagship.collective_finance.common.CurrencyCode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Recurring-charge schedule of a recurring order. Changes here only affect
 * future charges; recorded transactions are never touched.
 */
@Entity
@Table(name = "subscriptions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SubscriptionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "order_id", nullable = false, unique = true, updatable = false)
    private UUID orderId;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3, updatable = false)
    private CurrencyCode currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "charge_interval", nullable = false, length = 10, updatable = false)
    private OrderInterval interval;

    @Column(name = "payment_method_id", nullable = false)
    private UUID paymentMethodId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SubscriptionStatus status;

    @Column(name = "next_charge_date")
    private LocalDate nextChargeDate;

    @Column(name = "charge_count", nullable = false)
    private int chargeCount;

    @Column(name = "last_charged_at")
    private Instant lastChargedAt;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

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

    static SubscriptionEntity start(OrderEntity order, UUID paymentMethodId) {
        SubscriptionEntity subscription = new SubscriptionEntity();
        subscription.id = UUID.randomUUID();
        subscription.orderId = order.getId();
        subscription.amount = order.getAmount();
        subscription.currency = order.getCurrency();
        subscription.interval = order.getInterval();
        subscription.paymentMethodId = paymentMethodId;
        subscription.status = SubscriptionStatus.ACTIVE;
        return subscription;
    }

    public boolean isActive() {
        return status == SubscriptionStatus.ACTIVE;
    }

    void recordCharge(LocalDate chargedOn) {
        this.chargeCount++;
        this.lastChargedAt = Instant.now();
        this.nextChargeDate = interval.nextChargeAfter(chargedOn);
    }

    void cancel() {
        this.status = SubscriptionStatus.CANCELLED;
        this.cancelledAt = Instant.now();
        this.nextChargeDate = null;
    }

    void changeAmount(BigDecimal amount) {
        this.amount = amount;
    }

    void changePaymentMethod(UUID paymentMethodId) {
        this.paymentMethodId = paymentMethodId;
    }
}
