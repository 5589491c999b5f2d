package com.flagship.collective_finance.order;

/**
 * Lifecycle of an order.
 *
 * PENDING is the pledge state: the intent to contribute exists but nothing
 * has been captured yet.
 */
public enum OrderStatus {
    PENDING,
    ACTIVE,
    PAID,
    CANCELLED;

    public boolean canTransitionTo(OrderStatus target) {
        return switch (this) {
            case PENDING -> target == ACTIVE || target == PAID || target == CANCELLED;
            case ACTIVE -> target == CANCELLED;
            case PAID, CANCELLED -> false;
        };
    }

    /**
     * Whether the order may still cause a charge on its payment method.
     */
    public boolean isOpen() {
        return this == PENDING || this == ACTIVE;
    }
}
