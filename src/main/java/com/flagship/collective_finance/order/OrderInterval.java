package com.flagship.collective_finance.order;

import java.time.LocalDate;

public enum OrderInterval {
    NONE,
    MONTHLY,
    YEARLY;

    public boolean isRecurring() {
        return this != NONE;
    }

    /**
     * Date of the charge following one made on {@code chargedOn}.
     */
    public LocalDate nextChargeAfter(LocalDate chargedOn) {
        return switch (this) {
            case MONTHLY -> chargedOn.plusMonths(1);
            case YEARLY -> chargedOn.plusYears(1);
            case NONE -> throw new IllegalStateException("One-time orders have no next charge");
        };
    }
}
