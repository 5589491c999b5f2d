package com.flagship.collective_finance.order;

public enum SubscriptionStatus {
    ACTIVE,
    CANCELLED
}
