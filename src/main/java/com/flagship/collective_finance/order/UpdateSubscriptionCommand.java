package com.flagship.collective_finance.order;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Changes to a subscription, addressed by its order. Null fields are left
 * unchanged.
 */
@Value
@Builder
public class UpdateSubscriptionCommand {
    UUID orderId;
    UUID paymentMethodId;
    BigDecimal amount;
}
