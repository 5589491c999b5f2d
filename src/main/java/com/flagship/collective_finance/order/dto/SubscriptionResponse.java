package com.flagship.collective_finance.order.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.collective_finance.order.OrderInterval;
import com.flagship.collective_finance.order.SubscriptionEntity;
import com.flagship.collective_finance.order.SubscriptionStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class SubscriptionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("order_id")
    UUID orderId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("interval")
    OrderInterval interval;

    @JsonProperty("payment_method_id")
    UUID paymentMethodId;

    @JsonProperty("status")
    SubscriptionStatus status;

    @JsonProperty("next_charge_date")
    LocalDate nextChargeDate;

    @JsonProperty("cancelled_at")
    Instant cancelledAt;

    public static SubscriptionResponse from(SubscriptionEntity subscription) {
        return SubscriptionResponse.builder()
            .id(subscription.getId())
            .orderId(subscription.getOrderId())
            .amount(subscription.getAmount())
            .currency(subscription.getCurrency().name())
            .interval(subscription.getInterval())
            .paymentMethodId(subscription.getPaymentMethodId())
            .status(subscription.getStatus())
            .nextChargeDate(subscription.getNextChargeDate())
            .cancelledAt(subscription.getCancelledAt())
            .build();
    }
}
