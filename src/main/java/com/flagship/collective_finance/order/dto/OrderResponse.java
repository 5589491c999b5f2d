package com.flagship.collective_finance.order.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.collective_finance.order.OrderEntity;
import com.flagship.collective_finance.order.OrderInterval;
import com.flagship.collective_finance.order.OrderStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class OrderResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("from_account_id")
    UUID fromAccountId;

    @JsonProperty("to_account_id")
    UUID toAccountId;

    @JsonProperty("interval")
    OrderInterval interval;

    @JsonProperty("status")
    OrderStatus status;

    @JsonProperty("payment_method_id")
    UUID paymentMethodId;

    @JsonProperty("subscription_id")
    UUID subscriptionId;

    @JsonProperty("public_message")
    String publicMessage;

    @JsonProperty("processed_at")
    Instant processedAt;

    @JsonProperty("created_at")
    Instant createdAt;

    public static OrderResponse from(OrderEntity order) {
        return OrderResponse.builder()
            .id(order.getId())
            .amount(order.getAmount())
            .currency(order.getCurrency().name())
            .fromAccountId(order.getSourceAccountId())
            .toAccountId(order.getDestinationAccountId())
            .interval(order.getInterval())
            .status(order.getStatus())
            .paymentMethodId(order.getPaymentMethodId())
            .subscriptionId(order.getSubscriptionId())
            .publicMessage(order.getPublicMessage())
            .processedAt(order.getProcessedAt())
            .createdAt(order.getCreatedAt())
            .build();
    }
}
