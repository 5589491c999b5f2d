package com.flagship.collective_finance.paymentmethod.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.collective_finance.paymentmethod.PaymentMethodEntity;
import com.flagship.collective_finance.paymentmethod.PaymentMethodType;
import com.flagship.collective_finance.paymentmethod.PaymentProvider;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Payment method as seen by its owner. The processor token and customer
 * reference are never exposed.
 */
@Value
@Builder
public class PaymentMethodResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("type")
    PaymentMethodType type;

    @JsonProperty("provider")
    PaymentProvider provider;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("initial_balance")
    BigDecimal initialBalance;

    @JsonProperty("monthly_limit_per_member")
    BigDecimal monthlyLimitPerMember;

    @JsonProperty("limited_to_tags")
    List<String> limitedToTags;

    @JsonProperty("limited_to_collective_ids")
    List<UUID> limitedToCollectiveIds;

    @JsonProperty("limited_to_host_collective_ids")
    List<UUID> limitedToHostCollectiveIds;

    @JsonProperty("expiry_date")
    LocalDate expiryDate;

    @JsonProperty("parent_payment_method_id")
    UUID parentPaymentMethodId;

    @JsonProperty("recipient_email")
    String recipientEmail;

    @JsonProperty("claim_code")
    String claimCode;

    @JsonProperty("claimed_at")
    Instant claimedAt;

    @JsonProperty("archived_at")
    Instant archivedAt;

    @JsonProperty("created_at")
    Instant createdAt;

    public static PaymentMethodResponse from(PaymentMethodEntity paymentMethod) {
        return PaymentMethodResponse.builder()
            .id(paymentMethod.getId())
            .name(paymentMethod.getName())
            .type(paymentMethod.getType())
            .provider(paymentMethod.getProvider())
            .currency(paymentMethod.getCurrency().name())
            .accountId(paymentMethod.getAccountId())
            .initialBalance(paymentMethod.getInitialBalance())
            .monthlyLimitPerMember(paymentMethod.getMonthlyLimitPerMember())
            .limitedToTags(paymentMethod.getLimitedToTags())
            .limitedToCollectiveIds(paymentMethod.getLimitedToCollectiveIds())
            .limitedToHostCollectiveIds(paymentMethod.getLimitedToHostCollectiveIds())
            .expiryDate(paymentMethod.getExpiryDate())
            .parentPaymentMethodId(paymentMethod.getParentPaymentMethodId())
            .recipientEmail(paymentMethod.getRecipientEmail())
            .claimCode(paymentMethod.isClaimed() ? null : paymentMethod.getClaimCode())
            .claimedAt(paymentMethod.getClaimedAt())
            .archivedAt(paymentMethod.getArchivedAt())
            .createdAt(paymentMethod.getCreatedAt())
            .build();
    }
}
