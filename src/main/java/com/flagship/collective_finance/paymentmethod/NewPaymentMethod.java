package com.flagship.collective_finance.paymentmethod;

import com.flagship.collective_finance.common.CurrencyCode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Validated attributes of a payment method about to be persisted.
 */
@Value
@Builder
public class NewPaymentMethod {
    String name;
    String description;
    PaymentMethodType type;
    PaymentProvider provider;
    CurrencyCode currency;
    UUID accountId;
    String token;
    String processorCustomerId;
    @Singular("dataEntry")
    Map<String, Object> data;
    BigDecimal initialBalance;
    BigDecimal monthlyLimitPerMember;
    List<String> limitedToTags;
    List<UUID> limitedToCollectiveIds;
    List<UUID> limitedToHostCollectiveIds;
    LocalDate expiryDate;
    UUID parentPaymentMethodId;
    String recipientEmail;
    String claimCode;
    UUID createdByUserId;
}
