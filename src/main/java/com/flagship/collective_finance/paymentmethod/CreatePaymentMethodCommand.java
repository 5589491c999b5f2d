package com.flagship.collective_finance.paymentmethod;

import com.flagship.collective_finance.common.CurrencyCode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class CreatePaymentMethodCommand {
    UUID accountId;
    String name;
    String description;
    PaymentMethodType type;
    PaymentProvider provider;
    CurrencyCode currency;
    String token;
    Map<String, Object> data;
    BigDecimal initialBalance;
    BigDecimal monthlyLimitPerMember;
    List<String> limitedToTags;
    List<UUID> limitedToCollectiveIds;
    List<UUID> limitedToHostCollectiveIds;
    LocalDate expiryDate;
    UUID parentPaymentMethodId;
}
