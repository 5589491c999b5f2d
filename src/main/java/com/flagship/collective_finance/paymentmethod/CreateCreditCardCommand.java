package com.flagship.collective_finance.paymentmethod;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/**
 * A card tokenized by the processor's client-side library, to be attached
 * to {@code accountId}.
 */
@Value
@Builder
public class CreateCreditCardCommand {
    UUID accountId;
    String name;
    String token;
    Map<String, Object> data;
    BigDecimal monthlyLimitPerMember;
}
