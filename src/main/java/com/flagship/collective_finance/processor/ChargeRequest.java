package com.flagship.collective_finance.processor;

import com.flagship.collective_finance.common.CurrencyCode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class ChargeRequest {
    BigDecimal amount;
    CurrencyCode currency;
    UUID destinationAccountId;
    UUID orderId;
    String description;
}
