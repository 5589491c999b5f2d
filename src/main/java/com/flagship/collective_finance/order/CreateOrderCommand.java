package com.flagship.collective_finance.order;

import com.flagship.collective_finance.common.CurrencyCode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class CreateOrderCommand {
    UUID sourceAccountId;
    UUID destinationAccountId;
    BigDecimal amount;
    CurrencyCode currency;        // defaults to the destination's currency
    OrderInterval interval;       // defaults to NONE
    UUID paymentMethodId;         // absent for a pledge
    String publicMessage;
    String description;
}
