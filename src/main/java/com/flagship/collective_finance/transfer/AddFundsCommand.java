package com.flagship.collective_finance.transfer;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class AddFundsCommand {
    BigDecimal totalAmount;
    UUID collectiveId;
    UUID hostCollectiveId;
    String description;
}
