package com.flagship.collective_finance.transfer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class AddFundsRequest {

    @NotNull(message = "Total amount is required")
    @DecimalMin(value = "0.01", message = "Total amount must be greater than 0")
    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @NotNull(message = "Collective ID is required")
    @JsonProperty("collective_id")
    UUID collectiveId;

    @NotNull(message = "Host collective ID is required")
    @JsonProperty("host_collective_id")
    UUID hostCollectiveId;

    @JsonProperty("description")
    String description;
}
