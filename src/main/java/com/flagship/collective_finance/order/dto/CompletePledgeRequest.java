package com.flagship.collective_finance.order.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

@Value
public class CompletePledgeRequest {

    @NotNull(message = "Payment method ID is required")
    @JsonProperty("payment_method_id")
    UUID paymentMethodId;
}
