package com.flagship.collective_finance.paymentmethod.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

@Value
public class CreateCreditCardRequest {

    @NotNull(message = "Collective ID is required")
    @JsonProperty("collective_id")
    UUID collectiveId;

    @JsonProperty("name")
    String name;

    @NotBlank(message = "Token is required")
    @JsonProperty("token")
    String token;

    @NotEmpty(message = "Card data is required")
    @JsonProperty("data")
    Map<String, Object> data;

    @DecimalMin(value = "0.01", message = "Monthly limit must be greater than 0")
    @JsonProperty("monthly_limit_per_member")
    BigDecimal monthlyLimitPerMember;
}
