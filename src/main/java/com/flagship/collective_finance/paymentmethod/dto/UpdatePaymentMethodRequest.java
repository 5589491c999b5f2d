package com.flagship.collective_finance.paymentmethod.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class UpdatePaymentMethodRequest {

    @JsonProperty("name")
    String name;

    @DecimalMin(value = "0.01", message = "Monthly limit must be greater than 0")
    @JsonProperty("monthly_limit_per_member")
    BigDecimal monthlyLimitPerMember;
}
