package com.flagship.collective_finance.expense.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class PayExpenseRequest {

    @DecimalMin(value = "0.00", message = "Processor fee cannot be negative")
    @JsonProperty("processor_fee")
    BigDecimal processorFee;

    @DecimalMin(value = "0.00", message = "Host fee cannot be negative")
    @JsonProperty("host_fee")
    BigDecimal hostFee;

    @DecimalMin(value = "0.00", message = "Platform fee cannot be negative")
    @JsonProperty("platform_fee")
    BigDecimal platformFee;
}
