package com.flagship.collective_finance.order.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.collective_finance.order.OrderInterval;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class CreateOrderRequest {

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;

    @NotNull(message = "Source account ID is required")
    @JsonProperty("from_account_id")
    UUID fromAccountId;

    @NotNull(message = "Destination account ID is required")
    @JsonProperty("to_account_id")
    UUID toAccountId;

    @JsonProperty("interval")
    OrderInterval interval;

    @JsonProperty("payment_method_id")
    UUID paymentMethodId;

    @Size(max = 255)
    @JsonProperty("public_message")
    String publicMessage;

    @JsonProperty("description")
    String description;
}
