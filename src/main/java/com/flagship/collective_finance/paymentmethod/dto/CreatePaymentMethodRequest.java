package com.flagship.collective_finance.paymentmethod.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.collective_finance.paymentmethod.PaymentMethodType;
import com.flagship.collective_finance.paymentmethod.PaymentProvider;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Value
public class CreatePaymentMethodRequest {

    @NotNull(message = "Account ID is required")
    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("name")
    String name;

    @JsonProperty("description")
    String description;

    @NotNull(message = "Type is required")
    @JsonProperty("type")
    PaymentMethodType type;

    @JsonProperty("provider")
    PaymentProvider provider;

    @NotBlank(message = "Currency is required")
    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;

    @JsonProperty("token")
    String token;

    @JsonProperty("data")
    Map<String, Object> data;

    @DecimalMin(value = "0.01", message = "Initial balance must be greater than 0")
    @JsonProperty("initial_balance")
    BigDecimal initialBalance;

    @DecimalMin(value = "0.01", message = "Monthly limit must be greater than 0")
    @JsonProperty("monthly_limit_per_member")
    BigDecimal monthlyLimitPerMember;

    @JsonProperty("limited_to_tags")
    List<String> limitedToTags;

    @JsonProperty("limited_to_collective_ids")
    List<UUID> limitedToCollectiveIds;

    @JsonProperty("limited_to_host_collective_ids")
    List<UUID> limitedToHostCollectiveIds;

    @JsonProperty("expiry_date")
    LocalDate expiryDate;

    @JsonProperty("parent_payment_method_id")
    UUID parentPaymentMethodId;
}
