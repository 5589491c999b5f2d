package com.flagship.collective_finance.paymentmethod.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
public class CreateVirtualCardsRequest {

    @NotNull(message = "Collective ID is required")
    @JsonProperty("collective_id")
    UUID collectiveId;

    @JsonProperty("payment_method_id")
    UUID paymentMethodId;

    @JsonProperty("emails")
    List<@Email(message = "Each email must be a valid address") String> emails;

    @JsonProperty("number_of_virtual_cards")
    Integer numberOfVirtualCards;

    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;

    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @DecimalMin(value = "0.01", message = "Monthly limit must be greater than 0")
    @JsonProperty("monthly_limit_per_member")
    BigDecimal monthlyLimitPerMember;

    @JsonProperty("limited_to_tags")
    List<String> limitedToTags;

    @JsonProperty("limited_to_collective_ids")
    List<UUID> limitedToCollectiveIds;

    @JsonProperty("limited_to_host_collective_ids")
    List<UUID> limitedToHostCollectiveIds;

    @JsonProperty("limited_to_open_source_collectives")
    Boolean limitedToOpenSourceCollectives;

    @JsonProperty("description")
    String description;

    @JsonProperty("custom_message")
    String customMessage;

    @JsonProperty("expiry_date")
    LocalDate expiryDate;
}
