package com.flagship.collective_finance.expense.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Body of expense submission and edits. Required fields for a submission are
 * checked by the service since an edit may leave any of them out.
 */
@Value
public class ExpenseRequest {

    @JsonProperty("account_id")
    UUID accountId;

    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;

    @Size(max = 1000)
    @JsonProperty("description")
    String description;

    @JsonProperty("attachment_url")
    String attachmentUrl;
}
