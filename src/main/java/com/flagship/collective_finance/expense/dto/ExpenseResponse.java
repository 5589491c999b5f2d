package com.flagship.collective_finance.expense.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.collective_finance.expense.Expense;
import com.flagship.collective_finance.expense.ExpenseStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ExpenseResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("submitted_by_user_id")
    UUID submittedByUserId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("description")
    String description;

    @JsonProperty("attachment_url")
    String attachmentUrl;

    @JsonProperty("status")
    ExpenseStatus status;

    @JsonProperty("processor_fee")
    BigDecimal processorFee;

    @JsonProperty("host_fee")
    BigDecimal hostFee;

    @JsonProperty("platform_fee")
    BigDecimal platformFee;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static ExpenseResponse from(Expense expense) {
        return ExpenseResponse.builder()
            .id(expense.getId())
            .accountId(expense.getAccountId())
            .submittedByUserId(expense.getSubmittedByUserId())
            .amount(expense.getAmount())
            .currency(expense.getCurrency().name())
            .description(expense.getDescription())
            .attachmentUrl(expense.getAttachmentUrl())
            .status(expense.getStatus())
            .processorFee(expense.getFees().getProcessorFee())
            .hostFee(expense.getFees().getHostFee())
            .platformFee(expense.getFees().getPlatformFee())
            .createdAt(expense.getCreatedAt())
            .updatedAt(expense.getUpdatedAt())
            .build();
    }
}
