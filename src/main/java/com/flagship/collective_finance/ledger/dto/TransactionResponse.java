package com.flagship.collective_finance.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.collective_finance.ledger.LedgerTransactionEntity;
import com.flagship.collective_finance.ledger.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("type")
    TransactionType type;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("counterparty_account_id")
    UUID counterpartyAccountId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("processor_fee")
    BigDecimal processorFee;

    @JsonProperty("host_fee")
    BigDecimal hostFee;

    @JsonProperty("platform_fee")
    BigDecimal platformFee;

    @JsonProperty("refund_of_transaction_id")
    UUID refundOfTransactionId;

    @JsonProperty("transaction_group")
    UUID transactionGroup;

    @JsonProperty("description")
    String description;

    @JsonProperty("created_at")
    Instant createdAt;

    public static TransactionResponse from(LedgerTransactionEntity transaction) {
        return TransactionResponse.builder()
            .id(transaction.getId())
            .type(transaction.getType())
            .accountId(transaction.getAccountId())
            .counterpartyAccountId(transaction.getCounterpartyAccountId())
            .amount(transaction.getAmount())
            .currency(transaction.getCurrency().name())
            .processorFee(transaction.getProcessorFee())
            .hostFee(transaction.getHostFee())
            .platformFee(transaction.getPlatformFee())
            .refundOfTransactionId(transaction.getRefundOfTransactionId())
            .transactionGroup(transaction.getTransactionGroup())
            .description(transaction.getDescription())
            .createdAt(transaction.getCreatedAt())
            .build();
    }
}
