package com.flagship.collective_finance.expense;

import com.flagship.collective_finance.common.CurrencyCode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Fields of an expense as submitted or edited. On edit, null fields keep
 * their current value.
 */
@Value
@Builder
public class ExpenseDraft {
    UUID accountId;
    BigDecimal amount;
    CurrencyCode currency;
    String description;
    String attachmentUrl;
}
