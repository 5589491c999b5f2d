package com.flagship.collective_finance.ledger;

public enum TransactionType {
    CONTRIBUTION,
    EXPENSE_PAYMENT,
    REFUND,
    FUND_TRANSFER
}
