package com.flagship.collective_finance.expense;

public enum ExpenseStatus {
    PENDING,
    APPROVED,
    REJECTED,
    PAID
}
