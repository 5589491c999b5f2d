package com.flagship.collective_finance.account;

public enum AccountType {
    USER,
    ORGANIZATION,
    COLLECTIVE,
    EVENT
}
