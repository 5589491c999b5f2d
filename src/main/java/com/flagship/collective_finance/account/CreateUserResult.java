package com.flagship.collective_finance.account;

import lombok.Value;

@Value
public class CreateUserResult {
    AccountEntity user;
    AccountEntity organization; // null when none was requested
}
