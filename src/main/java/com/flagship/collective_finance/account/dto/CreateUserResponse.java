package com.flagship.collective_finance.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.collective_finance.account.CreateUserResult;
import lombok.Value;

@Value
public class CreateUserResponse {

    @JsonProperty("user")
    AccountResponse user;

    @JsonProperty("organization")
    AccountResponse organization;

    public static CreateUserResponse from(CreateUserResult result) {
        return new CreateUserResponse(AccountResponse.from(result.getUser()),
                AccountResponse.from(result.getOrganization()));
    }
}
