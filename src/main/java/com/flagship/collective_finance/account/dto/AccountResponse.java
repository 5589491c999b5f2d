package com.flagship.collective_finance.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.collective_finance.account.AccountEntity;
import com.flagship.collective_finance.account.AccountType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("slug")
    String slug;

    @JsonProperty("name")
    String name;

    @JsonProperty("type")
    AccountType type;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("created_at")
    Instant createdAt;

    public static AccountResponse from(AccountEntity account) {
        if (account == null) {
            return null;
        }
        return AccountResponse.builder()
            .id(account.getId())
            .slug(account.getSlug())
            .name(account.getName())
            .type(account.getType())
            .currency(account.getCurrency().name())
            .createdAt(account.getCreatedAt())
            .build();
    }
}
