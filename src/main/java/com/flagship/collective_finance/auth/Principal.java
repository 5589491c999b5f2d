package com.flagship.collective_finance.auth;

import lombok.Value;

import java.util.UUID;

/**
 * The caller of a mutation, as established by the upstream authentication
 * layer. An anonymous principal has no user account.
 */
@Value
public class Principal {
    UUID userAccountId;

    private static final Principal ANONYMOUS = new Principal(null);

    public static Principal anonymous() {
        return ANONYMOUS;
    }

    public static Principal user(UUID userAccountId) {
        return userAccountId == null ? ANONYMOUS : new Principal(userAccountId);
    }

    public boolean isAuthenticated() {
        return userAccountId != null;
    }

    public boolean is(UUID accountId) {
        return userAccountId != null && userAccountId.equals(accountId);
    }
}
