package com.flagship.collective_finance.auth;

import lombok.Value;

import java.util.UUID;

/**
 * What an action is aimed at, expressed relative to accounts.
 *
 * <ul>
 *   <li>{@code accountId}: the account whose administrators may act</li>
 *   <li>{@code ownerUserAccountId}: user who owns the entity (an expense submitter)</li>
 *   <li>{@code counterpartyAccountId}: other side of a movement of funds</li>
 * </ul>
 */
@Value
public class AuthorizationTarget {
    UUID accountId;
    UUID ownerUserAccountId;
    UUID counterpartyAccountId;

    public static AuthorizationTarget none() {
        return new AuthorizationTarget(null, null, null);
    }

    public static AuthorizationTarget account(UUID accountId) {
        return new AuthorizationTarget(accountId, null, null);
    }

    public static AuthorizationTarget ownedBy(UUID accountId, UUID ownerUserAccountId) {
        return new AuthorizationTarget(accountId, ownerUserAccountId, null);
    }

    public static AuthorizationTarget between(UUID accountId, UUID counterpartyAccountId) {
        return new AuthorizationTarget(accountId, null, counterpartyAccountId);
    }
}
