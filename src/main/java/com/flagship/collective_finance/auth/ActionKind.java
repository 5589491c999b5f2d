package com.flagship.collective_finance.auth;

/**
 * Authorization rule families. Each has exactly one {@link AccessPolicy}.
 */
public enum ActionKind {
    /** Open to anonymous callers. */
    PUBLIC,
    /** Any signed-in user. */
    AUTHENTICATED,
    /** Administrator of the target account, or owner of the target entity. */
    OWN_ACCOUNT,
    /** Administrator of the target account's fiscal host. */
    HOST_ADMIN,
    /** Administrator of the target account or of its host. */
    ACCOUNT_OR_HOST_ADMIN,
    /** Administrator of either side of a movement of funds. */
    EITHER_PARTY_ADMIN
}
