package com.flagship.collective_finance.auth;

/**
 * Rule for one {@link ActionKind}. Implementations only see authenticated
 * principals; anonymous callers and platform administrators are handled
 * by {@link AuthorizationGuard} before a policy is consulted.
 */
public interface AccessPolicy {

    ActionKind kind();

    AuthorizationDecision evaluate(Principal principal, AuthorizationTarget target);
}
