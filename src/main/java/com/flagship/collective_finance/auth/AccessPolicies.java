package com.flagship.collective_finance.auth;

import com.flagship.collective_finance.auth.AuthorizationDecision.DenyReason;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * One {@link AccessPolicy} per {@link ActionKind}.
 */
public class AccessPolicies {

    @Component
    public static class PublicPolicy implements AccessPolicy {
        @Override
        public ActionKind kind() {
            return ActionKind.PUBLIC;
        }

        @Override
        public AuthorizationDecision evaluate(Principal principal, AuthorizationTarget target) {
            return AuthorizationDecision.allow();
        }
    }

    @Component
    public static class AuthenticatedPolicy implements AccessPolicy {
        @Override
        public ActionKind kind() {
            return ActionKind.AUTHENTICATED;
        }

        @Override
        public AuthorizationDecision evaluate(Principal principal, AuthorizationTarget target) {
            return AuthorizationDecision.allowIf(principal.isAuthenticated(), DenyReason.UNAUTHENTICATED);
        }
    }

    /**
     * Owner of the entity, or administrator of the account it belongs to.
     * When the target names an owner and the caller is neither, the denial
     * is {@code NOT_OWNER}.
     */
    @Component
    @RequiredArgsConstructor
    public static class OwnAccountPolicy implements AccessPolicy {
        private final MembershipChecker membership;

        @Override
        public ActionKind kind() {
            return ActionKind.OWN_ACCOUNT;
        }

        @Override
        public AuthorizationDecision evaluate(Principal principal, AuthorizationTarget target) {
            if (target.getOwnerUserAccountId() != null) {
                if (principal.is(target.getOwnerUserAccountId())
                        || membership.isAdminOf(principal.getUserAccountId(), target.getAccountId())) {
                    return AuthorizationDecision.allow();
                }
                return AuthorizationDecision.deny(DenyReason.NOT_OWNER);
            }
            return AuthorizationDecision.allowIf(
                    membership.isAdminOf(principal.getUserAccountId(), target.getAccountId()),
                    DenyReason.INSUFFICIENT_ROLE);
        }
    }

    @Component
    @RequiredArgsConstructor
    public static class HostAdminPolicy implements AccessPolicy {
        private final MembershipChecker membership;

        @Override
        public ActionKind kind() {
            return ActionKind.HOST_ADMIN;
        }

        @Override
        public AuthorizationDecision evaluate(Principal principal, AuthorizationTarget target) {
            return AuthorizationDecision.allowIf(
                    membership.isHostAdminOf(principal.getUserAccountId(), target.getAccountId()),
                    DenyReason.INSUFFICIENT_ROLE);
        }
    }

    @Component
    @RequiredArgsConstructor
    public static class AccountOrHostAdminPolicy implements AccessPolicy {
        private final MembershipChecker membership;

        @Override
        public ActionKind kind() {
            return ActionKind.ACCOUNT_OR_HOST_ADMIN;
        }

        @Override
        public AuthorizationDecision evaluate(Principal principal, AuthorizationTarget target) {
            UUID user = principal.getUserAccountId();
            return AuthorizationDecision.allowIf(
                    membership.isAdminOf(user, target.getAccountId())
                            || membership.isHostAdminOf(user, target.getAccountId()),
                    DenyReason.INSUFFICIENT_ROLE);
        }
    }

    @Component
    @RequiredArgsConstructor
    public static class EitherPartyAdminPolicy implements AccessPolicy {
        private final MembershipChecker membership;

        @Override
        public ActionKind kind() {
            return ActionKind.EITHER_PARTY_ADMIN;
        }

        @Override
        public AuthorizationDecision evaluate(Principal principal, AuthorizationTarget target) {
            UUID user = principal.getUserAccountId();
            return AuthorizationDecision.allowIf(
                    membership.isAdminOf(user, target.getAccountId())
                            || membership.isAdminOf(user, target.getCounterpartyAccountId()),
                    DenyReason.INSUFFICIENT_ROLE);
        }
    }
}
