package com.flagship.collective_finance.auth;

import com.flagship.collective_finance.auth.AuthorizationDecision.DenyReason;
import com.flagship.collective_finance.error.AuthorizationException;
import com.flagship.collective_finance.error.ErrorCode;
import com.flagship.collective_finance.observability.MutationMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Single entry point for every authorization decision in the mutation layer.
 *
 * <p>Evaluation order:
 * <ol>
 *   <li>{@link ActionKind#PUBLIC} actions are always allowed</li>
 *   <li>anonymous principals are denied with {@code UNAUTHENTICATED}</li>
 *   <li>platform administrators are allowed</li>
 *   <li>otherwise the policy registered for the action's kind decides</li>
 * </ol>
 *
 * The guard never writes. Callers invoke {@link #require} after loading the
 * addressed entity and before touching anything else.
 */
@Component
@Slf4j
public class AuthorizationGuard {

    private final Map<ActionKind, AccessPolicy> policies = new EnumMap<>(ActionKind.class);
    private final MembershipChecker membership;
    private final MutationMetrics metrics;

    public AuthorizationGuard(List<AccessPolicy> policies, MembershipChecker membership, MutationMetrics metrics) {
        for (AccessPolicy policy : policies) {
            AccessPolicy previous = this.policies.put(policy.kind(), policy);
            if (previous != null) {
                throw new IllegalStateException("Two access policies registered for " + policy.kind());
            }
        }
        for (ActionKind kind : ActionKind.values()) {
            if (!this.policies.containsKey(kind)) {
                throw new IllegalStateException("No access policy registered for " + kind);
            }
        }
        this.membership = membership;
        this.metrics = metrics;
    }

    public AuthorizationDecision authorize(Principal principal, Action action, AuthorizationTarget target) {
        if (action.getKind() == ActionKind.PUBLIC) {
            return AuthorizationDecision.allow();
        }
        if (principal == null || !principal.isAuthenticated()) {
            return AuthorizationDecision.deny(DenyReason.UNAUTHENTICATED);
        }
        if (membership.isPlatformAdmin(principal.getUserAccountId())) {
            return AuthorizationDecision.allow();
        }
        return policies.get(action.getKind()).evaluate(principal, target);
    }

    /**
     * Like {@link #authorize} but throws on deny.
     *
     * @throws AuthorizationException carrying {@code unauthenticated},
     *         {@code forbidden} or {@code not-owner}
     */
    public void require(Principal principal, Action action, AuthorizationTarget target) {
        AuthorizationDecision decision = authorize(principal, action, target);
        if (decision.isAllowed()) {
            return;
        }
        DenyReason reason = decision.getReason();
        metrics.recordDenied(action.name(), reason.name());
        log.warn("Denied {}: reason={}, user={}, account={}",
                action, reason, principal == null ? null : principal.getUserAccountId(), target.getAccountId());

        throw switch (reason) {
            case UNAUTHENTICATED -> new AuthorizationException(ErrorCode.UNAUTHENTICATED,
                    "You need to be logged in to perform " + action);
            case NOT_OWNER -> new AuthorizationException(ErrorCode.NOT_OWNER,
                    "Only the owner or an administrator can perform " + action);
            case INSUFFICIENT_ROLE -> new AuthorizationException(ErrorCode.FORBIDDEN,
                    "You don't have permission to perform " + action);
        };
    }
}
