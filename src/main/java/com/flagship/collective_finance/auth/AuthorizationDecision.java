package com.flagship.collective_finance.auth;

import lombok.Value;

@Value
public class AuthorizationDecision {

    public enum DenyReason {
        UNAUTHENTICATED,
        INSUFFICIENT_ROLE,
        NOT_OWNER
    }

    private static final AuthorizationDecision ALLOW = new AuthorizationDecision(true, null);

    boolean allowed;
    DenyReason reason;

    public static AuthorizationDecision allow() {
        return ALLOW;
    }

    public static AuthorizationDecision deny(DenyReason reason) {
        return new AuthorizationDecision(false, reason);
    }

    public static AuthorizationDecision allowIf(boolean condition, DenyReason otherwise) {
        return condition ? ALLOW : deny(otherwise);
    }
}
