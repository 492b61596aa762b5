package com.mgmt.session.auth.server;

import java.util.Optional;

/**
 * Usage scope of a session token. Every scope is signed with its own secret.
 */
public enum TokenScope {
    /** Interactive login sessions. The secret is regenerated on every start. */
    DEFAULT("default", false),
    /** Tokens embedded in exported kubeconfig files. The secret is persisted in settings. */
    KUBECONFIG("kubeconfig", true);

    private final String claimValue;
    private final boolean durable;

    TokenScope(String claimValue, boolean durable) {
        this.claimValue = claimValue;
        this.durable = durable;
    }

    public String claimValue() {
        return claimValue;
    }

    public boolean isDurable() {
        return durable;
    }

    public static Optional<TokenScope> fromClaim(String value) {
        for (TokenScope scope : values()) {
            if (scope.claimValue.equals(value)) {
                return Optional.of(scope);
            }
        }
        return Optional.empty();
    }
}
