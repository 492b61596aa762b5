package com.mgmt.session.auth.server;

import java.time.Instant;

/**
 * Payload of a session token.
 *
 * @param issuedAt  always set
 * @param expiresAt {@code null} for tokens that never expire
 */
record SessionClaims(
    int userId,
    String username,
    int role,
    TokenScope scope,
    boolean forceChangePassword,
    Instant issuedAt,
    Instant expiresAt
) {
    static final String ID = "id";
    static final String USERNAME = "username";
    static final String ROLE = "role";
    static final String SCOPE = "scope";
    static final String FORCE_CHANGE_PASSWORD = "forceChangePassword";

    static SessionClaims of(TokenData data, TokenScope scope, Instant issuedAt, Instant expiresAt) {
        return new SessionClaims(
            data.id(),
            data.username(),
            data.role(),
            scope,
            data.forceChangePassword(),
            issuedAt,
            expiresAt
        );
    }
}
