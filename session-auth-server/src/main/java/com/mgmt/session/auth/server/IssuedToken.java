package com.mgmt.session.auth.server;

import java.time.Instant;

/**
 * @param expiresAt expiry embedded in the token, {@code null} if it never expires
 */
public record IssuedToken(String token, Instant expiresAt) {

    public boolean neverExpires() {
        return expiresAt == null;
    }
}
