package com.mgmt.session.auth.server;

/**
 * Identity carried by a session token. {@code token} is empty on the way in
 * and holds the verified raw token on the way out.
 */
public record TokenData(int id, String username, int role, String token, boolean forceChangePassword) {

    public static TokenData of(int id, String username, int role, boolean forceChangePassword) {
        return new TokenData(id, username, role, null, forceChangePassword);
    }
}
