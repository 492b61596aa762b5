package com.mgmt.session.auth.server.store;

/**
 * The slice of a user record needed to verify session tokens.
 *
 * @param tokenIssueAt epoch second at which the user's credentials were last invalidated;
 *                     tokens issued before it are stale
 */
public record UserRecord(int id, String username, int role, long tokenIssueAt) {

    public UserRecord withTokenIssueAt(long epochSecond) {
        return new UserRecord(id, username, role, epochSecond);
    }
}
