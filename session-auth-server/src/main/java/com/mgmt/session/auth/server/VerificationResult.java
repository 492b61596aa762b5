package com.mgmt.session.auth.server;

/**
 * Outcome of verifying a token. {@link Rejected} keeps the real cause for diagnostics
 * and never leaves {@link SessionTokenService}.
 */
sealed interface VerificationResult {

    record Verified(TokenData data) implements VerificationResult {}

    record Rejected(Reason reason, Exception cause) implements VerificationResult {}

    enum Reason {
        MALFORMED,
        UNSUPPORTED_ALGORITHM,
        BAD_SIGNATURE,
        EXPIRED,
        SCOPE_MISMATCH,
        USER_LOOKUP_FAILED,
        UNKNOWN_USER,
        REVOKED
    }
}
