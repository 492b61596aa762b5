package com.mgmt.session.auth.server;

/**
 * The only failure callers see when a token is rejected. It never says why.
 */
public class InvalidTokenException extends RuntimeException {

    public InvalidTokenException() {
        super("Invalid JWT token");
    }
}
