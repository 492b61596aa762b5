package com.mgmt.session.auth.server.store;

/**
 * Raised by a store when the backing data could not be read or written.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
