package com.mgmt.session.auth.server.key;

public class SecretGenerationException extends IllegalStateException {

    public SecretGenerationException(String message) {
        super(message);
    }
}
