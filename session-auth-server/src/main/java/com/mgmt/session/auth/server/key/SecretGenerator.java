package com.mgmt.session.auth.server.key;

/**
 * Source of random signing secrets.
 * A {@code null} or short result means no secret could be produced.
 */
@FunctionalInterface
public interface SecretGenerator {

    byte[] generate(int size);
}
