package com.mgmt.session.auth.server.key;

import java.security.SecureRandom;
import java.util.Objects;

/**
 * {@link SecretGenerator} backed by {@link SecureRandom}.
 */
public final class RandomSecretGenerator implements SecretGenerator {
    private final SecureRandom random;

    public RandomSecretGenerator() {
        this(new SecureRandom());
    }

    public RandomSecretGenerator(SecureRandom random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public byte[] generate(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Secret size must be positive: " + size);
        }
        byte[] secret = new byte[size];
        random.nextBytes(secret);
        return secret;
    }
}
