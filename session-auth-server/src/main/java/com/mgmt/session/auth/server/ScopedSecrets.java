package com.mgmt.session.auth.server;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import javax.crypto.SecretKey;

import com.mgmt.session.auth.server.key.SecretGenerationException;
import com.mgmt.session.auth.server.key.SecretGenerator;
import com.mgmt.session.auth.server.store.Settings;
import com.mgmt.session.auth.server.store.SettingsStore;
import com.mgmt.session.auth.server.store.StoreException;

import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;

/**
 * One HMAC secret per {@link TokenScope}, fixed for the lifetime of the owning service.
 */
@Slf4j
final class ScopedSecrets {
    static final int DEFAULT_SECRET_SIZE = 32;

    private final Map<TokenScope, SecretKey> secrets;

    private ScopedSecrets(EnumMap<TokenScope, SecretKey> secrets) {
        this.secrets = Collections.unmodifiableMap(secrets);
    }

    /**
     * Builds the secret table. Ephemeral scopes get a fresh secret; durable scopes reuse
     * the persisted secret or create and persist one on first start.
     */
    static ScopedSecrets bootstrap(SettingsStore settingsStore, SecretGenerator generator, int secretSize) {
        if (secretSize < DEFAULT_SECRET_SIZE) {
            throw new IllegalArgumentException(
                "Secret size must be at least " + DEFAULT_SECRET_SIZE + " bytes: " + secretSize);
        }

        EnumMap<TokenScope, SecretKey> secrets = new EnumMap<>(TokenScope.class);
        for (TokenScope scope : TokenScope.values()) {
            byte[] raw = scope.isDurable()
                ? getOrCreateKubeSecret(settingsStore, generator, secretSize)
                : newSecret(generator, secretSize);
            secrets.put(scope, Keys.hmacShaKeyFor(raw));
        }
        return new ScopedSecrets(secrets);
    }

    Optional<SecretKey> forScope(TokenScope scope) {
        return Optional.ofNullable(secrets.get(scope));
    }

    private static byte[] getOrCreateKubeSecret(SettingsStore settingsStore, SecretGenerator generator, int secretSize) {
        Settings settings = settingsStore.read();

        byte[] kubeSecret = settings.getKubeSecretKey();
        if (kubeSecret != null) {
            if (kubeSecret.length < DEFAULT_SECRET_SIZE) {
                throw new StoreException("Stored kubeconfig secret is " + kubeSecret.length
                    + " bytes, expected at least " + DEFAULT_SECRET_SIZE);
            }
            return kubeSecret;
        }

        kubeSecret = newSecret(generator, secretSize);
        settings.setKubeSecretKey(kubeSecret);
        settingsStore.write(settings);
        log.info("Generated and stored a new kubeconfig signing secret");

        return kubeSecret;
    }

    private static byte[] newSecret(SecretGenerator generator, int secretSize) {
        byte[] secret = generator.generate(secretSize);
        if (secret == null || secret.length < secretSize) {
            throw new SecretGenerationException("Unable to generate secret key");
        }
        return secret;
    }
}
