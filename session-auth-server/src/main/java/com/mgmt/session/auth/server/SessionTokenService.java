package com.mgmt.session.auth.server;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import javax.crypto.SecretKey;

import com.mgmt.session.auth.server.VerificationResult.Reason;
import com.mgmt.session.auth.server.store.Settings;
import com.mgmt.session.auth.server.store.SettingsStore;
import com.mgmt.session.auth.server.store.UserRecord;
import com.mgmt.session.auth.server.store.UserStore;

import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.SecurityException;
import lombok.extern.slf4j.Slf4j;

/**
 * Issues and verifies signed session tokens.
 *
 * <p>Verification runs in two phases: the unverified {@code scope} claim picks the secret,
 * then signature, algorithm and expiry are checked with that secret. A verified token is
 * still rejected when the user's credentials were invalidated after it was issued.
 */
@Slf4j
public class SessionTokenService {
    static final Duration UNBOUNDED_LIFETIME = Duration.ofDays(365L * 99);

    private final ScopedSecrets secrets;
    private final HmacTokenCodec codec;
    private final SettingsStore settingsStore;
    private final UserStore userStore;
    private final Clock clock;
    private final AtomicReference<Duration> userSessionTimeout;

    SessionTokenService(ScopedSecrets secrets,
                        Duration userSessionTimeout,
                        SettingsStore settingsStore,
                        UserStore userStore,
                        Clock clock) {
        this.secrets = Objects.requireNonNull(secrets, "secrets");
        this.settingsStore = Objects.requireNonNull(settingsStore, "settingsStore");
        this.userStore = Objects.requireNonNull(userStore, "userStore");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.codec = new HmacTokenCodec(clock);
        this.userSessionTimeout = new AtomicReference<>(userSessionTimeout);
    }

    public static SessionTokenService create(String userSessionDuration, SettingsStore settingsStore, UserStore userStore) {
        SessionTokenConfig config = new SessionTokenConfig();
        config.setSessionDuration(userSessionDuration);
        return create(config, settingsStore, userStore);
    }

    /**
     * Parses the session duration and builds the secret table, persisting the kubeconfig
     * secret on first use.
     *
     * @throws IllegalArgumentException if the session duration is not a valid duration or the secret size is below 32 bytes
     * @throws com.mgmt.session.auth.server.key.SecretGenerationException if no secret could be generated
     * @throws com.mgmt.session.auth.server.store.StoreException if settings could not be read or written,
     *         or hold a kubeconfig secret that is too short
     */
    public static SessionTokenService create(SessionTokenConfig config, SettingsStore settingsStore, UserStore userStore) {
        Duration sessionTimeout = SessionDurations.parse(config.getSessionDuration());
        requireValidSessionDuration(sessionTimeout);

        ScopedSecrets secrets = ScopedSecrets.bootstrap(settingsStore, config.getSecretGenerator(), config.getSecretSize());
        log.info("Session token service initialized, user session timeout {}", sessionTimeout);

        return new SessionTokenService(secrets, sessionTimeout, settingsStore, userStore, config.getClock());
    }

    /**
     * Issues a login session token that expires after the current user session timeout.
     */
    public IssuedToken issueToken(TokenData data) {
        return issueToken(data, TokenScope.DEFAULT, defaultExpiresAt());
    }

    /**
     * Issues a token for an exported kubeconfig. Its lifetime comes from
     * {@link Settings#getKubeconfigExpiry()}, where {@code "0"} means it never expires.
     */
    public IssuedToken issueKubeconfigToken(TokenData data) {
        Settings settings = readSettings();

        Duration expiry;
        try {
            expiry = SessionDurations.parse(Optional.ofNullable(settings.getKubeconfigExpiry()).orElse("0"));
        } catch (IllegalArgumentException e) {
            throw new TokenIssuanceException("invalid kubeconfig expiry in settings", e);
        }

        Instant expiresAt = expiry.isZero() ? null : clock.instant().plus(expiry);
        return sign(data, TokenScope.KUBECONFIG, expiresAt, settings);
    }

    /**
     * Issues a token for an explicit scope and expiry.
     *
     * @param expiresAt {@code null} for a token without {@code exp}; it can then only be
     *                  invalidated through the user's token issue time
     */
    public IssuedToken issueToken(TokenData data, TokenScope scope, Instant expiresAt) {
        return sign(data, scope, expiresAt, readSettings());
    }

    /**
     * @throws InvalidTokenException for every kind of rejection
     */
    public TokenData verifyToken(String token) {
        VerificationResult result = verify(token);
        if (result instanceof VerificationResult.Verified verified) {
            return verified.data();
        }

        VerificationResult.Rejected rejected = (VerificationResult.Rejected) result;
        log.debug("Rejected session token: {}", rejected.reason(), rejected.cause());
        throw new InvalidTokenException();
    }

    public void setUserSessionDuration(Duration userSessionDuration) {
        requireValidSessionDuration(userSessionDuration);
        Duration previous = userSessionTimeout.getAndSet(userSessionDuration);
        log.info("User session timeout changed from {} to {}", previous, userSessionDuration);
    }

    public Duration getUserSessionDuration() {
        return userSessionTimeout.get();
    }

    VerificationResult verify(String token) {
        if (token == null || token.isBlank()) {
            return new VerificationResult.Rejected(Reason.MALFORMED, null);
        }

        TokenScope scope = ScopePeeker.peek(token);
        SecretKey secret = secrets.forScope(scope).orElseThrow();

        SessionClaims claims;
        try {
            claims = codec.verify(token, secret);
        } catch (ExpiredJwtException e) {
            return new VerificationResult.Rejected(Reason.EXPIRED, e);
        } catch (SecurityException e) {
            return new VerificationResult.Rejected(Reason.BAD_SIGNATURE, e);
        } catch (UnsupportedJwtException e) {
            return new VerificationResult.Rejected(Reason.UNSUPPORTED_ALGORITHM, e);
        } catch (JwtException | IllegalArgumentException e) {
            return new VerificationResult.Rejected(Reason.MALFORMED, e);
        }

        if (claims.scope() != scope) {
            return new VerificationResult.Rejected(Reason.SCOPE_MISMATCH, null);
        }

        Optional<UserRecord> user;
        try {
            user = userStore.findById(claims.userId());
        } catch (RuntimeException e) {
            return new VerificationResult.Rejected(Reason.USER_LOOKUP_FAILED, e);
        }
        if (user.isEmpty()) {
            return new VerificationResult.Rejected(Reason.UNKNOWN_USER, null);
        }
        if (user.get().tokenIssueAt() > claims.issuedAt().getEpochSecond()) {
            return new VerificationResult.Rejected(Reason.REVOKED, null);
        }

        return new VerificationResult.Verified(new TokenData(
            claims.userId(),
            claims.username(),
            claims.role(),
            token,
            claims.forceChangePassword()
        ));
    }

    private Instant defaultExpiresAt() {
        return clock.instant().plus(userSessionTimeout.get());
    }

    private IssuedToken sign(TokenData data, TokenScope scope, Instant expiresAt, Settings settings) {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(scope, "scope");

        SecretKey secret = secrets.forScope(scope)
            .orElseThrow(() -> new TokenIssuanceException("invalid scope: " + scope));

        Instant now = clock.instant();
        if (settings.isExtensionMode()) {
            log.info("detected extension mode");
            expiresAt = now.plus(UNBOUNDED_LIFETIME);
        }

        // JWT numeric dates carry whole seconds
        Instant issuedAt = now.truncatedTo(ChronoUnit.SECONDS);
        Instant exp = expiresAt == null ? null : expiresAt.truncatedTo(ChronoUnit.SECONDS);

        try {
            String token = codec.sign(SessionClaims.of(data, scope, issuedAt, exp), secret);
            return new IssuedToken(token, exp);
        } catch (JwtException | IllegalArgumentException e) {
            throw new TokenIssuanceException("failed signing token", e);
        }
    }

    private Settings readSettings() {
        try {
            return settingsStore.read();
        } catch (RuntimeException e) {
            throw new TokenIssuanceException("failed fetching settings", e);
        }
    }

    private static void requireValidSessionDuration(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("User session duration must not be negative: " + duration);
        }
    }
}
