package com.mgmt.session.auth.server;

import java.time.Clock;
import java.util.Date;
import java.util.Objects;

import javax.crypto.SecretKey;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.UnsupportedJwtException;

/**
 * HS256 compact JWS encoding of {@link SessionClaims} using JJWT.
 */
final class HmacTokenCodec {
    static final String ALGORITHM = Jwts.SIG.HS256.getId();

    private final Clock clock;

    HmacTokenCodec(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    String sign(SessionClaims claims, SecretKey secret) {
        JwtBuilder builder = Jwts.builder()
            .claim(SessionClaims.ID, claims.userId())
            .claim(SessionClaims.USERNAME, claims.username())
            .claim(SessionClaims.ROLE, claims.role())
            .claim(SessionClaims.SCOPE, claims.scope().claimValue())
            .claim(SessionClaims.FORCE_CHANGE_PASSWORD, claims.forceChangePassword())
            .issuedAt(Date.from(claims.issuedAt()));

        if (claims.expiresAt() != null) {
            builder.expiration(Date.from(claims.expiresAt()));
        }

        return builder
            .signWith(secret, Jwts.SIG.HS256)
            .compact();
    }

    /**
     * Checks algorithm, signature and expiry, then maps the payload back to claims.
     *
     * @throws io.jsonwebtoken.JwtException if any check fails
     */
    SessionClaims verify(String token, SecretKey secret) {
        Claims payload = Jwts.parser()
            .keyLocator(header -> {
                if (!ALGORITHM.equals(header.getAlgorithm())) {
                    throw new UnsupportedJwtException("unexpected signing method: " + header.getAlgorithm());
                }
                return secret;
            })
            .clock(() -> Date.from(clock.instant()))
            .build()
            .parseSignedClaims(token)
            .getPayload();

        Integer userId = payload.get(SessionClaims.ID, Integer.class);
        Date issuedAt = payload.getIssuedAt();
        if (userId == null || issuedAt == null) {
            throw new MalformedJwtException("token is missing id or iat");
        }

        String scopeClaim = payload.get(SessionClaims.SCOPE, String.class);
        TokenScope scope = scopeClaim == null
            ? TokenScope.DEFAULT
            : TokenScope.fromClaim(scopeClaim)
                .orElseThrow(() -> new MalformedJwtException("unknown scope: " + scopeClaim));

        Integer role = payload.get(SessionClaims.ROLE, Integer.class);
        Boolean forceChangePassword = payload.get(SessionClaims.FORCE_CHANGE_PASSWORD, Boolean.class);
        Date expiration = payload.getExpiration();

        return new SessionClaims(
            userId,
            payload.get(SessionClaims.USERNAME, String.class),
            role == null ? 0 : role,
            scope,
            Boolean.TRUE.equals(forceChangePassword),
            issuedAt.toInstant(),
            expiration == null ? null : expiration.toInstant()
        );
    }
}
