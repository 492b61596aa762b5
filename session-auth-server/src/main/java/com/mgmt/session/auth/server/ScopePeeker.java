package com.mgmt.session.auth.server;

import java.io.IOException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.jsonwebtoken.io.Decoders;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads the {@code scope} claim of a token WITHOUT verifying it, so the verifier knows
 * which secret to check the signature against.
 *
 * <p>The result only routes to a secret. It can be one of the {@link TokenScope} constants and
 * nothing else, and the signature check that follows covers the same payload, so a forged
 * scope only selects a secret the forger does not hold.
 */
@Slf4j
final class ScopePeeker {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ScopePeeker() {}

    /**
     * @return {@link TokenScope#KUBECONFIG} if the payload says so, {@link TokenScope#DEFAULT} otherwise,
     * including for anything that does not parse
     */
    static TokenScope peek(String token) {
        if (token == null) {
            return TokenScope.DEFAULT;
        }

        String[] segments = token.split("\\.", -1);
        if (segments.length != 3) {
            return TokenScope.DEFAULT;
        }

        try {
            JsonNode payload = MAPPER.readTree(Decoders.BASE64URL.decode(segments[1]));
            JsonNode scope = payload == null ? null : payload.get(SessionClaims.SCOPE);
            if (scope != null && scope.isTextual()
                && TokenScope.KUBECONFIG.claimValue().equals(scope.textValue())) {
                return TokenScope.KUBECONFIG;
            }
        } catch (IOException | RuntimeException e) {
            log.trace("Unreadable token payload, routing to default scope: {}", e.getMessage());
        }

        return TokenScope.DEFAULT;
    }
}
