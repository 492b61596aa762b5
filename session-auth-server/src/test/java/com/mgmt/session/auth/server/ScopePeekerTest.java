package com.mgmt.session.auth.server;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

import io.jsonwebtoken.io.Encoders;

@DisplayName("ScopePeeker")
class ScopePeekerTest {

    private static String tokenWithPayload(String json) {
        return "eyJhbGciOiJIUzI1NiJ9."
            + Encoders.BASE64URL.encode(json.getBytes(StandardCharsets.UTF_8))
            + ".c2lnbmF0dXJl";
    }

    @Test
    @DisplayName("should route a kubeconfig scope claim to KUBECONFIG")
    void shouldDetectKubeconfig() {
        assertEquals(TokenScope.KUBECONFIG, ScopePeeker.peek(tokenWithPayload("{\"id\":1,\"scope\":\"kubeconfig\"}")));
    }

    @Test
    @DisplayName("should route a default scope claim to DEFAULT")
    void shouldDetectDefault() {
        assertEquals(TokenScope.DEFAULT, ScopePeeker.peek(tokenWithPayload("{\"id\":1,\"scope\":\"default\"}")));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "{\"id\":1}",
        "{\"scope\":\"KUBECONFIG\"}",
        "{\"scope\":\"admin\"}",
        "{\"scope\":[\"kubeconfig\"]}",
        "{\"scope\":{\"value\":\"kubeconfig\"}}",
        "[\"kubeconfig\"]",
        "not json"
    })
    @DisplayName("should fall back to DEFAULT for anything but an exact kubeconfig string")
    void shouldFallBackToDefault(String payload) {
        assertEquals(TokenScope.DEFAULT, ScopePeeker.peek(tokenWithPayload(payload)));
    }

    @ParameterizedTest
    @NullSource
    @ValueSource(strings = {"", "abc", "a.b", "a.b.c.d", "a.!!!.c"})
    @DisplayName("should fall back to DEFAULT for malformed tokens")
    void shouldFallBackForMalformedTokens(String token) {
        assertEquals(TokenScope.DEFAULT, ScopePeeker.peek(token));
    }
}
