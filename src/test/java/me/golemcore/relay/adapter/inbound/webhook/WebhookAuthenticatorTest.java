package me.golemcore.relay.adapter.inbound.webhook;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class WebhookAuthenticatorTest {

    private static final String SECRET = "test-secret-token";

    private WebhookAuthenticator authenticator;
    private WebhookClient client;

    @BeforeEach
    void setUp() {
        authenticator = new WebhookAuthenticator();
        client = new WebhookClient("twitter", null, SECRET, mock(WebhookCallbackSender.class));
    }

    // ==================== Bearer token ====================

    @Test
    void shouldAcceptValidBearerToken() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "Bearer " + SECRET);

        assertTrue(authenticator.authenticateBearer(client, headers));
    }

    @Test
    void shouldRejectInvalidBearerToken() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "Bearer wrong-token");

        assertFalse(authenticator.authenticateBearer(client, headers));
    }

    @Test
    void shouldRejectMissingAuthorizationHeader() {
        assertFalse(authenticator.authenticateBearer(client, new HttpHeaders()));
    }

    @Test
    void shouldRejectNonBearerScheme() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "Basic " + SECRET);

        assertFalse(authenticator.authenticateBearer(client, headers));
    }

    // ==================== Custom header ====================

    @Test
    void shouldAcceptCustomTokenHeader() {
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-Relay-Token", SECRET);

        assertTrue(authenticator.authenticateBearer(client, headers));
    }

    @Test
    void shouldRejectWrongCustomTokenHeader() {
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-Relay-Token", "nope");

        assertFalse(authenticator.authenticateBearer(client, headers));
    }

    // ==================== Unconfigured ====================

    @Test
    void shouldRejectWhenClientHasNoToken() {
        WebhookClient open = new WebhookClient("discord", null, null, mock(WebhookCallbackSender.class));
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "Bearer anything");

        assertFalse(authenticator.authenticateBearer(open, headers));
    }
}
