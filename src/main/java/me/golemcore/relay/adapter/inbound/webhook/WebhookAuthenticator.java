package me.golemcore.relay.adapter.inbound.webhook;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Authenticates inbound client requests against the client's configured token,
 * sent either as {@code Authorization: Bearer <token>} or in the
 * {@code X-Relay-Token} header. Comparison is constant-time.
 */
@Component
@Slf4j
public class WebhookAuthenticator {

    static final String BEARER_PREFIX = "Bearer ";
    static final String CUSTOM_HEADER = "X-Relay-Token";

    public boolean authenticateBearer(WebhookClient client, HttpHeaders headers) {
        String expected = client.getToken();
        if (expected == null || expected.isBlank()) {
            log.warn("[Webhook] No token configured for client {}, rejecting request", client.getId());
            return false;
        }

        String authHeader = headers.getFirst(HttpHeaders.AUTHORIZATION);
        if (authHeader != null && authHeader.startsWith(BEARER_PREFIX)) {
            return constantTimeEquals(expected, authHeader.substring(BEARER_PREFIX.length()));
        }

        String customToken = headers.getFirst(CUSTOM_HEADER);
        if (customToken != null) {
            return constantTimeEquals(expected, customToken);
        }

        log.debug("[Webhook] No authentication token found in request headers");
        return false;
    }

    private boolean constantTimeEquals(String expected, String provided) {
        byte[] expectedBytes = expected.getBytes(StandardCharsets.UTF_8);
        byte[] providedBytes = provided.getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expectedBytes, providedBytes);
    }
}
