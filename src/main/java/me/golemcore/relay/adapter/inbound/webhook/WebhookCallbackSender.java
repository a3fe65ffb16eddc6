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
import me.golemcore.relay.domain.model.OutboundEvent;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * POSTs outbound events to a client's callback URL with {@link WebClient}.
 * Each event is attempted once; failures are reported through the returned
 * future and never retried.
 */
@Component
@Slf4j
public class WebhookCallbackSender {

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private final WebClient webClient;

    public WebhookCallbackSender() {
        this(WebClient.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(256 * 1024))
                .build());
    }

    WebhookCallbackSender(WebClient webClient) {
        this.webClient = webClient;
    }

    /**
     * Posts the event to the given URL.
     *
     * @param callbackUrl
     *            target URL
     * @param token
     *            optional bearer token for the receiving bridge
     * @param event
     *            the outbound event
     * @return a future completing when the receiver acknowledged the event
     */
    public CompletableFuture<Void> send(String callbackUrl, String token, OutboundEvent event) {
        return webClient.post()
                .uri(callbackUrl)
                .headers(headers -> {
                    if (token != null && !token.isBlank()) {
                        headers.set(HttpHeaders.AUTHORIZATION, WebhookAuthenticator.BEARER_PREFIX + token);
                    }
                })
                .bodyValue(event)
                .retrieve()
                .toBodilessEntity()
                .timeout(REQUEST_TIMEOUT)
                .doOnSuccess(response -> log.debug("[Webhook] Delivered {} to {}", event.getKind(), callbackUrl))
                .doOnError(error -> log.error("[Webhook] Callback to {} failed: {}", callbackUrl,
                        error.getMessage()))
                .then()
                .toFuture();
    }
}
