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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.adapter.inbound.webhook.dto.InboundEventRequest;
import me.golemcore.relay.adapter.inbound.webhook.dto.WebhookResponse;
import me.golemcore.relay.domain.model.InboundEvent;
import me.golemcore.relay.domain.service.Failures;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Optional;

/**
 * Inbound HTTP endpoint for webhook clients (WebFlux).
 *
 * <p>
 * {@code POST /api/clients/{clientId}/events} authenticates with the client's
 * token, converts the body into an {@link InboundEvent} and feeds it to the
 * dispatcher through the client. The response is sent after the event has
 * been fully processed.
 */
@RestController
@RequestMapping("/api/clients")
@RequiredArgsConstructor
@Slf4j
public class WebhookController {

    private final WebhookClientRegistry clientRegistry;
    private final WebhookAuthenticator authenticator;
    private final Clock clock;

    @PostMapping("/{clientId}/events")
    public Mono<ResponseEntity<WebhookResponse>> receive(
            @PathVariable String clientId,
            @RequestBody InboundEventRequest request,
            @RequestHeader HttpHeaders headers) {

        return Mono.defer(() -> {
            Optional<WebhookClient> found = clientRegistry.find(clientId);
            if (found.isEmpty()) {
                return Mono.just(ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(WebhookResponse.error("Unknown client: " + clientId)));
            }

            WebhookClient client = found.get();
            if (!authenticator.authenticateBearer(client, headers)) {
                return Mono.just(ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                        .body(WebhookResponse.error("Unauthorized")));
            }

            if (request.getKind() == null || request.getKind().isBlank()) {
                return Mono.just(ResponseEntity.badRequest().body(WebhookResponse.error("'kind' is required")));
            }

            if (!client.isRunning()) {
                return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                        .body(WebhookResponse.error("Client " + clientId + " is not running")));
            }

            InboundEvent event = toEvent(clientId, request);
            log.info("[Webhook] {} received from client {}", event.getKind(), clientId);

            return Mono.fromFuture(() -> client.accept(event))
                    .thenReturn(ResponseEntity.ok(WebhookResponse.processed(clientId, event.getKind())))
                    .onErrorResume(error -> {
                        log.error("[Webhook] Processing of {} from {} failed: {}", event.getKind(), clientId,
                                Failures.describe(error));
                        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                                .body(WebhookResponse.error("Processing failed")));
                    });
        });
    }

    private InboundEvent toEvent(String clientId, InboundEventRequest request) {
        InboundEvent.InboundEventBuilder builder = InboundEvent.builder()
                .kind(request.getKind())
                .source(request.getSource() != null && !request.getSource().isBlank() ? request.getSource()
                        : clientId)
                .content(request.getContent() != null ? request.getContent() : "")
                .timestamp(request.getTimestamp() != null ? request.getTimestamp() : clock.instant())
                .tweetId(request.getTweetId())
                .userId(request.getUserId())
                .username(request.getUsername())
                .channelId(request.getChannelId());
        if (request.getMetadata() != null) {
            builder.metadata(request.getMetadata());
        }
        return builder.build();
    }
}
