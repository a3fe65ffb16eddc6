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
import me.golemcore.relay.domain.model.InboundEvent;
import me.golemcore.relay.domain.model.OutboundEvent;
import me.golemcore.relay.port.inbound.ClientPort;
import me.golemcore.relay.port.inbound.InboundEventSink;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Push-based client bridging an external platform over HTTP. Inbound events
 * arrive through {@link WebhookController}; outbound events are POSTed to the
 * configured callback URL.
 *
 * <p>
 * {@link #listen(InboundEventSink)} attaches the sink and returns immediately;
 * there is no polling loop. After {@link #stop()} inbound events are rejected.
 */
@Slf4j
public class WebhookClient implements ClientPort {

    static final String CLIENT_TYPE = "webhook";

    private final String id;
    private final String callbackUrl;
    private final String token;
    private final WebhookCallbackSender callbackSender;
    private final AtomicReference<InboundEventSink> sink = new AtomicReference<>();

    public WebhookClient(String id, String callbackUrl, String token, WebhookCallbackSender callbackSender) {
        this.id = id;
        this.callbackUrl = callbackUrl;
        this.token = token;
        this.callbackSender = callbackSender;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getClientType() {
        return CLIENT_TYPE;
    }

    String getToken() {
        return token;
    }

    @Override
    public CompletableFuture<Void> listen(InboundEventSink eventSink) {
        sink.set(eventSink);
        log.info("[Clients] Webhook client {} listening", id);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> stop() {
        sink.set(null);
        log.info("[Clients] Webhook client {} stopped", id);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public boolean isRunning() {
        return sink.get() != null;
    }

    /**
     * Forwards an inbound event to the dispatcher. The future completes when the
     * event has been fully processed.
     */
    public CompletableFuture<Void> accept(InboundEvent event) {
        InboundEventSink current = sink.get();
        if (current == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("Client " + id + " is not running"));
        }
        return current.emit(event);
    }

    @Override
    public CompletableFuture<Void> emit(OutboundEvent event) {
        if (callbackUrl == null || callbackUrl.isBlank()) {
            log.warn("[Clients] Webhook client {} has no callback URL, dropping {}", id, event.getKind());
            return CompletableFuture.completedFuture(null);
        }
        return callbackSender.send(callbackUrl, token, event);
    }
}
