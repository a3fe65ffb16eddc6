package me.golemcore.relay.port.inbound;

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

import me.golemcore.relay.domain.model.OutboundEvent;

import java.util.concurrent.CompletableFuture;

/**
 * Bidirectional port for platform clients (Twitter, Discord, webhook bridges,
 * etc.). A client acquires inbound events on its own schedule and hands them to
 * the sink it was started with; the dispatcher delivers outbound events back
 * through {@link #emit(OutboundEvent)}.
 */
public interface ClientPort {

    /**
     * Returns the unique client id that outbound events are addressed to (e.g.,
     * "twitter").
     */
    String getId();

    /**
     * Returns the client type (e.g., "twitter", "discord", "webhook").
     */
    String getClientType();

    /**
     * Begins acquiring inbound events and forwarding them to the sink. The
     * returned future completes when acquisition has started; it completes
     * exceptionally if the client cannot start.
     */
    CompletableFuture<Void> listen(InboundEventSink sink);

    /**
     * Halts acquisition. Events already handed to the sink run to completion.
     */
    CompletableFuture<Void> stop();

    /**
     * Best-effort delivery of an outbound event to the external platform.
     */
    CompletableFuture<Void> emit(OutboundEvent event);

    /**
     * Checks if the client is currently acquiring events.
     */
    boolean isRunning();
}
