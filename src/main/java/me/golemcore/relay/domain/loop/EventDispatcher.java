package me.golemcore.relay.domain.loop;

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
import me.golemcore.relay.domain.model.EventAttributes;
import me.golemcore.relay.domain.model.InboundEvent;
import me.golemcore.relay.domain.model.OutboundEvent;
import me.golemcore.relay.domain.model.ProcessingResult;
import me.golemcore.relay.domain.model.Room;
import me.golemcore.relay.domain.model.RoomIdentity;
import me.golemcore.relay.domain.service.EventProcessor;
import me.golemcore.relay.domain.service.Failures;
import me.golemcore.relay.domain.service.IntentActionExecutor;
import me.golemcore.relay.domain.service.RoomManager;
import me.golemcore.relay.port.inbound.ClientPort;
import me.golemcore.relay.port.inbound.InboundEventSink;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central event loop: owns client registration, routes every inbound event
 * through room resolution, memory, the enrichment pipeline and action routing,
 * then notifies local handlers.
 *
 * <p>
 * Processing order for one {@link #emit(InboundEvent)} call:
 * <ol>
 * <li>Resolve or create the owning {@link Room}</li>
 * <li>Append the event content as a memory</li>
 * <li>Run the {@link EventProcessor}</li>
 * <li>Execute immediate intent actions (best-effort)</li>
 * <li>Route suggested outbound events to their clients, at most once</li>
 * <li>Notify handlers registered for the event kind, concurrently</li>
 * </ol>
 *
 * <p>
 * The returned future completes only after the last step, so callers that
 * await it get back-pressure. Concurrent {@code emit} calls for the same
 * platform identity share one room: creation is serialized per
 * {@link RoomIdentity}.
 */
@Service
@Slf4j
public class EventDispatcher implements InboundEventSink {

    private final RoomManager roomManager;
    private final EventProcessor eventProcessor;
    private final IntentActionExecutor intentActionExecutor;

    private final Map<String, ClientPort> clients = new ConcurrentHashMap<>();
    private final Map<String, Set<EventHandler>> handlers = new ConcurrentHashMap<>();
    private final Map<RoomIdentity, Object> roomCreationLocks = new ConcurrentHashMap<>();

    public EventDispatcher(RoomManager roomManager, EventProcessor eventProcessor,
            IntentActionExecutor intentActionExecutor) {
        this.roomManager = roomManager;
        this.eventProcessor = eventProcessor;
        this.intentActionExecutor = intentActionExecutor;
    }

    /**
     * Stores the client under its id and starts its acquisition loop. A failing
     * loop is logged; the client stays registered as a delivery target.
     */
    public void registerClient(ClientPort client) {
        ClientPort previous = clients.put(client.getId(), client);
        if (previous != null && previous != client) {
            log.warn("[Dispatcher] Client {} replaced", client.getId());
        }

        CompletableFuture<Void> listening;
        try {
            listening = client.listen(this);
        } catch (RuntimeException e) {
            listening = CompletableFuture.failedFuture(e);
        }
        listening.exceptionally(error -> {
            log.error("[Dispatcher] Client {} listen loop failed: {}", client.getId(), Failures.describe(error));
            return null;
        });
        log.info("[Dispatcher] Registered client {} ({})", client.getId(), client.getClientType());
    }

    /**
     * Unregisters and stops a client. Stop failures are logged.
     */
    public void removeClient(String clientId) {
        ClientPort client = clients.remove(clientId);
        if (client == null) {
            log.debug("[Dispatcher] Client {} not registered", clientId);
            return;
        }

        CompletableFuture<Void> stopping;
        try {
            stopping = client.stop();
        } catch (RuntimeException e) {
            stopping = CompletableFuture.failedFuture(e);
        }
        stopping.exceptionally(error -> {
            log.error("[Dispatcher] Failed to stop client {}: {}", clientId, Failures.describe(error));
            return null;
        });
        log.info("[Dispatcher] Removed client {}", clientId);
    }

    public Optional<ClientPort> getClient(String clientId) {
        return Optional.ofNullable(clients.get(clientId));
    }

    public Set<String> getClientIds() {
        return Set.copyOf(clients.keySet());
    }

    /**
     * Subscribes a handler to an event kind. Registering the same handler twice
     * has no effect.
     */
    public void on(String kind, EventHandler handler) {
        handlers.computeIfAbsent(kind, key -> ConcurrentHashMap.newKeySet()).add(handler);
    }

    public void off(String kind, EventHandler handler) {
        Set<EventHandler> kindHandlers = handlers.get(kind);
        if (kindHandlers != null) {
            kindHandlers.remove(handler);
        }
    }

    @Override
    public CompletableFuture<Void> emit(InboundEvent event) {
        log.debug("[Dispatcher] Event {} from {}", event.getKind(), event.getSource());

        Room room = resolveRoom(event);
        return roomManager.addMemory(room.getId(), event.getContent(), memoryMetadata(event))
                .thenCompose(memory -> eventProcessor.process(event, room))
                .thenCompose(result -> intentActionExecutor.execute(result.getIntents(), event, room)
                        .thenCompose(ignored -> routeActions(result.getSuggestedActions()))
                        .thenCompose(ignored -> notifyHandlers(event, result)));
    }

    Room resolveRoom(InboundEvent event) {
        RoomIdentity identity = RoomIdentityResolver.resolve(event);
        Object lock = roomCreationLocks.computeIfAbsent(identity, key -> new Object());

        synchronized (lock) {
            Optional<Room> existing = roomManager.getRoomByPlatformId(identity.platformId(), identity.platform());
            if (existing.isPresent()) {
                Room room = existing.get();
                room.addParticipants(RoomIdentityResolver.participants(event));
                room.touch();
                return room;
            }

            return roomManager.createRoom(identity.platformId(), identity.platform(),
                    new Room.RoomMetadataUpdate(
                            RoomIdentityResolver.roomName(event),
                            null,
                            RoomIdentityResolver.participants(event),
                            null));
        }
    }

    private CompletableFuture<Void> routeActions(List<OutboundEvent> actions) {
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (OutboundEvent action : actions) {
            chain = chain.thenCompose(ignored -> route(action));
        }
        return chain;
    }

    private CompletableFuture<Void> route(OutboundEvent action) {
        ClientPort client = action.getTarget() != null ? clients.get(action.getTarget()) : null;
        if (client == null) {
            log.warn("[Dispatcher] No client '{}' for {}, dropping", action.getTarget(), action.getKind());
            return CompletableFuture.completedFuture(null);
        }

        CompletableFuture<Void> delivery;
        try {
            delivery = client.emit(action);
        } catch (RuntimeException e) {
            delivery = CompletableFuture.failedFuture(e);
        }
        return delivery.handle((ignored, error) -> {
            if (error != null) {
                log.error("[Dispatcher] Delivery of {} to {} failed: {}", action.getKind(), client.getId(),
                        Failures.describe(error));
            } else {
                log.debug("[Dispatcher] Routed {} to {}", action.getKind(), client.getId());
            }
            return null;
        });
    }

    private CompletableFuture<Void> notifyHandlers(InboundEvent event, ProcessingResult result) {
        Set<EventHandler> kindHandlers = handlers.get(event.getKind());
        if (kindHandlers == null || kindHandlers.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }

        InboundEvent enriched = result.getEnrichedContext() != null
                ? event.withMetadata(result.getEnrichedContext().toMetadata())
                : event;

        CompletableFuture<?>[] invocations = List.copyOf(kindHandlers).stream()
                .map(handler -> invoke(handler, enriched))
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(invocations);
    }

    private CompletableFuture<Void> invoke(EventHandler handler, InboundEvent event) {
        CompletableFuture<Void> invocation;
        try {
            invocation = handler.handle(event);
        } catch (RuntimeException e) {
            invocation = CompletableFuture.failedFuture(e);
        }
        return invocation.exceptionally(error -> {
            log.error("[Dispatcher] Handler for {} failed: {}", event.getKind(), Failures.describe(error));
            return null;
        });
    }

    private static Map<String, Object> memoryMetadata(InboundEvent event) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(EventAttributes.EVENT_TYPE, event.getKind());
        metadata.put(EventAttributes.SOURCE, event.getSource());
        metadata.putAll(event.getMetadata());
        return metadata;
    }
}
