package me.golemcore.relay.domain.loop;

import me.golemcore.relay.domain.model.EnrichedContext;
import me.golemcore.relay.domain.model.InboundEvent;
import me.golemcore.relay.domain.model.Intent;
import me.golemcore.relay.domain.model.Memory;
import me.golemcore.relay.domain.model.OutboundEvent;
import me.golemcore.relay.domain.model.ProcessingResult;
import me.golemcore.relay.domain.model.RecencyBucket;
import me.golemcore.relay.domain.model.Room;
import me.golemcore.relay.domain.service.EventProcessor;
import me.golemcore.relay.domain.service.IntentActionExecutor;
import me.golemcore.relay.domain.service.RoomManager;
import me.golemcore.relay.port.inbound.ClientPort;
import me.golemcore.relay.port.outbound.SimilarityIndexPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class EventDispatcherTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private RoomManager roomManager;
    private EventProcessor eventProcessor;
    private IntentActionExecutor intentActionExecutor;
    private EventDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        roomManager = new RoomManager((SimilarityIndexPort) null, Clock.fixed(NOW, ZoneOffset.UTC));
        eventProcessor = mock(EventProcessor.class);
        intentActionExecutor = new IntentActionExecutor(List.of());
        dispatcher = new EventDispatcher(roomManager, eventProcessor, intentActionExecutor);

        when(eventProcessor.process(any(), any())).thenReturn(CompletableFuture.completedFuture(result(List.of())));
    }

    @Test
    void shouldCreateRoomOnceAndReuseIt() {
        dispatcher.emit(tweet("hello", "alice")).join();
        dispatcher.emit(tweet("again", "bob")).join();

        List<Room> rooms = roomManager.getRoomsByPlatform("twitter");
        assertEquals(1, rooms.size());

        Room room = rooms.get(0);
        assertEquals("t1", room.getPlatformId());
        assertEquals("Twitter Thread by alice", room.getName());
        assertEquals(Set.of("alice", "bob", "twitter"), room.getParticipants());
        assertEquals(List.of("hello", "again"), room.getMemories().stream().map(Memory::getContent).toList());
    }

    @Test
    void shouldStoreEventTypeAndSourceInMemoryMetadata() {
        InboundEvent event = tweet("hello", "alice").toBuilder().metadataEntry("lang", "en").build();

        dispatcher.emit(event).join();

        Memory memory = roomManager.getRoomsByPlatform("twitter").get(0).getMemories().get(0);
        assertEquals("tweet_received", memory.getMetadata().get("eventType"));
        assertEquals("twitter", memory.getMetadata().get("source"));
        assertEquals("en", memory.getMetadata().get("lang"));
    }

    @Test
    void shouldCreateSingleRoomForConcurrentFirstEvents() throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<CompletableFuture<Void>> emits = Collections.synchronizedList(new ArrayList<>());
        for (int i = 0; i < 16; i++) {
            executor.submit(() -> {
                start.await();
                emits.add(dispatcher.emit(tweet("hello", "alice")));
                return null;
            });
        }
        start.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        CompletableFuture.allOf(emits.toArray(CompletableFuture[]::new)).join();

        assertEquals(1, roomManager.getRoomsByPlatform("twitter").size());
        assertEquals(16, roomManager.getRoomsByPlatform("twitter").get(0).getMemoryCount());
    }

    @Test
    void shouldRouteSuggestedActionToTargetClient() {
        ClientPort twitter = client("twitter");
        dispatcher.registerClient(twitter);
        OutboundEvent action = OutboundEvent.builder().kind("tweet_request").target("twitter").content("hi").build();
        when(eventProcessor.process(any(), any()))
                .thenReturn(CompletableFuture.completedFuture(result(List.of(action))));

        dispatcher.emit(tweet("hello", "alice")).join();

        verify(twitter).emit(action);
    }

    @Test
    void shouldDropActionForUnknownClientWithoutThrowing() {
        ClientPort twitter = client("twitter");
        dispatcher.registerClient(twitter);
        OutboundEvent action = OutboundEvent.builder().kind("discord_message").target("discord").build();
        when(eventProcessor.process(any(), any()))
                .thenReturn(CompletableFuture.completedFuture(result(List.of(action))));

        assertDoesNotThrow(() -> dispatcher.emit(tweet("hello", "alice")).join());

        verify(twitter, never()).emit(any());
    }

    @Test
    void shouldContinueRoutingWhenOneDeliveryFails() {
        ClientPort twitter = client("twitter");
        ClientPort discord = client("discord");
        when(twitter.emit(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));
        dispatcher.registerClient(twitter);
        dispatcher.registerClient(discord);
        OutboundEvent first = OutboundEvent.builder().kind("tweet_request").target("twitter").build();
        OutboundEvent second = OutboundEvent.builder().kind("discord_message").target("discord").build();
        when(eventProcessor.process(any(), any()))
                .thenReturn(CompletableFuture.completedFuture(result(List.of(first, second))));

        dispatcher.emit(tweet("hello", "alice")).join();

        verify(discord).emit(second);
    }

    @Test
    void shouldNotifyHandlersWithEnrichedEvent() {
        List<InboundEvent> received = Collections.synchronizedList(new ArrayList<>());
        EventHandler first = event -> {
            received.add(event);
            return CompletableFuture.completedFuture(null);
        };
        EventHandler failing = event -> CompletableFuture.failedFuture(new IllegalStateException("boom"));
        dispatcher.on("tweet_received", first);
        dispatcher.on("tweet_received", first);
        dispatcher.on("tweet_received", failing);
        dispatcher.on("dm_received", first);

        dispatcher.emit(tweet("hello", "alice")).join();

        assertEquals(1, received.size());
        assertEquals("hello summary", received.get(0).getMetadata().get("summary"));
        assertEquals("very_recent", received.get(0).getMetadata().get("timeContext"));
    }

    @Test
    void shouldStopNotifyingAfterOff() {
        List<InboundEvent> received = new ArrayList<>();
        EventHandler handler = event -> {
            received.add(event);
            return CompletableFuture.completedFuture(null);
        };
        dispatcher.on("tweet_received", handler);
        dispatcher.off("tweet_received", handler);

        dispatcher.emit(tweet("hello", "alice")).join();

        assertTrue(received.isEmpty());
    }

    @Test
    void shouldKeepClientRegisteredWhenListenFails() {
        ClientPort twitter = client("twitter");
        when(twitter.listen(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("auth")));

        dispatcher.registerClient(twitter);

        assertTrue(dispatcher.getClient("twitter").isPresent());
        verify(twitter).listen(dispatcher);
    }

    @Test
    void shouldStopAndUnregisterClient() {
        ClientPort twitter = client("twitter");
        when(twitter.stop()).thenThrow(new IllegalStateException("stuck"));
        dispatcher.registerClient(twitter);

        assertDoesNotThrow(() -> dispatcher.removeClient("twitter"));

        assertEquals(Set.of(), dispatcher.getClientIds());
        assertDoesNotThrow(() -> dispatcher.removeClient("missing"));
    }

    @Test
    void shouldSkipIntentActionsWithoutHandler() {
        Intent intent = Intent.builder().kind("greeting").confidence(0.9).action("wave").build();
        ProcessingResult withIntent = ProcessingResult.builder()
                .intents(List.of(intent))
                .enrichedContext(context())
                .build();
        when(eventProcessor.process(any(), any())).thenReturn(CompletableFuture.completedFuture(withIntent));

        assertDoesNotThrow(() -> dispatcher.emit(tweet("hello", "alice")).join());
    }

    @Test
    void shouldPassResolvedRoomToProcessor() {
        dispatcher.emit(tweet("hello", "alice")).join();

        ArgumentCaptor<Room> captor = ArgumentCaptor.forClass(Room.class);
        verify(eventProcessor).process(any(InboundEvent.class), captor.capture());
        assertEquals("twitter", captor.getValue().getPlatform());
        assertEquals(1, captor.getValue().getMemoryCount());
    }

    private static InboundEvent tweet(String content, String username) {
        return InboundEvent.builder()
                .kind("tweet_received")
                .source("twitter")
                .content(content)
                .timestamp(NOW)
                .tweetId("t1")
                .userId("u-" + username)
                .username(username)
                .build();
    }

    private static ClientPort client(String id) {
        ClientPort client = mock(ClientPort.class);
        when(client.getId()).thenReturn(id);
        when(client.getClientType()).thenReturn("mock");
        when(client.listen(any())).thenReturn(CompletableFuture.completedFuture(null));
        when(client.stop()).thenReturn(CompletableFuture.completedFuture(null));
        when(client.emit(any())).thenReturn(CompletableFuture.completedFuture(null));
        return client;
    }

    private static ProcessingResult result(List<OutboundEvent> actions) {
        return ProcessingResult.builder()
                .suggestedActions(actions)
                .enrichedContext(context())
                .build();
    }

    private static EnrichedContext context() {
        return EnrichedContext.builder()
                .timeContext(RecencyBucket.VERY_RECENT)
                .summary("hello summary")
                .build();
    }
}
