package me.golemcore.relay.domain.service;

import me.golemcore.relay.domain.component.IntentActionHandler;
import me.golemcore.relay.domain.model.InboundEvent;
import me.golemcore.relay.domain.model.Intent;
import me.golemcore.relay.domain.model.Room;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class IntentActionExecutorTest {

    private InboundEvent event;
    private Room room;

    @BeforeEach
    void setUp() {
        event = InboundEvent.builder().kind("tweet_received").source("twitter").content("hi").build();
        room = new Room("t1", "twitter", Clock.systemUTC());
    }

    @Test
    void shouldRunHandlersInIntentOrder() {
        IntentActionHandler follow = handler("follow");
        IntentActionHandler like = handler("like");
        IntentActionExecutor executor = new IntentActionExecutor(List.of(follow, like));
        Intent first = Intent.builder().kind("praise").confidence(0.9).action("like").build();
        Intent second = Intent.builder().kind("interest").confidence(0.8).action("follow").build();

        executor.execute(List.of(first, second), event, room).join();

        InOrder order = inOrder(like, follow);
        order.verify(like).execute(first, event, room);
        order.verify(follow).execute(second, event, room);
    }

    @Test
    void shouldSkipIntentsWithoutActionOrHandler() {
        IntentActionHandler like = handler("like");
        IntentActionExecutor executor = new IntentActionExecutor(List.of(like));

        executor.execute(List.of(
                Intent.builder().kind("question").confidence(0.9).build(),
                Intent.builder().kind("praise").confidence(0.9).action("retweet").build()), event, room).join();

        verify(like, never()).execute(any(), any(), any());
    }

    @Test
    void shouldContinueAfterHandlerFailure() {
        IntentActionHandler broken = mock(IntentActionHandler.class);
        when(broken.getActionName()).thenReturn("broken");
        when(broken.execute(any(), any(), any())).thenThrow(new IllegalStateException("boom"));
        IntentActionHandler failing = mock(IntentActionHandler.class);
        when(failing.getActionName()).thenReturn("failing");
        when(failing.execute(any(), any(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("async boom")));
        IntentActionHandler like = handler("like");
        IntentActionExecutor executor = new IntentActionExecutor(List.of(broken, failing, like));

        assertDoesNotThrow(() -> executor.execute(List.of(
                Intent.builder().kind("a").confidence(0.9).action("broken").build(),
                Intent.builder().kind("b").confidence(0.9).action("failing").build(),
                Intent.builder().kind("c").confidence(0.9).action("like").build()), event, room).join());

        verify(like).execute(any(), eq(event), eq(room));
    }

    private static IntentActionHandler handler(String name) {
        IntentActionHandler handler = mock(IntentActionHandler.class);
        when(handler.getActionName()).thenReturn(name);
        when(handler.execute(any(), any(), any())).thenReturn(CompletableFuture.completedFuture(null));
        return handler;
    }
}
