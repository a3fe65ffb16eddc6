package me.golemcore.relay.adapter.inbound.webhook;

import me.golemcore.relay.domain.model.InboundEvent;
import me.golemcore.relay.domain.model.OutboundEvent;
import me.golemcore.relay.port.inbound.InboundEventSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class WebhookClientTest {

    private WebhookCallbackSender sender;
    private InboundEventSink sink;

    @BeforeEach
    void setUp() {
        sender = mock(WebhookCallbackSender.class);
        sink = mock(InboundEventSink.class);
        when(sink.emit(any())).thenReturn(CompletableFuture.completedFuture(null));
    }

    @Test
    void shouldForwardInboundEventsWhileListening() {
        WebhookClient client = new WebhookClient("twitter", "http://bridge/out", "t", sender);
        InboundEvent event = InboundEvent.builder().kind("tweet_received").source("twitter").build();

        assertFalse(client.isRunning());
        client.listen(sink).join();
        assertTrue(client.isRunning());

        client.accept(event).join();

        verify(sink).emit(event);
    }

    @Test
    void shouldRejectInboundEventsAfterStop() {
        WebhookClient client = new WebhookClient("twitter", "http://bridge/out", "t", sender);
        client.listen(sink).join();
        client.stop().join();

        CompletionException error = assertThrows(CompletionException.class,
                () -> client.accept(InboundEvent.builder().kind("tweet_received").build()).join());

        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertFalse(client.isRunning());
        verify(sink, never()).emit(any());
    }

    @Test
    void shouldSendOutboundEventsToCallback() {
        WebhookClient client = new WebhookClient("discord", "http://bridge/out", "t", sender);
        OutboundEvent event = OutboundEvent.builder().kind("discord_message").target("discord").build();
        when(sender.send("http://bridge/out", "t", event)).thenReturn(CompletableFuture.completedFuture(null));

        client.emit(event).join();

        verify(sender).send("http://bridge/out", "t", event);
    }

    @Test
    void shouldDropOutboundEventsWithoutCallback() {
        WebhookClient client = new WebhookClient("discord", " ", "t", sender);

        client.emit(OutboundEvent.builder().kind("discord_message").build()).join();

        verifyNoInteractions(sender);
    }

    @Test
    void shouldReportIdentity() {
        WebhookClient client = new WebhookClient("discord", null, null, sender);

        assertEquals("discord", client.getId());
        assertEquals("webhook", client.getClientType());
    }
}
