package me.golemcore.relay.infrastructure.config;

import me.golemcore.relay.adapter.inbound.webhook.WebhookCallbackSender;
import me.golemcore.relay.adapter.inbound.webhook.WebhookClient;
import me.golemcore.relay.adapter.inbound.webhook.WebhookClientRegistry;
import me.golemcore.relay.domain.loop.EventDispatcher;
import me.golemcore.relay.port.inbound.ClientPort;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import java.util.List;
import java.util.stream.Stream;

import static org.mockito.Mockito.*;

class AutoConfigurationTest {

    @Test
    @SuppressWarnings("unchecked")
    void shouldRegisterOnlyEnabledClientsAndRemoveThemOnShutdown() {
        BotProperties properties = new BotProperties();
        BotProperties.ClientProperties twitter = new BotProperties.ClientProperties();
        twitter.setEnabled(true);
        properties.getClients().put("twitter", twitter);
        properties.getClients().put("discord", new BotProperties.ClientProperties());

        WebhookCallbackSender sender = mock(WebhookCallbackSender.class);
        WebhookClient twitterClient = new WebhookClient("twitter", null, null, sender);
        WebhookClient discordClient = new WebhookClient("discord", null, null, sender);
        WebhookClientRegistry registry = mock(WebhookClientRegistry.class);
        when(registry.getClients()).thenReturn(List.of(twitterClient, discordClient));

        ObjectProvider<ClientPort> clientPorts = mock(ObjectProvider.class);
        when(clientPorts.orderedStream()).thenReturn(Stream.empty());
        EventDispatcher dispatcher = mock(EventDispatcher.class);

        AutoConfiguration configuration = new AutoConfiguration(properties, dispatcher, clientPorts, registry);
        configuration.init();

        verify(dispatcher).registerClient(twitterClient);
        verify(dispatcher, never()).registerClient(discordClient);

        configuration.shutdown();

        verify(dispatcher).removeClient("twitter");
        verify(dispatcher, never()).removeClient("discord");
    }
}
