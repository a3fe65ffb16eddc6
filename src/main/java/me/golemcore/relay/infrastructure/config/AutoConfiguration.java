package me.golemcore.relay.infrastructure.config;

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

import me.golemcore.relay.adapter.inbound.webhook.WebhookClientRegistry;
import me.golemcore.relay.domain.loop.EventDispatcher;
import me.golemcore.relay.port.inbound.ClientPort;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Spring configuration that wires shared infrastructure beans and registers
 * clients with the dispatcher on application startup.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the shared {@link Clock} and {@link ObjectMapper}</li>
 * <li>Logs startup information (LLM provider, autonomous loop)</li>
 * <li>Registers every enabled client ({@link ClientPort} beans and configured
 * webhook bridges) with the {@link EventDispatcher}</li>
 * <li>Removes the registered clients on shutdown</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final BotProperties properties;
    private final EventDispatcher dispatcher;
    private final ObjectProvider<ClientPort> clientPorts;
    private final WebhookClientRegistry webhookClientRegistry;

    private final List<String> registeredClientIds = new ArrayList<>();

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        log.info("GolemCore Relay starting...");
        log.info("LLM Provider: {}", properties.getLlm().getProvider());
        log.info("Consciousness: {}", properties.getConsciousness().isEnabled() ? "enabled" : "disabled");

        List<ClientPort> clients = new ArrayList<>(clientPorts.orderedStream().toList());
        clients.addAll(webhookClientRegistry.getClients());

        for (ClientPort client : clients) {
            if (!isClientEnabled(client)) {
                log.debug("Client {} disabled, not registering", client.getId());
                continue;
            }
            log.info("Starting client: {} ({})", client.getId(), client.getClientType());
            dispatcher.registerClient(client);
            registeredClientIds.add(client.getId());
        }

        log.info("GolemCore Relay started with {} client(s)", registeredClientIds.size());
    }

    @PreDestroy
    public void shutdown() {
        for (String clientId : registeredClientIds) {
            dispatcher.removeClient(clientId);
        }
        registeredClientIds.clear();
    }

    private boolean isClientEnabled(ClientPort client) {
        BotProperties.ClientProperties clientProps = properties.getClients().get(client.getId());
        return clientProps != null && clientProps.isEnabled();
    }
}
