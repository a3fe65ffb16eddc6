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
import me.golemcore.relay.infrastructure.config.BotProperties;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Builds one {@link WebhookClient} per {@code bot.clients.<id>} entry of type
 * {@code webhook}. Registration with the dispatcher happens at startup and
 * only for enabled entries.
 */
@Component
@Slf4j
public class WebhookClientRegistry {

    private final Map<String, WebhookClient> clients = new LinkedHashMap<>();

    public WebhookClientRegistry(BotProperties properties, WebhookCallbackSender callbackSender) {
        properties.getClients().forEach((clientId, config) -> {
            if (!WebhookClient.CLIENT_TYPE.equals(config.getType())) {
                log.debug("[Clients] Client {} has type {}, not a webhook", clientId, config.getType());
                return;
            }
            clients.put(clientId, new WebhookClient(clientId, config.getCallbackUrl(), config.getToken(),
                    callbackSender));
        });
    }

    public Collection<WebhookClient> getClients() {
        return Collections.unmodifiableCollection(clients.values());
    }

    public Optional<WebhookClient> find(String clientId) {
        return Optional.ofNullable(clients.get(clientId));
    }
}
