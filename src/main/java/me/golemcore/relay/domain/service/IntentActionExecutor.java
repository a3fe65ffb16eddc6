package me.golemcore.relay.domain.service;

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
import me.golemcore.relay.domain.component.IntentActionHandler;
import me.golemcore.relay.domain.model.InboundEvent;
import me.golemcore.relay.domain.model.Intent;
import me.golemcore.relay.domain.model.Room;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs the immediate actions attached to extracted intents. Execution is
 * sequential and best-effort: a failing action is logged and the remaining
 * intents still run.
 */
@Service
@Slf4j
public class IntentActionExecutor {

    private final Map<String, IntentActionHandler> handlers = new LinkedHashMap<>();

    @Autowired
    public IntentActionExecutor(ObjectProvider<IntentActionHandler> handlers) {
        this(handlers.orderedStream().toList());
    }

    public IntentActionExecutor(List<IntentActionHandler> handlers) {
        for (IntentActionHandler handler : handlers) {
            IntentActionHandler previous = this.handlers.put(handler.getActionName(), handler);
            if (previous != null) {
                log.warn("[Intent] Handler for action '{}' replaced by {}", handler.getActionName(),
                        handler.getClass().getSimpleName());
            }
        }
    }

    public CompletableFuture<Void> execute(List<Intent> intents, InboundEvent event, Room room) {
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (Intent intent : intents) {
            if (!intent.hasAction()) {
                continue;
            }
            chain = chain.thenCompose(ignored -> executeOne(intent, event, room));
        }
        return chain;
    }

    private CompletableFuture<Void> executeOne(Intent intent, InboundEvent event, Room room) {
        IntentActionHandler handler = handlers.get(intent.getAction());
        if (handler == null) {
            log.debug("[Intent] No handler for action '{}' (intent {}), skipping", intent.getAction(),
                    intent.getKind());
            return CompletableFuture.completedFuture(null);
        }

        CompletableFuture<Void> result;
        try {
            result = handler.execute(intent, event, room);
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }
        return result.exceptionally(error -> {
            log.error("[Intent] Action '{}' for intent {} failed: {}", intent.getAction(), intent.getKind(),
                    Failures.describe(error));
            return null;
        });
    }
}
