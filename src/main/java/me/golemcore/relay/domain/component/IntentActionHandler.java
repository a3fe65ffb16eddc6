package me.golemcore.relay.domain.component;

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

import me.golemcore.relay.domain.model.InboundEvent;
import me.golemcore.relay.domain.model.Intent;
import me.golemcore.relay.domain.model.Room;

import java.util.concurrent.CompletableFuture;

/**
 * Core-local side effect bound to an immediate intent action. Implementations
 * are discovered as Spring beans and keyed by {@link #getActionName()}.
 */
public interface IntentActionHandler {

    /**
     * Action name as reported in {@link Intent#getAction()}.
     */
    String getActionName();

    /**
     * Executes the action for one intent.
     *
     * @param intent
     *            the intent carrying the action and its parameters
     * @param event
     *            the inbound event the intent was extracted from
     * @param room
     *            the room owning the event
     * @return a future completing when the side effect is done
     */
    CompletableFuture<Void> execute(Intent intent, InboundEvent event, Room room);
}
