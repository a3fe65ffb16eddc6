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

import me.golemcore.relay.domain.model.InboundEvent;

import java.util.concurrent.CompletableFuture;

/**
 * Local subscriber notified after an inbound event of a given kind has been
 * processed. Receives the event merged with the pipeline's enrichment metadata.
 */
@FunctionalInterface
public interface EventHandler {

    CompletableFuture<Void> handle(InboundEvent event);
}
