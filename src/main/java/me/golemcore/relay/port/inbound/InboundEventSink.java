package me.golemcore.relay.port.inbound;

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
 * Single entry point for inbound events, whether they come from an external
 * client or are generated by the core itself. The returned future completes
 * once the event has been fully processed, which gives callers back-pressure.
 */
public interface InboundEventSink {

    CompletableFuture<Void> emit(InboundEvent event);
}
