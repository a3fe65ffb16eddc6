package me.golemcore.relay.domain.model;

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

/**
 * Well-known metadata keys written by the core onto memories and events.
 */
public final class EventAttributes {

    public static final String EVENT_TYPE = "eventType";
    public static final String SOURCE = "source";
    public static final String MEMORY_ID = "memoryId";
    public static final String ROOM_ID = "roomId";
    public static final String PLATFORM = "platform";
    public static final String TIMESTAMP = "timestamp";

    public static final String INTENT = "intent";
    public static final String ACTION = "action";
    public static final String CONFIDENCE = "confidence";
    public static final String REASONING = "reasoning";
    public static final String ORIGINAL_PARAMETERS = "originalParameters";
    public static final String CONTENT = "content";

    public static final String CONSCIOUSNESS_SOURCE = "consciousness";

    private EventAttributes() {
    }
}
