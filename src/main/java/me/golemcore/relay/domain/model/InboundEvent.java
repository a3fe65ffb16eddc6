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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Client-to-core event. Immutable; enrichment is attached through
 * {@link #withMetadata(Map)}, which returns a derived copy.
 *
 * <p>
 * Platform attributes ({@code tweetId}, {@code userId}, {@code username},
 * {@code channelId}) are optional and only meaningful for the kinds that carry
 * them.
 */
@Value
@Builder(toBuilder = true)
public class InboundEvent {

    String kind;
    String source;

    @Builder.Default
    String content = "";

    @Builder.Default
    Instant timestamp = Instant.now();

    @Singular("metadataEntry")
    Map<String, Object> metadata;

    String tweetId;
    String userId;
    String username;
    String channelId;

    /**
     * Returns a copy of this event whose metadata is merged with the given
     * entries (given entries win on key collisions).
     */
    public InboundEvent withMetadata(Map<String, Object> extra) {
        if (extra == null || extra.isEmpty()) {
            return this;
        }
        return toBuilder().metadata(extra).build();
    }

    public boolean isKind(EventKind eventKind) {
        return eventKind.tag().equals(kind);
    }
}
