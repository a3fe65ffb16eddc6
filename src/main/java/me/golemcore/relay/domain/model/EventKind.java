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

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of event kinds the core knows about. Each kind carries its wire
 * tag, the direction it travels in and the platform family it belongs to.
 *
 * <p>
 * Events are still tagged with plain strings so that clients can introduce
 * their own kinds; {@link PlatformFamily#of(String)} maps any tag (known or
 * not) onto a family, which keeps room resolution total.
 */
public enum EventKind {

    TWEET_RECEIVED("tweet_received", Direction.INBOUND),
    DM_RECEIVED("dm_received", Direction.INBOUND),
    DISCORD_MESSAGE_RECEIVED("discord_message_received", Direction.INBOUND),
    INTERNAL_THOUGHT("internal_thought", Direction.INBOUND),
    TWEET_REQUEST("tweet_request", Direction.OUTBOUND),
    DM_REQUEST("dm_request", Direction.OUTBOUND),
    DISCORD_MESSAGE("discord_message", Direction.OUTBOUND);

    private final String tag;
    private final Direction direction;

    EventKind(String tag, Direction direction) {
        this.tag = tag;
        this.direction = direction;
    }

    public String tag() {
        return tag;
    }

    public Direction direction() {
        return direction;
    }

    public PlatformFamily family() {
        return PlatformFamily.of(tag);
    }

    public static Optional<EventKind> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(kind -> kind.tag.equals(tag))
                .findFirst();
    }

    public enum Direction {
        INBOUND, OUTBOUND
    }

    /**
     * Platform family derived from the kind prefix.
     */
    public enum PlatformFamily {

        TWITTER_TWEET("tweet_"),
        TWITTER_DM("dm_"),
        DISCORD("discord_"),
        OTHER(null);

        private final String prefix;

        PlatformFamily(String prefix) {
            this.prefix = prefix;
        }

        public static PlatformFamily of(String kind) {
            if (kind == null) {
                return OTHER;
            }
            for (PlatformFamily family : values()) {
                if (family.prefix != null && kind.startsWith(family.prefix)) {
                    return family;
                }
            }
            return OTHER;
        }
    }
}
