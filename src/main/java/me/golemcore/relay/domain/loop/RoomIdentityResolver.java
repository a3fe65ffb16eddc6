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

import me.golemcore.relay.domain.model.EventKind.PlatformFamily;
import me.golemcore.relay.domain.model.InboundEvent;
import me.golemcore.relay.domain.model.RoomIdentity;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Derives which room an inbound event belongs to. Every method is a pure
 * function of the event and never fails.
 */
public final class RoomIdentityResolver {

    public static final String PLATFORM_TWITTER = "twitter";
    public static final String PLATFORM_DISCORD = "discord";

    static final String UNKNOWN_SOURCE = "unknown";

    private RoomIdentityResolver() {
    }

    public static RoomIdentity resolve(InboundEvent event) {
        String source = sourceOf(event);
        return switch (PlatformFamily.of(event.getKind())) {
            case TWITTER_TWEET -> new RoomIdentity(PLATFORM_TWITTER, firstNonBlank(event.getTweetId(), source));
            case TWITTER_DM -> new RoomIdentity(PLATFORM_TWITTER, source);
            case DISCORD -> new RoomIdentity(PLATFORM_DISCORD, firstNonBlank(event.getChannelId(), source));
            case OTHER -> new RoomIdentity(leadingToken(source), source);
        };
    }

    /**
     * Human-readable name for a newly created room.
     */
    public static String roomName(InboundEvent event) {
        return switch (PlatformFamily.of(event.getKind())) {
            case TWITTER_TWEET -> "Twitter Thread by " + firstNonBlank(event.getUsername(), sourceOf(event));
            case DISCORD -> "Discord Channel " + firstNonBlank(event.getChannelId(), sourceOf(event));
            case TWITTER_DM, OTHER -> "Room for " + sourceOf(event);
        };
    }

    /**
     * Participants implied by the event: the username when present, then the
     * source.
     */
    public static Set<String> participants(InboundEvent event) {
        Set<String> participants = new LinkedHashSet<>();
        if (event.getUsername() != null && !event.getUsername().isBlank()) {
            participants.add(event.getUsername());
        }
        participants.add(sourceOf(event));
        return participants;
    }

    private static String sourceOf(InboundEvent event) {
        String source = event.getSource();
        return source == null || source.isBlank() ? UNKNOWN_SOURCE : source;
    }

    private static String leadingToken(String source) {
        String token = source.split("-", 2)[0];
        return token.isBlank() ? source : token;
    }

    private static String firstNonBlank(String preferred, String fallback) {
        return preferred != null && !preferred.isBlank() ? preferred : fallback;
    }
}
