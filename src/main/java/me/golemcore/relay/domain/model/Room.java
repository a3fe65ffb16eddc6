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

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * One logical conversation (thread, channel, DM, internal stream) and its
 * append-only memory history.
 *
 * <p>
 * Memories are appended in insertion order and are never edited or removed.
 * Reads return copies, so callers cannot corrupt the internal list. All
 * mutators are safe under concurrent use.
 */
public class Room {

    private final String id;
    private final String platformId;
    private final String platform;
    private final Instant createdAt;
    private final Clock clock;

    private final Object lock = new Object();
    private final List<Memory> memories = new ArrayList<>();
    private final Set<String> participants = new LinkedHashSet<>();
    private final Map<String, Object> platformAttributes = new LinkedHashMap<>();

    private String name;
    private String description;
    private Instant lastActiveAt;

    public Room(String platformId, String platform, Clock clock) {
        this.id = UUID.randomUUID().toString();
        this.platformId = platformId;
        this.platform = platform;
        this.clock = clock;
        this.createdAt = clock.instant();
        this.lastActiveAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public String getPlatformId() {
        return platformId;
    }

    public String getPlatform() {
        return platform;
    }

    public RoomIdentity getIdentity() {
        return new RoomIdentity(platform, platformId);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastActiveAt() {
        synchronized (lock) {
            return lastActiveAt;
        }
    }

    public String getName() {
        synchronized (lock) {
            return name;
        }
    }

    public String getDescription() {
        synchronized (lock) {
            return description;
        }
    }

    public Set<String> getParticipants() {
        synchronized (lock) {
            return Set.copyOf(participants);
        }
    }

    public Map<String, Object> getPlatformAttributes() {
        synchronized (lock) {
            return Map.copyOf(platformAttributes);
        }
    }

    /**
     * Appends a memory with a fresh id and timestamp.
     */
    public Memory addMemory(String content, Map<String, Object> metadata) {
        Instant now = clock.instant();
        Memory memory = Memory.builder()
                .id(UUID.randomUUID().toString())
                .roomId(id)
                .content(content)
                .timestamp(now)
                .metadata(metadata != null ? copyOf(metadata) : Map.of())
                .build();

        synchronized (lock) {
            memories.add(memory);
            lastActiveAt = now;
        }
        return memory;
    }

    /**
     * Returns all memories in insertion order.
     */
    public List<Memory> getMemories() {
        synchronized (lock) {
            return List.copyOf(memories);
        }
    }

    /**
     * Returns the most recent {@code limit} memories in insertion order. A
     * non-positive limit returns everything.
     */
    public List<Memory> getMemories(int limit) {
        synchronized (lock) {
            if (limit <= 0 || limit >= memories.size()) {
                return List.copyOf(memories);
            }
            return List.copyOf(memories.subList(memories.size() - limit, memories.size()));
        }
    }

    public int getMemoryCount() {
        synchronized (lock) {
            return memories.size();
        }
    }

    public void addParticipants(Collection<String> newParticipants) {
        if (newParticipants == null || newParticipants.isEmpty()) {
            return;
        }
        synchronized (lock) {
            for (String participant : newParticipants) {
                if (participant != null && !participant.isBlank()) {
                    participants.add(participant);
                }
            }
        }
    }

    /**
     * Applies metadata overrides and bumps {@code lastActiveAt}. Null fields of the
     * update are left untouched.
     */
    public void updateMetadata(RoomMetadataUpdate update) {
        synchronized (lock) {
            if (update.name() != null) {
                name = update.name();
            }
            if (update.description() != null) {
                description = update.description();
            }
            if (update.participants() != null) {
                update.participants().stream()
                        .filter(p -> p != null && !p.isBlank())
                        .forEach(participants::add);
            }
            if (update.platformAttributes() != null) {
                platformAttributes.putAll(update.platformAttributes());
            }
            lastActiveAt = clock.instant();
        }
    }

    public void touch() {
        synchronized (lock) {
            lastActiveAt = clock.instant();
        }
    }

    private static Map<String, Object> copyOf(Map<String, Object> source) {
        return java.util.Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    @Override
    public String toString() {
        return "Room{id=" + id + ", platform=" + platform + ", platformId=" + platformId + "}";
    }

    /**
     * Partial room metadata used on creation and on later updates.
     */
    public record RoomMetadataUpdate(String name, String description, Collection<String> participants,
            Map<String, Object> platformAttributes) {

        public static RoomMetadataUpdate empty() {
            return new RoomMetadataUpdate(null, null, null, null);
        }
    }
}
