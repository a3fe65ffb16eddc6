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
import me.golemcore.relay.domain.model.EventAttributes;
import me.golemcore.relay.domain.model.Memory;
import me.golemcore.relay.domain.model.Room;
import me.golemcore.relay.domain.model.SimilarityMatch;
import me.golemcore.relay.port.outbound.RoomScopedSimilarityIndexPort;
import me.golemcore.relay.port.outbound.SimilarityIndexPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Session registry: creates and looks up {@link Room}s by platform identity and
 * forwards memory writes to the room and to the similarity index.
 *
 * <p>
 * {@link #createRoom} never checks for duplicates. Callers look up first; the
 * dispatcher owns the lookup-then-create sequence.
 *
 * <p>
 * The in-memory append is authoritative: failures while mirroring a memory
 * into the similarity index are logged and never fail the append.
 */
@Service
@Slf4j
public class RoomManager {

    private static final int DEFAULT_SIMILAR_LIMIT = 5;

    private final Map<String, Room> rooms = new ConcurrentHashMap<>();
    private final Map<String, List<String>> platformRooms = new ConcurrentHashMap<>();
    private final SimilarityIndexPort similarityIndex;
    private final RoomScopedSimilarityIndexPort roomScopedIndex;
    private final Clock clock;

    @Autowired
    public RoomManager(ObjectProvider<SimilarityIndexPort> similarityIndex, Clock clock) {
        this(similarityIndex.getIfAvailable(), clock);
    }

    public RoomManager(SimilarityIndexPort similarityIndex, Clock clock) {
        this.similarityIndex = similarityIndex;
        this.roomScopedIndex = resolveRoomScope(similarityIndex);
        this.clock = clock;
    }

    /**
     * Allocates a new room and indexes it by platform.
     */
    public Room createRoom(String platformId, String platform, Room.RoomMetadataUpdate metadata) {
        Room room = new Room(platformId, platform, clock);
        if (metadata != null) {
            room.updateMetadata(metadata);
        }
        rooms.put(room.getId(), room);
        platformRooms.computeIfAbsent(platform, key -> new CopyOnWriteArrayList<>()).add(room.getId());

        log.debug("[Rooms] Created room {} for {}:{}", room.getId(), platform, platformId);
        return room;
    }

    /**
     * Finds the first room of the platform with the given platform id.
     */
    public Optional<Room> getRoomByPlatformId(String platformId, String platform) {
        List<String> roomIds = platformRooms.get(platform);
        if (roomIds == null) {
            return Optional.empty();
        }
        return roomIds.stream()
                .map(rooms::get)
                .filter(room -> room != null && Objects.equals(room.getPlatformId(), platformId))
                .findFirst();
    }

    public Optional<Room> getRoom(String roomId) {
        return Optional.ofNullable(rooms.get(roomId));
    }

    public Collection<Room> getRooms() {
        return Collections.unmodifiableCollection(rooms.values());
    }

    public List<Room> getRoomsByPlatform(String platform) {
        List<String> roomIds = platformRooms.get(platform);
        if (roomIds == null) {
            return List.of();
        }
        return roomIds.stream()
                .map(rooms::get)
                .filter(room -> room != null)
                .toList();
    }

    /**
     * Appends a memory to the room and mirrors it into the similarity index. The
     * returned future completes once the mirror attempt has finished (success or
     * logged failure).
     */
    public CompletableFuture<Memory> addMemory(String roomId, String content, Map<String, Object> metadata) {
        Room room = rooms.get(roomId);
        if (room == null) {
            return CompletableFuture.failedFuture(new RoomNotFoundException(roomId));
        }

        Memory memory = room.addMemory(content, metadata);
        if (similarityIndex == null) {
            return CompletableFuture.completedFuture(memory);
        }

        return mirror(room, memory, metadata)
                .handle((ignored, error) -> {
                    if (error != null) {
                        log.warn("[Rooms] Failed to mirror memory {} of room {} into similarity index: {}",
                                memory.getId(), roomId, Failures.describe(error));
                    }
                    return memory;
                });
    }

    /**
     * Searches the similarity index for memories similar to {@code content},
     * optionally restricted to one room.
     *
     * @throws SimilarityIndexNotConfiguredException
     *             if no similarity index is attached
     */
    public CompletableFuture<List<Memory>> findSimilarMemories(String content, String roomId, int limit) {
        if (similarityIndex == null) {
            throw new SimilarityIndexNotConfiguredException();
        }

        int effectiveLimit = limit > 0 ? limit : DEFAULT_SIMILAR_LIMIT;
        Map<String, Object> filter = roomId != null ? Map.of(EventAttributes.ROOM_ID, roomId) : Map.of();

        return similarityIndex.findSimilar(content, effectiveLimit, filter)
                .thenApply(matches -> matches.stream()
                        .map(RoomManager::toMemory)
                        .toList());
    }

    public CompletableFuture<List<Memory>> findSimilarMemories(String content, String roomId) {
        return findSimilarMemories(content, roomId, DEFAULT_SIMILAR_LIMIT);
    }

    private CompletableFuture<Void> mirror(Room room, Memory memory, Map<String, Object> callerMetadata) {
        Map<String, Object> indexMetadata = new LinkedHashMap<>();
        indexMetadata.put(EventAttributes.MEMORY_ID, memory.getId());
        indexMetadata.put(EventAttributes.ROOM_ID, room.getId());
        indexMetadata.put(EventAttributes.PLATFORM, room.getPlatform());
        indexMetadata.put(EventAttributes.TIMESTAMP, memory.getTimestamp().toString());
        if (callerMetadata != null) {
            indexMetadata.putAll(callerMetadata);
        }

        try {
            if (roomScopedIndex != null) {
                return roomScopedIndex.storeInRoom(memory.getContent(), room.getId(), indexMetadata);
            }
            return similarityIndex.store(memory.getContent(), indexMetadata);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static Memory toMemory(SimilarityMatch match) {
        Map<String, Object> metadata = match.getMetadata() != null ? match.getMetadata() : Map.of();
        return Memory.builder()
                .id(asString(metadata.get(EventAttributes.MEMORY_ID), match.getId()))
                .roomId(asString(metadata.get(EventAttributes.ROOM_ID), null))
                .content(match.getContent())
                .timestamp(parseTimestamp(metadata.get(EventAttributes.TIMESTAMP)))
                .metadata(metadata)
                .build();
    }

    private static String asString(Object value, String fallback) {
        return value != null ? value.toString() : fallback;
    }

    private static Instant parseTimestamp(Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value.toString());
        } catch (RuntimeException e) {
            return null;
        }
    }

    private static RoomScopedSimilarityIndexPort resolveRoomScope(SimilarityIndexPort index) {
        if (index != null && index.supportsRoomScope() && index instanceof RoomScopedSimilarityIndexPort scoped) {
            return scoped;
        }
        return null;
    }

    /**
     * Raised when a memory is appended to a room id that does not exist.
     */
    public static class RoomNotFoundException extends IllegalArgumentException {

        private static final long serialVersionUID = 1L;

        public RoomNotFoundException(String roomId) {
            super("Room " + roomId + " not found");
        }
    }

    /**
     * Raised when similarity search is requested but no similarity index is
     * attached.
     */
    public static class SimilarityIndexNotConfiguredException extends IllegalStateException {

        private static final long serialVersionUID = 1L;

        public SimilarityIndexNotConfiguredException() {
            super("Similarity index not configured");
        }
    }
}
