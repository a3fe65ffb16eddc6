package me.golemcore.relay.port.outbound;

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

import me.golemcore.relay.domain.model.SimilarityMatch;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the similarity index holding a derived, replaceable copy of room
 * memories. Never the source of truth.
 *
 * <p>
 * Implementations that can scope storage and search to a single room implement
 * {@link RoomScopedSimilarityIndexPort} and report it through
 * {@link #supportsRoomScope()}; consumers resolve that capability once, at
 * construction.
 */
public interface SimilarityIndexPort {

    /**
     * Stores content with its metadata.
     */
    CompletableFuture<Void> store(String content, Map<String, Object> metadata);

    /**
     * Finds up to {@code limit} entries most similar to {@code content}, keeping
     * only entries whose metadata contains every entry of {@code metadataFilter}.
     *
     * @return matches ordered by descending similarity
     */
    CompletableFuture<List<SimilarityMatch>> findSimilar(String content, int limit,
            Map<String, Object> metadataFilter);

    /**
     * Removes an entry by id.
     */
    CompletableFuture<Void> delete(String id);

    /**
     * Declares whether this index also implements
     * {@link RoomScopedSimilarityIndexPort}.
     */
    default boolean supportsRoomScope() {
        return false;
    }
}
