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
 * Optional second tier of {@link SimilarityIndexPort}: storage and search scoped
 * to a single room.
 */
public interface RoomScopedSimilarityIndexPort extends SimilarityIndexPort {

    CompletableFuture<Void> storeInRoom(String content, String roomId, Map<String, Object> metadata);

    CompletableFuture<List<SimilarityMatch>> findSimilarInRoom(String content, String roomId, int limit,
            Map<String, Object> metadataFilter);

    @Override
    default boolean supportsRoomScope() {
        return true;
    }
}
