package me.golemcore.relay.adapter.outbound.similarity;

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
import me.golemcore.relay.domain.model.SimilarityMatch;
import me.golemcore.relay.domain.service.Failures;
import me.golemcore.relay.port.outbound.EmbeddingPort;
import me.golemcore.relay.port.outbound.RoomScopedSimilarityIndexPort;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Process-local similarity index with room scoping.
 *
 * <p>
 * Entries are scored by cosine similarity of their embeddings when the
 * {@link EmbeddingPort} is available, and by token overlap (Jaccard over
 * lower-cased word tokens) otherwise. Room scope is a metadata filter on
 * {@code roomId}.
 */
@Component
@Slf4j
public class InMemorySimilarityIndex implements RoomScopedSimilarityIndexPort {

    private static final int MIN_TOKEN_LENGTH = 2;

    private final EmbeddingPort embeddingPort;
    private final List<Entry> entries = new CopyOnWriteArrayList<>();

    public InMemorySimilarityIndex(EmbeddingPort embeddingPort) {
        this.embeddingPort = embeddingPort;
    }

    @Override
    public CompletableFuture<Void> store(String content, Map<String, Object> metadata) {
        String id = UUID.randomUUID().toString();
        Map<String, Object> entryMetadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();

        return embedOrNull(content).thenAccept(embedding -> {
            entries.add(new Entry(id, content, Map.copyOf(withoutNulls(entryMetadata)), embedding, tokenize(content)));
            log.trace("[Similarity] Stored entry {} ({} total)", id, entries.size());
        });
    }

    @Override
    public CompletableFuture<Void> storeInRoom(String content, String roomId, Map<String, Object> metadata) {
        Map<String, Object> scoped = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
        scoped.put(EventAttributes.ROOM_ID, roomId);
        return store(content, scoped);
    }

    @Override
    public CompletableFuture<List<SimilarityMatch>> findSimilar(String content, int limit,
            Map<String, Object> metadataFilter) {
        Map<String, Object> filter = metadataFilter != null ? metadataFilter : Map.of();
        List<Entry> candidates = entries.stream()
                .filter(entry -> matches(entry, filter))
                .toList();
        if (candidates.isEmpty() || limit <= 0) {
            return CompletableFuture.completedFuture(List.of());
        }

        return embedOrNull(content).thenApply(queryEmbedding -> {
            Set<String> queryTokens = tokenize(content);
            return candidates.stream()
                    .map(entry -> toMatch(entry, score(entry, queryEmbedding, queryTokens)))
                    .filter(match -> match.getSimilarity() > 0)
                    .sorted(Comparator.comparingDouble(SimilarityMatch::getSimilarity).reversed())
                    .limit(limit)
                    .toList();
        });
    }

    @Override
    public CompletableFuture<List<SimilarityMatch>> findSimilarInRoom(String content, String roomId, int limit,
            Map<String, Object> metadataFilter) {
        Map<String, Object> scoped = metadataFilter != null ? new LinkedHashMap<>(metadataFilter)
                : new LinkedHashMap<>();
        scoped.put(EventAttributes.ROOM_ID, roomId);
        return findSimilar(content, limit, scoped);
    }

    @Override
    public CompletableFuture<Void> delete(String id) {
        entries.removeIf(entry -> entry.id().equals(id));
        return CompletableFuture.completedFuture(null);
    }

    public int size() {
        return entries.size();
    }

    private CompletableFuture<float[]> embedOrNull(String content) {
        if (embeddingPort == null || content == null || content.isBlank() || !embeddingPort.isAvailable()) {
            return CompletableFuture.completedFuture(null);
        }
        return embeddingPort.embed(content).exceptionally(error -> {
            log.warn("[Similarity] Embedding failed, falling back to token overlap: {}", Failures.describe(error));
            return null;
        });
    }

    private double score(Entry entry, float[] queryEmbedding, Set<String> queryTokens) {
        if (queryEmbedding != null && entry.embedding() != null
                && queryEmbedding.length == entry.embedding().length) {
            return embeddingPort.cosineSimilarity(queryEmbedding, entry.embedding());
        }
        return jaccard(queryTokens, entry.tokens());
    }

    static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        if (intersection.isEmpty()) {
            return 0.0;
        }
        int union = a.size() + b.size() - intersection.size();
        return (double) intersection.size() / union;
    }

    static Set<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
                .filter(token -> token.length() >= MIN_TOKEN_LENGTH)
                .collect(Collectors.toUnmodifiableSet());
    }

    private static boolean matches(Entry entry, Map<String, Object> filter) {
        for (Map.Entry<String, Object> condition : filter.entrySet()) {
            Object value = entry.metadata().get(condition.getKey());
            if (!Objects.equals(value, condition.getValue())) {
                return false;
            }
        }
        return true;
    }

    private static SimilarityMatch toMatch(Entry entry, double similarity) {
        return SimilarityMatch.builder()
                .id(entry.id())
                .content(entry.content())
                .similarity(similarity)
                .metadata(entry.metadata())
                .build();
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> metadata) {
        metadata.values().removeIf(Objects::isNull);
        return metadata;
    }

    private record Entry(String id, String content, Map<String, Object> metadata, float[] embedding,
            Set<String> tokens) {
    }
}
