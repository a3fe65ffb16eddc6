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
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured enrichment produced by the pipeline for one inbound event. All
 * fields are non-null, even in degraded form.
 */
@Value
@Builder
public class EnrichedContext {

    public static final String SENTIMENT_NEUTRAL = "neutral";
    public static final String INTENT_UNKNOWN = "unknown";

    RecencyBucket timeContext;
    String summary;

    @Builder.Default
    List<String> topics = List.of();

    @Builder.Default
    String sentiment = SENTIMENT_NEUTRAL;

    @Builder.Default
    List<String> entities = List.of();

    @Builder.Default
    String intent = INTENT_UNKNOWN;

    @Builder.Default
    List<String> relatedMemories = List.of();

    /**
     * Minimal enrichment used when the completion service cannot produce a
     * usable answer.
     */
    public static EnrichedContext degraded(String content, RecencyBucket timeContext,
            List<String> relatedMemories, int summaryMaxLength) {
        return EnrichedContext.builder()
                .timeContext(timeContext)
                .summary(truncate(content, summaryMaxLength))
                .relatedMemories(relatedMemories != null ? List.copyOf(relatedMemories) : List.of())
                .build();
    }

    /**
     * Flattens the context into event metadata entries.
     */
    public Map<String, Object> toMetadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("timeContext", timeContext != null ? timeContext.label() : null);
        metadata.put("summary", summary);
        metadata.put("topics", topics);
        metadata.put("sentiment", sentiment);
        metadata.put("entities", entities);
        metadata.put("intent", intent);
        metadata.put("relatedMemories", relatedMemories);
        return metadata;
    }

    static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxLength ? text : text.substring(0, maxLength);
    }
}
