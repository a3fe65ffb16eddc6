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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.ActionDescriptor;
import me.golemcore.relay.domain.model.EnrichedContext;
import me.golemcore.relay.domain.model.EventAttributes;
import me.golemcore.relay.domain.model.InboundEvent;
import me.golemcore.relay.domain.model.Intent;
import me.golemcore.relay.domain.model.LlmRequest;
import me.golemcore.relay.domain.model.OutboundEvent;
import me.golemcore.relay.domain.model.ProcessingResult;
import me.golemcore.relay.domain.model.RecencyBucket;
import me.golemcore.relay.domain.model.Room;
import me.golemcore.relay.domain.model.SimilarityMatch;
import me.golemcore.relay.infrastructure.config.BotProperties;
import me.golemcore.relay.port.outbound.IntentExtractorPort;
import me.golemcore.relay.port.outbound.LlmPort;
import me.golemcore.relay.port.outbound.RoomScopedSimilarityIndexPort;
import me.golemcore.relay.port.outbound.SimilarityIndexPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Enrichment and decision pipeline run once per inbound event.
 *
 * <p>
 * Stages:
 * <ol>
 * <li>Recency bucket from the event timestamp</li>
 * <li>Related memories from the room's similarity scope</li>
 * <li>LLM enrichment (summary, topics, sentiment, entities, intent), retried
 * once with a stricter prompt when the answer cannot be parsed</li>
 * <li>Intent extraction</li>
 * <li>Action selection per intent against the {@link ActionRegistry}</li>
 * </ol>
 *
 * <p>
 * Every stage degrades instead of failing: {@link #process} always completes
 * normally with a non-null enrichment context.
 */
@Service
@Slf4j
public class EventProcessor {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private static final String ENRICHMENT_PROMPT = """
            Analyze the following content and provide enrichment.

            ## Content:
            "%s"

            ## Related Context:
            %s

            Provide a JSON response with:
            1. A brief summary (max %d chars)
            2. Key topics mentioned (max 5)
            3. Sentiment analysis
            4. Named entities
            5. Detected intent/purpose

            Response format:
            ```json
            {
              "summary": "Brief summary here",
              "topics": ["topic1", "topic2"],
              "sentiment": "positive|negative|neutral",
              "entities": ["entity1", "entity2"],
              "intent": "question|statement|request|etc"
            }
            ```
            Return only valid JSON, no other text.""";

    private static final String STRICT_SUFFIX = """


            IMPORTANT: Respond with ONLY the JSON object, no markdown, no explanations.""";

    private static final String ACTION_PROMPT = """
            Given the following intent and available actions, determine the most appropriate action to take.

            ## Intent:
            - Type: %s
            - Confidence: %s
            - Parameters: %s

            ## Available Actions:
            %s
            Response format:
            ```json
            {
              "selectedAction": "action_type",
              "confidence": 0.0,
              "parameters": {},
              "reasoning": "Explanation of why this action was chosen"
            }
            ```
            Return only valid JSON.""";

    private final LlmPort llmPort;
    private final IntentExtractorPort intentExtractor;
    private final ActionRegistry actionRegistry;
    private final RoomScopedSimilarityIndexPort roomScopedIndex;
    private final StructuredResponseParser responseParser;
    private final ObjectMapper objectMapper;
    private final BotProperties.ProcessorProperties config;
    private final Clock clock;

    @Autowired
    public EventProcessor(LlmPort llmPort, IntentExtractorPort intentExtractor, ActionRegistry actionRegistry,
            ObjectProvider<SimilarityIndexPort> similarityIndex, StructuredResponseParser responseParser,
            ObjectMapper objectMapper, BotProperties properties, Clock clock) {
        this(llmPort, intentExtractor, actionRegistry, similarityIndex.getIfAvailable(), responseParser,
                objectMapper, properties, clock);
    }

    public EventProcessor(LlmPort llmPort, IntentExtractorPort intentExtractor, ActionRegistry actionRegistry,
            SimilarityIndexPort similarityIndex, StructuredResponseParser responseParser,
            ObjectMapper objectMapper, BotProperties properties, Clock clock) {
        this.llmPort = llmPort;
        this.intentExtractor = intentExtractor;
        this.actionRegistry = actionRegistry;
        this.roomScopedIndex = similarityIndex != null && similarityIndex.supportsRoomScope()
                && similarityIndex instanceof RoomScopedSimilarityIndexPort scoped ? scoped : null;
        this.responseParser = responseParser;
        this.objectMapper = objectMapper;
        this.config = properties.getProcessor();
        this.clock = clock;
        if (roomScopedIndex == null) {
            log.info("[Processor] Similarity index has no room scope, related memories disabled");
        }
    }

    public CompletableFuture<ProcessingResult> process(InboundEvent event, Room room) {
        log.debug("[Processor] Processing {} from {} in room {}", event.getKind(), event.getSource(), room.getId());

        String content = event.getContent();
        RecencyBucket timeContext = RecencyBucket.between(event.getTimestamp(), clock.instant());

        return fetchRelatedMemories(content, room)
                .thenCompose(related -> enrich(content, related, timeContext))
                .thenCompose(context -> extractIntents(content)
                        .thenCompose(intents -> generateActions(intents)
                                .thenApply(actions -> ProcessingResult.builder()
                                        .intents(intents)
                                        .suggestedActions(actions)
                                        .enrichedContext(context)
                                        .build())))
                .exceptionally(error -> {
                    log.error("[Processor] Pipeline failed for {}: {}", event.getKind(), Failures.describe(error));
                    return ProcessingResult.degraded(EnrichedContext.degraded(content, timeContext, List.of(),
                            config.getSummaryMaxLength()));
                });
    }

    private CompletableFuture<List<String>> fetchRelatedMemories(String content, Room room) {
        if (roomScopedIndex == null) {
            return CompletableFuture.completedFuture(List.of());
        }

        return call(() -> roomScopedIndex.findSimilarInRoom(content, room.getId(),
                config.getRelatedMemoryLimit() + 1, Map.of()))
                .thenApply(matches -> matches.stream()
                        .map(SimilarityMatch::getContent)
                        .filter(Objects::nonNull)
                        .filter(related -> !related.equals(content))
                        .limit(config.getRelatedMemoryLimit())
                        .toList())
                .exceptionally(error -> {
                    log.warn("[Processor] Related memory lookup failed: {}", Failures.describe(error));
                    return List.of();
                });
    }

    private CompletableFuture<EnrichedContext> enrich(String content, List<String> related,
            RecencyBucket timeContext) {
        String prompt = buildEnrichmentPrompt(content, related);
        EnrichedContext degraded = EnrichedContext.degraded(content, timeContext, related,
                config.getSummaryMaxLength());

        return complete(prompt, config.getEnrichmentTemperature())
                .thenCompose(response -> {
                    Optional<JsonNode> parsed = parseEnrichment(response);
                    if (parsed.isPresent()) {
                        return CompletableFuture.completedFuture(parsed.get());
                    }
                    log.warn("[Processor] Unparseable enrichment response, retrying with stricter prompt");
                    log.debug("[Processor] Raw enrichment response: {}", response);
                    return complete(prompt + STRICT_SUFFIX, config.getRetryTemperature())
                            .thenApply(retry -> parseEnrichment(retry)
                                    .orElseThrow(() -> new StructuredResponseParser.StructuredResponseException(
                                            "Enrichment response unparseable after retry")));
                })
                .thenApply(node -> toContext(node, content, related, timeContext))
                .exceptionally(error -> {
                    log.error("[Processor] Enrichment failed: {}", Failures.describe(error));
                    return degraded;
                });
    }

    private Optional<JsonNode> parseEnrichment(String response) {
        try {
            JsonNode node = responseParser.parseObject(response);
            JsonNode summary = node.get("summary");
            if (summary == null || !summary.isTextual() || summary.asText().isBlank()
                    || !node.path("topics").isArray()) {
                return Optional.empty();
            }
            return Optional.of(node);
        } catch (StructuredResponseParser.StructuredResponseException e) {
            return Optional.empty();
        }
    }

    private EnrichedContext toContext(JsonNode node, String content, List<String> related,
            RecencyBucket timeContext) {
        String sentiment = node.path("sentiment").asText("");
        String intent = node.path("intent").asText("");
        return EnrichedContext.builder()
                .timeContext(timeContext)
                .summary(node.path("summary").asText(content))
                .topics(textList(node.path("topics")))
                .sentiment(sentiment.isBlank() ? EnrichedContext.SENTIMENT_NEUTRAL : sentiment)
                .entities(textList(node.path("entities")))
                .intent(intent.isBlank() ? EnrichedContext.INTENT_UNKNOWN : intent)
                .relatedMemories(List.copyOf(related))
                .build();
    }

    private CompletableFuture<List<Intent>> extractIntents(String content) {
        return call(() -> intentExtractor.extract(content))
                .thenApply(intents -> intents != null ? intents : List.<Intent>of())
                .exceptionally(error -> {
                    log.error("[Processor] Intent extraction failed: {}", Failures.describe(error));
                    return List.of();
                });
    }

    private CompletableFuture<List<OutboundEvent>> generateActions(List<Intent> intents) {
        List<OutboundEvent> actions = new ArrayList<>();
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (Intent intent : intents) {
            chain = chain.thenCompose(ignored -> selectAction(intent)
                    .thenAccept(action -> action.ifPresent(actions::add)));
        }
        return chain.thenApply(ignored -> List.copyOf(actions));
    }

    private CompletableFuture<Optional<OutboundEvent>> selectAction(Intent intent) {
        String prompt;
        try {
            prompt = buildActionPrompt(intent);
        } catch (JsonProcessingException e) {
            log.error("[Processor] Failed to build action prompt for intent {}: {}", intent.getKind(),
                    e.getMessage());
            return CompletableFuture.completedFuture(Optional.empty());
        }

        return complete(prompt, config.getActionTemperature())
                .thenApply(response -> toAction(intent, responseParser.parseObject(response)))
                .exceptionally(error -> {
                    log.error("[Processor] Failed to generate action for intent {}: {}", intent.getKind(),
                            Failures.describe(error));
                    return Optional.empty();
                });
    }

    private Optional<OutboundEvent> toAction(Intent intent, JsonNode node) {
        String selectedAction = node.path("selectedAction").asText("");
        double confidence = node.path("confidence").asDouble(0.0);

        if (confidence < config.getActionMinConfidence()) {
            log.debug("[Processor] Action confidence too low for intent {}: {} ({})", intent.getKind(),
                    selectedAction, confidence);
            return Optional.empty();
        }

        Optional<ActionDescriptor> descriptor = actionRegistry.getActionDefinition(selectedAction);
        if (descriptor.isEmpty()) {
            log.warn("[Processor] LLM selected unknown action '{}' for intent {}", selectedAction,
                    intent.getKind());
            return Optional.empty();
        }

        Map<String, Object> parameters = node.path("parameters").isObject()
                ? objectMapper.convertValue(node.get("parameters"), MAP_TYPE)
                : Map.of();

        Map<String, Object> metadata = new LinkedHashMap<>(parameters);
        metadata.put(EventAttributes.INTENT, intent.getKind());
        metadata.put(EventAttributes.CONFIDENCE, confidence);
        if (node.hasNonNull("reasoning")) {
            metadata.put(EventAttributes.REASONING, node.get("reasoning").asText());
        }
        metadata.put(EventAttributes.ORIGINAL_PARAMETERS, intent.getParameters());
        metadata.put(EventAttributes.ACTION, selectedAction);

        Object actionContent = parameters.get(EventAttributes.CONTENT);
        ActionDescriptor action = descriptor.get();
        OutboundEvent event = OutboundEvent.builder()
                .kind(action.getEventKind())
                .target(action.getClientId())
                .content(actionContent != null ? actionContent.toString() : "")
                .timestamp(clock.instant())
                .metadata(metadata)
                .build();

        log.debug("[Processor] Generated {} -> {} for intent {} (confidence {})", selectedAction,
                action.getClientId(), intent.getKind(), confidence);
        return Optional.of(event);
    }

    private CompletableFuture<String> complete(String prompt, double temperature) {
        LlmRequest request = LlmRequest.builder()
                .prompt(prompt)
                .temperature(temperature)
                .structuredOutput(true)
                .build();
        return call(() -> llmPort.chat(request))
                .thenApply(response -> response != null && response.getContent() != null
                        ? response.getContent()
                        : "");
    }

    private String buildEnrichmentPrompt(String content, List<String> related) {
        StringBuilder relatedSection = new StringBuilder();
        for (String memory : related) {
            relatedSection.append("- ").append(memory).append('\n');
        }
        return String.format(ENRICHMENT_PROMPT, content, relatedSection.toString().stripTrailing(),
                config.getSummaryMaxLength());
    }

    private String buildActionPrompt(Intent intent) throws JsonProcessingException {
        StringBuilder available = new StringBuilder();
        for (ActionDescriptor descriptor : actionRegistry.getAvailableActions().values()) {
            available.append(String.format("- %s:%n  Description: %s%n  Platforms: %s%n  Parameters: %s%n",
                    descriptor.getKind(),
                    descriptor.getDescription(),
                    String.join(", ", descriptor.getTargetPlatforms()),
                    objectMapper.writeValueAsString(descriptor.getParameters())));
        }
        return String.format(ACTION_PROMPT,
                intent.getKind(),
                intent.getConfidence(),
                objectMapper.writeValueAsString(intent.getParameters()),
                available);
    }

    private static List<String> textList(JsonNode node) {
        if (!node.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        node.forEach(item -> {
            if (item.isValueNode() && !item.isNull()) {
                values.add(item.asText());
            }
        });
        return List.copyOf(values);
    }

    private static <T> CompletableFuture<T> call(Supplier<CompletableFuture<T>> supplier) {
        try {
            return supplier.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
