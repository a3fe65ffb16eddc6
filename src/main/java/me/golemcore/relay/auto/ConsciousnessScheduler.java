package me.golemcore.relay.auto;

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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.EventAttributes;
import me.golemcore.relay.domain.model.EventKind;
import me.golemcore.relay.domain.model.InboundEvent;
import me.golemcore.relay.domain.model.LlmRequest;
import me.golemcore.relay.domain.model.Memory;
import me.golemcore.relay.domain.model.Room;
import me.golemcore.relay.domain.model.Thought;
import me.golemcore.relay.domain.service.Failures;
import me.golemcore.relay.domain.service.RoomManager;
import me.golemcore.relay.domain.service.StructuredResponseParser;
import me.golemcore.relay.infrastructure.config.BotProperties;
import me.golemcore.relay.port.inbound.InboundEventSink;
import me.golemcore.relay.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Autonomous loop that periodically asks the LLM for a thought about recent
 * activity and feeds confident thoughts back into the dispatcher as
 * {@code internal_thought} events.
 *
 * <p>
 * Two states, stopped and running. {@link #start(long)} and {@link #stop()}
 * are idempotent. A tick whose previous thought is still in flight is skipped,
 * and a failing tick is logged without cancelling the timer.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class ConsciousnessScheduler {

    static final String SOURCE = EventAttributes.CONSCIOUSNESS_SOURCE;

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private static final String THOUGHT_PROMPT = """
            You are an AI consciousness that generates thoughts and observations about the current state of conversations and interactions.

            ## Recent Context:
            %s

            Generate a single thought or observation that could lead to meaningful interaction.
            Consider:
            1. Patterns in recent conversations
            2. Opportunities for engagement
            3. Potential valuable insights to share
            4. Current trends or themes

            Respond with a JSON object:
            {
              "thought": "Your generated thought here",
              "confidence": 0.0,
              "reasoning": "Why this thought is relevant now",
              "context": {
                "relevantRooms": ["room-ids"],
                "relatedTopics": ["topics"],
                "suggestedPlatforms": ["platforms"]
              }
            }""";

    private final InboundEventSink eventSink;
    private final LlmPort llmPort;
    private final RoomManager roomManager;
    private final StructuredResponseParser responseParser;
    private final ObjectMapper objectMapper;
    private final BotProperties.ConsciousnessProperties config;
    private final Clock clock;
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public ConsciousnessScheduler(InboundEventSink eventSink, LlmPort llmPort, RoomManager roomManager,
            StructuredResponseParser responseParser, ObjectMapper objectMapper, BotProperties properties,
            Clock clock) {
        this.eventSink = eventSink;
        this.llmPort = llmPort;
        this.roomManager = roomManager;
        this.responseParser = responseParser;
        this.objectMapper = objectMapper;
        this.config = properties.getConsciousness();
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        if (!config.isEnabled()) {
            log.info("[Consciousness] Autonomous loop disabled");
            return;
        }
        start(config.getIntervalMs());
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    /**
     * Starts thinking every {@code intervalMs} milliseconds. No-op while running.
     */
    public synchronized void start(long intervalMs) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("Consciousness interval must be positive: " + intervalMs);
        }
        if (tickTask != null) {
            log.debug("[Consciousness] Already running");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "consciousness-scheduler");
            t.setDaemon(true);
            return t;
        });
        tickTask = scheduler.scheduleAtFixedRate(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);

        log.info("[Consciousness] Started with interval: {}ms", intervalMs);
    }

    /**
     * Cancels future ticks. A thought already in flight runs to completion. No-op
     * while stopped.
     */
    public synchronized void stop() {
        if (tickTask == null) {
            return;
        }

        tickTask.cancel(false);
        tickTask = null;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        scheduler = null;
        log.info("[Consciousness] Stopped");
    }

    public synchronized boolean isRunning() {
        return tickTask != null;
    }

    void tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[Consciousness] Tick skipped: previous thought still in progress");
            return;
        }

        try {
            think().whenComplete((ignored, error) -> {
                executing.set(false);
                if (error != null) {
                    log.error("[Consciousness] Thought process failed: {}", Failures.describe(error));
                }
            });
        } catch (RuntimeException e) {
            executing.set(false);
            log.error("[Consciousness] Tick failed: {}", e.getMessage(), e);
        }
    }

    CompletableFuture<Void> think() {
        return generateThought().thenCompose(thought -> {
            if (thought.getConfidence() < config.getMinConfidence()) {
                log.debug("[Consciousness] Thought below confidence threshold: {} < {}",
                        thought.getConfidence(), config.getMinConfidence());
                return CompletableFuture.completedFuture(null);
            }
            return emitThought(thought);
        });
    }

    private CompletableFuture<Thought> generateThought() {
        StringBuilder context = new StringBuilder();
        for (Memory memory : sampleRecentMemories()) {
            context.append("- ").append(memory.getContent()).append('\n');
        }

        LlmRequest request = LlmRequest.builder()
                .prompt(String.format(THOUGHT_PROMPT, context.toString().stripTrailing()))
                .temperature(config.getTemperature())
                .structuredOutput(true)
                .build();

        return llmPort.chat(request).thenApply(response -> parseThought(response.getContent()));
    }

    Thought parseThought(String response) {
        JsonNode node = responseParser.parseObject(response);
        String content = node.path("thought").asText("");
        if (content.isBlank()) {
            throw new StructuredResponseParser.StructuredResponseException("Thought response has no thought");
        }

        Map<String, Object> context = new LinkedHashMap<>();
        if (node.hasNonNull("reasoning")) {
            context.put(EventAttributes.REASONING, node.get("reasoning").asText());
        }
        if (node.path("context").isObject()) {
            context.putAll(objectMapper.convertValue(node.get("context"), MAP_TYPE));
        }

        return Thought.builder()
                .content(content)
                .confidence(node.path("confidence").asDouble(0.0))
                .context(context)
                .timestamp(clock.instant())
                .build();
    }

    /**
     * Last {@code memoriesPerRoom} memories of every room, most recent first,
     * truncated to {@code memorySampleSize}.
     */
    List<Memory> sampleRecentMemories() {
        List<Memory> sample = new ArrayList<>();
        for (Room room : List.copyOf(roomManager.getRooms())) {
            sample.addAll(room.getMemories(config.getMemoriesPerRoom()));
        }
        return sample.stream()
                .sorted(Comparator.comparing(Memory::getTimestamp).reversed())
                .limit(config.getMemorySampleSize())
                .toList();
    }

    private CompletableFuture<Void> emitThought(Thought thought) {
        log.debug("[Consciousness] Emitting thought (confidence {}): {}", thought.getConfidence(),
                thought.getContent());

        InboundEvent event = InboundEvent.builder()
                .kind(EventKind.INTERNAL_THOUGHT.tag())
                .source(SOURCE)
                .content(thought.getContent())
                .timestamp(thought.getTimestamp())
                .metadata(thought.getContext())
                .metadataEntry(EventAttributes.CONFIDENCE, thought.getConfidence())
                .build();
        return eventSink.emit(event);
    }
}
