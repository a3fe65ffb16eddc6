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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.Intent;
import me.golemcore.relay.domain.model.LlmRequest;
import me.golemcore.relay.port.outbound.IntentExtractorPort;
import me.golemcore.relay.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * LLM-backed intent classification.
 *
 * <p>
 * Accepts either a bare JSON array or an object with an {@code intents} array.
 * Entries without a type are skipped, confidences are clamped to [0, 1], and
 * any failure yields an empty list.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LlmIntentExtractor implements IntentExtractorPort {

    private static final double TEMPERATURE = 0.3;

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private static final String DEFAULT_INSTRUCTIONS = """
            Identify the intents expressed in the content below.

            For each intent report:
            - "type": short snake_case label (question, greeting, request, complaint, ...)
            - "confidence": number between 0 and 1
            - "action": optional name of an immediate action to perform
            - "parameters": optional object with intent-specific values

            Respond ONLY with a JSON array, most relevant intent first:
            [{"type": "question", "confidence": 0.9, "parameters": {}}]
            """;

    private final LlmPort llmPort;
    private final StructuredResponseParser responseParser;
    private final ObjectMapper objectMapper;

    @Override
    public CompletableFuture<List<Intent>> extract(String content, String promptOverride) {
        String instructions = promptOverride != null && !promptOverride.isBlank()
                ? promptOverride
                : DEFAULT_INSTRUCTIONS;

        LlmRequest request = LlmRequest.builder()
                .prompt(instructions + "\n## Content:\n" + content)
                .temperature(TEMPERATURE)
                .structuredOutput(true)
                .build();

        CompletableFuture<List<Intent>> result;
        try {
            result = llmPort.chat(request).thenApply(response -> parseIntents(response.getContent()));
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }
        return result.exceptionally(error -> {
            log.warn("[Intent] Intent extraction failed: {}", Failures.describe(error));
            return List.of();
        });
    }

    List<Intent> parseIntents(String response) {
        JsonNode root = responseParser.parse(response);
        JsonNode items = root.isArray() ? root : root.path("intents");
        if (!items.isArray()) {
            log.debug("[Intent] Response has no intent array");
            return List.of();
        }

        List<Intent> intents = new ArrayList<>();
        for (JsonNode item : items) {
            String type = item.path("type").asText("");
            if (!item.isObject() || type.isBlank()) {
                log.debug("[Intent] Skipping malformed intent entry: {}", item);
                continue;
            }

            Intent.IntentBuilder builder = Intent.builder()
                    .kind(type)
                    .confidence(clamp(item.path("confidence").asDouble(0.0)));
            if (item.hasNonNull("action") && !item.get("action").asText().isBlank()) {
                builder.action(item.get("action").asText());
            }
            if (item.path("parameters").isObject()) {
                builder.parameters(objectMapper.convertValue(item.get("parameters"), MAP_TYPE));
            }
            intents.add(builder.build());
        }

        log.debug("[Intent] Extracted {} intent(s)", intents.size());
        return List.copyOf(intents);
    }

    private static double clamp(double confidence) {
        return Math.max(0.0, Math.min(1.0, confidence));
    }
}
