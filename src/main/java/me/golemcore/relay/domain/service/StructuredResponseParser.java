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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort extraction of a JSON document from free-form completion text.
 *
 * <p>
 * Fallback order:
 * <ol>
 * <li>strip a fenced code block ({@code ```json ... ```}) if present</li>
 * <li>parse the remaining text directly</li>
 * <li>extract the outermost {@code {...}} (or {@code [...]}) span and parse
 * it</li>
 * <li>fail with {@link StructuredResponseException}</li>
 * </ol>
 * Callers decide how to degrade on failure.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StructuredResponseParser {

    private static final Pattern FENCED_BLOCK_PATTERN = Pattern.compile("```[\\w-]*\\s*\\n?(.*?)\\s*```",
            Pattern.DOTALL);
    private static final Pattern OBJECT_PATTERN = Pattern.compile("(\\{.*})", Pattern.DOTALL);
    private static final Pattern ARRAY_PATTERN = Pattern.compile("(\\[.*])", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    /**
     * Parses the response into a JSON tree.
     *
     * @throws StructuredResponseException
     *             if no JSON document can be recovered
     */
    public JsonNode parse(String response) {
        if (response == null || response.isBlank()) {
            throw new StructuredResponseException("Empty response");
        }

        String candidate = stripCodeBlock(response);

        JsonNode direct = tryParse(candidate);
        if (direct != null) {
            return direct;
        }

        JsonNode extracted = tryParse(extractBraces(candidate));
        if (extracted != null) {
            return extracted;
        }

        throw new StructuredResponseException("No JSON document found in response: " + abbreviate(response));
    }

    /**
     * Parses the response and requires a JSON object at the top level.
     */
    public JsonNode parseObject(String response) {
        JsonNode node = parse(response);
        if (!node.isObject()) {
            throw new StructuredResponseException("Expected JSON object but got " + node.getNodeType());
        }
        return node;
    }

    /**
     * Removes markdown code fences and any language identifier.
     */
    public String stripCodeBlock(String text) {
        if (text == null) {
            return "";
        }
        Matcher matcher = FENCED_BLOCK_PATTERN.matcher(text);
        if (matcher.find()) {
            return matcher.group(1).trim();
        }
        return text.trim();
    }

    private String extractBraces(String text) {
        Matcher objectMatcher = OBJECT_PATTERN.matcher(text);
        if (objectMatcher.find()) {
            return objectMatcher.group(1);
        }
        Matcher arrayMatcher = ARRAY_PATTERN.matcher(text);
        if (arrayMatcher.find()) {
            return arrayMatcher.group(1);
        }
        return null;
    }

    private JsonNode tryParse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(text);
            if (node == null || !(node.isObject() || node.isArray())) {
                return null;
            }
            return node;
        } catch (JsonProcessingException e) {
            log.trace("[Parser] Candidate is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static String abbreviate(String text) {
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }

    /**
     * Raised when a completion response cannot be turned into the expected JSON
     * document.
     */
    public static class StructuredResponseException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        public StructuredResponseException(String message) {
            super(message);
        }
    }
}
