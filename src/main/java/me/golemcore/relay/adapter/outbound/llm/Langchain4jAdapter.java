package me.golemcore.relay.adapter.outbound.llm;

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

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.LlmRequest;
import me.golemcore.relay.domain.model.LlmResponse;
import me.golemcore.relay.infrastructure.config.BotProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * LLM adapter using the langchain4j library.
 *
 * <p>
 * Supports OpenAI (and any OpenAI-compatible endpoint) and Anthropic. The
 * provider is taken from the model prefix of {@code bot.llm.langchain4j.model}
 * ({@code openai/gpt-4o-mini}, {@code anthropic/claude-3-5-haiku-latest});
 * credentials come from {@code bot.llm.langchain4j.providers.<provider>}.
 *
 * <p>
 * Temperature and token limits are applied per request. Failed calls are not
 * retried.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 *
 * @see LlmProviderAdapter
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmProviderAdapter {

    static final String PROVIDER_ID = "langchain4j";
    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String PROVIDER_OPENAI = "openai";
    private static final int ANTHROPIC_MAX_TOKENS = 4096;
    private static final String JSON_ONLY_INSTRUCTION = "Respond with valid JSON only.";

    private final BotProperties properties;

    private ChatModel chatModel;
    private String currentModel;
    private volatile boolean initialized = false;

    @Override
    public synchronized void initialize() {
        if (initialized) {
            return;
        }

        String model = properties.getLlm().getLangchain4j().getModel();
        this.currentModel = model;

        try {
            this.chatModel = createModel(model);
            initialized = true;
            log.info("Langchain4j adapter initialized with model: {}", model);
        } catch (RuntimeException e) {
            log.warn("Failed to initialize Langchain4j adapter: {}", e.getMessage());
        }
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();
            if (chatModel == null) {
                throw new IllegalStateException("Langchain4j adapter not available");
            }

            ChatRequest.Builder builder = ChatRequest.builder()
                    .messages(convertMessages(request))
                    .temperature(request.getTemperature());
            if (request.getMaxTokens() != null) {
                builder.maxOutputTokens(request.getMaxTokens());
            }

            try {
                ChatResponse response = chatModel.chat(builder.build());
                return convertResponse(response);
            } catch (RuntimeException e) {
                log.error("[LLM] Chat failed: {}", e.getMessage());
                throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
            }
        });
    }

    @Override
    public String getCurrentModel() {
        return currentModel;
    }

    @Override
    public boolean isAvailable() {
        String provider = providerOf(properties.getLlm().getLangchain4j().getModel());
        BotProperties.ProviderProperties config = properties.getLlm().getLangchain4j().getProviders()
                .get(provider);
        return config != null && config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    private void ensureInitialized() {
        if (!initialized) {
            initialize();
        }
    }

    private ChatModel createModel(String model) {
        String provider = providerOf(model);
        BotProperties.ProviderProperties config = getProviderConfig(provider);
        String modelName = stripProviderPrefix(model);

        if (PROVIDER_ANTHROPIC.equals(provider)) {
            return createAnthropicModel(modelName, config);
        }
        return createOpenAiModel(modelName, config);
    }

    private ChatModel createAnthropicModel(String modelName, BotProperties.ProviderProperties config) {
        var builder = AnthropicChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0)
                .maxTokens(ANTHROPIC_MAX_TOKENS)
                .timeout(Duration.ofMillis(properties.getLlm().getLangchain4j().getTimeoutMs()));

        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel(String modelName, BotProperties.ProviderProperties config) {
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0)
                .timeout(Duration.ofMillis(properties.getLlm().getLangchain4j().getTimeoutMs()));

        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private BotProperties.ProviderProperties getProviderConfig(String providerName) {
        var config = properties.getLlm().getLangchain4j().getProviders().get(providerName);
        if (config == null) {
            throw new IllegalStateException("Provider not configured: " + providerName
                    + ". Add bot.llm.langchain4j.providers." + providerName + ".api-key");
        }
        return config;
    }

    static String providerOf(String model) {
        return model != null && model.contains("/") ? model.substring(0, model.indexOf('/')) : PROVIDER_OPENAI;
    }

    static String stripProviderPrefix(String model) {
        return model.contains("/") ? model.substring(model.indexOf('/') + 1) : model;
    }

    private List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        String systemPrompt = request.getSystemPrompt();
        if (request.isStructuredOutput()) {
            systemPrompt = systemPrompt != null && !systemPrompt.isBlank()
                    ? systemPrompt + "\n\n" + JSON_ONLY_INSTRUCTION
                    : JSON_ONLY_INSTRUCTION;
        }
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(SystemMessage.from(systemPrompt));
        }
        messages.add(UserMessage.from(request.getPrompt() != null ? request.getPrompt() : ""));
        return messages;
    }

    private LlmResponse convertResponse(ChatResponse response) {
        AiMessage aiMessage = response.aiMessage();
        return LlmResponse.builder()
                .content(aiMessage.text())
                .model(currentModel)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }
}
