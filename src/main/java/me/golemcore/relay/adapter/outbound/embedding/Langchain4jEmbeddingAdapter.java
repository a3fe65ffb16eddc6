package me.golemcore.relay.adapter.outbound.embedding;

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

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.infrastructure.config.BotProperties;
import me.golemcore.relay.port.outbound.EmbeddingPort;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Embedding adapter using langchain4j and OpenAI. Backs semantic search in the
 * similarity index; unavailable when no OpenAI key is configured.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code bot.llm.langchain4j.providers.openai.api-key} - OpenAI API key
 * <li>{@code bot.embedding.model} - embedding model name
 * </ul>
 *
 * @see me.golemcore.relay.adapter.outbound.similarity.InMemorySimilarityIndex
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jEmbeddingAdapter implements EmbeddingPort {

    private static final String DEFAULT_MODEL = "text-embedding-3-small";

    private final BotProperties properties;

    private volatile EmbeddingModel embeddingModel;
    private volatile boolean initialized = false;

    private synchronized void ensureInitialized() {
        if (initialized) {
            return;
        }

        var openaiConfig = properties.getLlm().getLangchain4j().getProviders().get("openai");
        String apiKey = openaiConfig != null ? openaiConfig.getApiKey() : null;
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("[Similarity] OpenAI API key not configured, embeddings unavailable");
            initialized = true;
            return;
        }

        String model = getModel();
        try {
            var builder = OpenAiEmbeddingModel.builder()
                    .apiKey(apiKey)
                    .modelName(model);
            if (openaiConfig.getBaseUrl() != null) {
                builder.baseUrl(openaiConfig.getBaseUrl());
            }
            embeddingModel = builder.build();
            log.info("[Similarity] Embedding model initialized: {}", model);
        } catch (RuntimeException e) {
            log.error("[Similarity] Failed to initialize embedding model", e);
        }

        initialized = true;
    }

    @Override
    public CompletableFuture<float[]> embed(String text) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();

            if (embeddingModel == null) {
                throw new IllegalStateException("Embedding model not available");
            }

            Response<Embedding> response = embeddingModel.embed(text);
            return response.content().vector();
        });
    }

    @Override
    public String getModel() {
        String model = properties.getEmbedding().getModel();
        return model != null && !model.isBlank() ? model : DEFAULT_MODEL;
    }

    @Override
    public boolean isAvailable() {
        ensureInitialized();
        return embeddingModel != null;
    }
}
