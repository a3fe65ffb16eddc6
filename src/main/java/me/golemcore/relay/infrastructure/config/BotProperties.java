package me.golemcore.relay.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Centralized configuration properties for the relay, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code bot.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - text-completion provider settings</li>
 * <li>{@link EmbeddingProperties} - embedding model used by the similarity
 * index</li>
 * <li>{@link ProcessorProperties} - enrichment and action pipeline tuning</li>
 * <li>{@link ConsciousnessProperties} - autonomous thought loop</li>
 * <li>{@link ClientProperties} - webhook bridge clients, keyed by client
 * id</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private LlmProperties llm = new LlmProperties();
    private EmbeddingProperties embedding = new EmbeddingProperties();
    private ProcessorProperties processor = new ProcessorProperties();
    private ConsciousnessProperties consciousness = new ConsciousnessProperties();
    private Map<String, ClientProperties> clients = new HashMap<>();

    @Data
    public static class LlmProperties {
        private String provider = "langchain4j";
        private Langchain4jProperties langchain4j = new Langchain4jProperties();
    }

    @Data
    public static class Langchain4jProperties {
        private String model = "openai/gpt-4o-mini";
        private long timeoutMs = 60000;
        private Map<String, ProviderProperties> providers = new HashMap<>();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    @Data
    public static class EmbeddingProperties {
        private String model = "text-embedding-3-small";
    }

    @Data
    public static class ProcessorProperties {
        private int relatedMemoryLimit = 3;
        private double enrichmentTemperature = 0.3;
        private double retryTemperature = 0.2;
        private double actionTemperature = 0.3;
        private double actionMinConfidence = 0.7;
        private int summaryMaxLength = 100;
    }

    @Data
    public static class ConsciousnessProperties {
        private boolean enabled = false;
        private long intervalMs = 60000;
        private double minConfidence = 0.7;
        private int memoriesPerRoom = 5;
        private int memorySampleSize = 10;
        private double temperature = 0.7;
    }

    @Data
    public static class ClientProperties {
        private boolean enabled = false;
        private String type = "webhook";
        private String callbackUrl;
        private String token;
    }
}
