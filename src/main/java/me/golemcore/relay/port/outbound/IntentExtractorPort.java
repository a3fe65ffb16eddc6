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

import me.golemcore.relay.domain.model.Intent;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for classifying inbound content into an ordered list of intents.
 */
public interface IntentExtractorPort {

    /**
     * Extracts intents from content.
     *
     * @param content
     *            the inbound content
     * @param promptOverride
     *            optional replacement for the default classification prompt, may
     *            be {@code null}
     * @return intents in extraction order, never {@code null}
     */
    CompletableFuture<List<Intent>> extract(String content, String promptOverride);

    default CompletableFuture<List<Intent>> extract(String content) {
        return extract(content, null);
    }
}
