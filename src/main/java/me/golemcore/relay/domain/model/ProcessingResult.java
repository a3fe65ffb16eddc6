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

import java.util.List;

/**
 * Output of one pipeline run: extracted intents, suggested outbound events and
 * the enrichment context.
 */
@Value
@Builder
public class ProcessingResult {

    @Builder.Default
    List<Intent> intents = List.of();

    @Builder.Default
    List<OutboundEvent> suggestedActions = List.of();

    EnrichedContext enrichedContext;

    public static ProcessingResult degraded(EnrichedContext context) {
        return ProcessingResult.builder()
                .enrichedContext(context)
                .build();
    }
}
