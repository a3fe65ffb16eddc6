package me.golemcore.relay.adapter.inbound.webhook.dto;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Request body for {@code POST /api/clients/{clientId}/events}: one inbound
 * platform event pushed by an external bridge.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InboundEventRequest {

    /** Event kind, e.g. {@code tweet_received}. Required. */
    private String kind;

    /** Event source. Defaults to the client id. */
    private String source;

    private String content;

    /** Original event time. Defaults to the time of receipt. */
    private Instant timestamp;

    private String tweetId;
    private String userId;
    private String username;
    private String channelId;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();
}
