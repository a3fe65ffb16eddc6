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
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Registered capability describing how an intent is turned into an outbound
 * event: which event kind it produces and which client id receives it.
 */
@Value
@Builder(toBuilder = true)
public class ActionDescriptor {

    String kind;
    String description;

    @Singular
    List<String> targetPlatforms;

    /**
     * Kind of the outbound event produced by this action.
     */
    String eventKind;

    /**
     * Client id the outbound event is addressed to.
     */
    String clientId;

    @Singular
    Map<String, ActionParameter> parameters;

    @Singular
    List<ActionExample> examples;
}
