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

import me.golemcore.relay.domain.model.ActionDescriptor;

import java.util.Map;
import java.util.Optional;

/**
 * Catalog of actions the pipeline may suggest, keyed by action kind.
 */
public interface ActionRegistry {

    /**
     * Returns every registered descriptor, in registration order.
     */
    Map<String, ActionDescriptor> getAvailableActions();

    Optional<ActionDescriptor> getActionDefinition(String kind);

    /**
     * Registers a descriptor, replacing any existing one of the same kind.
     */
    void registerAction(ActionDescriptor descriptor);
}
