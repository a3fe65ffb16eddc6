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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.ActionDescriptor;
import me.golemcore.relay.domain.model.ActionExample;
import me.golemcore.relay.domain.model.ActionParameter;
import me.golemcore.relay.domain.model.EventKind;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory action catalog pre-populated with the built-in Twitter and Discord
 * actions. Additional {@link ActionDescriptor} beans are registered on
 * construction; runtime registration is last-write-wins.
 */
@Service
@Slf4j
public class CoreActionRegistry implements ActionRegistry {

    public static final String ACTION_TWEET = "tweet";
    public static final String ACTION_TWEET_THOUGHT = "tweet_thought";
    public static final String ACTION_DM = "dm";
    public static final String ACTION_DISCORD_MESSAGE = "discord_message";

    private static final String CLIENT_TWITTER = "twitter";
    private static final String CLIENT_DISCORD = "discord";
    private static final String TYPE_STRING = "string";
    private static final String TYPE_OBJECT = "object";

    private final Map<String, ActionDescriptor> actions = Collections.synchronizedMap(new LinkedHashMap<>());

    public CoreActionRegistry() {
        this(List.of());
    }

    @Autowired
    public CoreActionRegistry(ObjectProvider<ActionDescriptor> contributedActions) {
        this(contributedActions.orderedStream().toList());
    }

    public CoreActionRegistry(List<ActionDescriptor> contributedActions) {
        builtinActions().forEach(this::registerAction);
        if (contributedActions != null) {
            contributedActions.forEach(this::registerAction);
        }
    }

    @Override
    public Map<String, ActionDescriptor> getAvailableActions() {
        synchronized (actions) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(actions));
        }
    }

    @Override
    public Optional<ActionDescriptor> getActionDefinition(String kind) {
        if (kind == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(actions.get(kind));
    }

    @Override
    public void registerAction(ActionDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(descriptor.getKind(), "descriptor.kind");
        ActionDescriptor previous = actions.put(descriptor.getKind(), descriptor);
        if (previous != null) {
            log.info("[Actions] Replaced action: {}", descriptor.getKind());
        } else {
            log.debug("[Actions] Registered action: {} -> {}@{}",
                    descriptor.getKind(), descriptor.getEventKind(), descriptor.getClientId());
        }
    }

    private static List<ActionDescriptor> builtinActions() {
        ActionParameter replyTo = ActionParameter.builder()
                .type(TYPE_STRING)
                .description("Tweet ID to reply to")
                .required(false)
                .example("1234567890")
                .build();

        ActionDescriptor tweet = ActionDescriptor.builder()
                .kind(ACTION_TWEET)
                .description("Post a new tweet to Twitter")
                .targetPlatform(CLIENT_TWITTER)
                .eventKind(EventKind.TWEET_REQUEST.tag())
                .clientId(CLIENT_TWITTER)
                .parameter("content", ActionParameter.builder()
                        .type(TYPE_STRING)
                        .description("The tweet content")
                        .required(true)
                        .example("Just shipped a new release of our bot!")
                        .build())
                .parameter("replyTo", replyTo)
                .parameter("context", ActionParameter.builder()
                        .type(TYPE_OBJECT)
                        .description("Additional context about the tweet")
                        .required(false)
                        .example(Map.of())
                        .build())
                .example(ActionExample.builder()
                        .description("Posting a product update")
                        .actionEntry("type", EventKind.TWEET_REQUEST.tag())
                        .actionEntry("target", CLIENT_TWITTER)
                        .actionEntry("content", "New release is out: faster replies and better memory!")
                        .build())
                .build();

        ActionDescriptor tweetThought = ActionDescriptor.builder()
                .kind(ACTION_TWEET_THOUGHT)
                .description("Convert an internal thought into a tweet")
                .targetPlatform(CLIENT_TWITTER)
                .eventKind(EventKind.TWEET_REQUEST.tag())
                .clientId(CLIENT_TWITTER)
                .parameter("content", ActionParameter.builder()
                        .type(TYPE_STRING)
                        .description("The tweet content")
                        .required(true)
                        .example("Deep thoughts about AI...")
                        .build())
                .parameter("context", ActionParameter.builder()
                        .type(TYPE_OBJECT)
                        .description("Additional context about the thought")
                        .required(false)
                        .example(Map.of("mood", "contemplative", "topics", List.of("AI")))
                        .build())
                .parameter("replyTo", replyTo)
                .example(ActionExample.builder()
                        .description("Converting a philosophical thought into a tweet")
                        .actionEntry("type", EventKind.TWEET_REQUEST.tag())
                        .actionEntry("target", CLIENT_TWITTER)
                        .actionEntry("content", "Neural networks learn like children: simple shapes first, "
                                + "then concepts. #AI")
                        .build())
                .build();

        ActionDescriptor directMessage = ActionDescriptor.builder()
                .kind(ACTION_DM)
                .description("Send a direct message to a Twitter user")
                .targetPlatform(CLIENT_TWITTER)
                .eventKind(EventKind.DM_REQUEST.tag())
                .clientId(CLIENT_TWITTER)
                .parameter("content", ActionParameter.builder()
                        .type(TYPE_STRING)
                        .description("The message text")
                        .required(true)
                        .example("Thanks for reaching out!")
                        .build())
                .parameter("userId", ActionParameter.builder()
                        .type(TYPE_STRING)
                        .description("Recipient user ID")
                        .required(true)
                        .example("987654321")
                        .build())
                .build();

        ActionDescriptor discordMessage = ActionDescriptor.builder()
                .kind(ACTION_DISCORD_MESSAGE)
                .description("Post a message to a Discord channel")
                .targetPlatform(CLIENT_DISCORD)
                .eventKind(EventKind.DISCORD_MESSAGE.tag())
                .clientId(CLIENT_DISCORD)
                .parameter("content", ActionParameter.builder()
                        .type(TYPE_STRING)
                        .description("The message text")
                        .required(true)
                        .example("Good morning, everyone!")
                        .build())
                .parameter("channelId", ActionParameter.builder()
                        .type(TYPE_STRING)
                        .description("Discord channel ID")
                        .required(true)
                        .example("112233445566")
                        .build())
                .build();

        return List.of(tweet, tweetThought, directMessage, discordMessage);
    }
}
