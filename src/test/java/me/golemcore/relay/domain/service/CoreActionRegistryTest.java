package me.golemcore.relay.domain.service;

import me.golemcore.relay.domain.model.ActionDescriptor;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CoreActionRegistryTest {

    @Test
    void shouldRegisterBuiltinActions() {
        CoreActionRegistry registry = new CoreActionRegistry();

        Map<String, ActionDescriptor> actions = registry.getAvailableActions();

        assertEquals(List.of("tweet", "tweet_thought", "dm", "discord_message"), List.copyOf(actions.keySet()));
        ActionDescriptor tweet = actions.get("tweet");
        assertEquals("tweet_request", tweet.getEventKind());
        assertEquals("twitter", tweet.getClientId());
        assertTrue(tweet.getParameters().get("content").isRequired());
        assertEquals("discord", actions.get("discord_message").getClientId());
        assertEquals("dm_request", actions.get("dm").getEventKind());
    }

    @Test
    void shouldOverwriteExistingKind() {
        CoreActionRegistry registry = new CoreActionRegistry();
        ActionDescriptor replacement = ActionDescriptor.builder()
                .kind("tweet")
                .description("Post through the staging bridge")
                .eventKind("tweet_request")
                .clientId("twitter-staging")
                .build();

        registry.registerAction(replacement);

        assertSame(replacement, registry.getActionDefinition("tweet").orElseThrow());
        assertEquals(4, registry.getAvailableActions().size());
    }

    @Test
    void shouldRegisterContributedDescriptors() {
        ActionDescriptor slack = ActionDescriptor.builder()
                .kind("slack_post")
                .eventKind("slack_message")
                .clientId("slack")
                .build();

        CoreActionRegistry registry = new CoreActionRegistry(List.of(slack));

        assertTrue(registry.getActionDefinition("slack_post").isPresent());
        assertTrue(registry.getActionDefinition("unknown").isEmpty());
        assertTrue(registry.getActionDefinition(null).isEmpty());
    }

    @Test
    void shouldReturnSnapshotOfAvailableActions() {
        CoreActionRegistry registry = new CoreActionRegistry();
        Map<String, ActionDescriptor> snapshot = registry.getAvailableActions();

        registry.registerAction(ActionDescriptor.builder().kind("later").eventKind("x").clientId("y").build());

        assertFalse(snapshot.containsKey("later"));
        assertThrows(UnsupportedOperationException.class, () -> snapshot.remove("tweet"));
    }
}
