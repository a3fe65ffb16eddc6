package me.golemcore.relay.domain.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventKindTest {

    @Test
    void shouldMapKnownKindsToFamilies() {
        assertEquals(EventKind.PlatformFamily.TWITTER_TWEET, EventKind.TWEET_RECEIVED.family());
        assertEquals(EventKind.PlatformFamily.TWITTER_DM, EventKind.DM_RECEIVED.family());
        assertEquals(EventKind.PlatformFamily.DISCORD, EventKind.DISCORD_MESSAGE_RECEIVED.family());
        assertEquals(EventKind.PlatformFamily.OTHER, EventKind.INTERNAL_THOUGHT.family());
    }

    @Test
    void shouldResolveUnknownAndNullKindsToFamilies() {
        assertEquals(EventKind.PlatformFamily.TWITTER_TWEET, EventKind.PlatformFamily.of("tweet_liked"));
        assertEquals(EventKind.PlatformFamily.OTHER, EventKind.PlatformFamily.of("slack_message"));
        assertEquals(EventKind.PlatformFamily.OTHER, EventKind.PlatformFamily.of(null));
    }

    @Test
    void shouldLookUpByTag() {
        assertEquals(EventKind.TWEET_REQUEST, EventKind.fromTag("tweet_request").orElseThrow());
        assertTrue(EventKind.fromTag("nope").isEmpty());
        assertTrue(EventKind.fromTag(null).isEmpty());
    }

    @Test
    void shouldMergeMetadataIntoCopy() {
        InboundEvent event = InboundEvent.builder()
                .kind("tweet_received")
                .source("twitter")
                .metadataEntry("a", 1)
                .build();

        InboundEvent merged = event.withMetadata(Map.of("b", 2));

        assertEquals(Map.of("a", 1), event.getMetadata());
        assertEquals(Map.of("a", 1, "b", 2), merged.getMetadata());
        assertSame(event, event.withMetadata(Map.of()));
        assertTrue(merged.isKind(EventKind.TWEET_RECEIVED));
    }
}
