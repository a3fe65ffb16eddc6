package me.golemcore.relay.domain.loop;

import me.golemcore.relay.domain.model.InboundEvent;
import me.golemcore.relay.domain.model.RoomIdentity;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RoomIdentityResolverTest {

    @Test
    void shouldUseTweetIdForTweetEvents() {
        InboundEvent event = InboundEvent.builder()
                .kind("tweet_received").source("twitter").tweetId("t1").username("alice").build();

        assertEquals(new RoomIdentity("twitter", "t1"), RoomIdentityResolver.resolve(event));
        assertEquals("Twitter Thread by alice", RoomIdentityResolver.roomName(event));
    }

    @Test
    void shouldFallBackToSourceWhenTweetIdMissing() {
        InboundEvent event = InboundEvent.builder().kind("tweet_received").source("twitter-main").build();

        assertEquals(new RoomIdentity("twitter", "twitter-main"), RoomIdentityResolver.resolve(event));
    }

    @Test
    void shouldUseSourceForDirectMessages() {
        InboundEvent event = InboundEvent.builder().kind("dm_received").source("dm-alice").build();

        assertEquals(new RoomIdentity("twitter", "dm-alice"), RoomIdentityResolver.resolve(event));
        assertEquals("Room for dm-alice", RoomIdentityResolver.roomName(event));
    }

    @Test
    void shouldUseChannelIdForDiscordEvents() {
        InboundEvent event = InboundEvent.builder()
                .kind("discord_message_received").source("discord").channelId("c42").build();

        assertEquals(new RoomIdentity("discord", "c42"), RoomIdentityResolver.resolve(event));
        assertEquals("Discord Channel c42", RoomIdentityResolver.roomName(event));
    }

    @Test
    void shouldDeriveUnknownKindsFromLeadingSourceToken() {
        InboundEvent event = InboundEvent.builder().kind("slack_message").source("slack-team1").build();

        assertEquals(new RoomIdentity("slack", "slack-team1"), RoomIdentityResolver.resolve(event));
    }

    @Test
    void shouldRouteInternalThoughtsToConsciousnessRoom() {
        InboundEvent event = InboundEvent.builder().kind("internal_thought").source("consciousness").build();

        assertEquals(new RoomIdentity("consciousness", "consciousness"), RoomIdentityResolver.resolve(event));
    }

    @Test
    void shouldBeTotalForMissingKindAndSource() {
        List<InboundEvent> events = List.of(
                InboundEvent.builder().build(),
                InboundEvent.builder().kind("tweet_received").build(),
                InboundEvent.builder().kind("discord_x").source("").build(),
                InboundEvent.builder().kind("other").source("-").build());

        for (InboundEvent event : events) {
            RoomIdentity identity = RoomIdentityResolver.resolve(event);
            assertNotNull(identity.platform());
            assertNotNull(identity.platformId());
            assertFalse(identity.platform().isBlank());
        }
    }

    @Test
    void shouldListUsernameThenSourceAsParticipants() {
        InboundEvent event = InboundEvent.builder()
                .kind("tweet_received").source("twitter").username("alice").build();

        assertEquals(Set.of("alice", "twitter"), RoomIdentityResolver.participants(event));
        assertEquals(Set.of("twitter"), RoomIdentityResolver.participants(
                InboundEvent.builder().kind("tweet_received").source("twitter").build()));
    }
}
