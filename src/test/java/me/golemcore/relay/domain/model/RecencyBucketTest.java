package me.golemcore.relay.domain.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RecencyBucketTest {

    @ParameterizedTest
    @CsvSource({
            "23.9, VERY_RECENT",
            "24.1, RECENT",
            "71.9, RECENT",
            "72.1, THIS_WEEK",
            "167.9, THIS_WEEK",
            "168.1, THIS_MONTH",
            "719.9, THIS_MONTH",
            "720.1, OLDER"
    })
    void shouldBucketJustBelowAndAboveThresholds(double hours, RecencyBucket expected) {
        assertEquals(expected, RecencyBucket.ofHours(hours));
    }

    @Test
    void shouldTreatUpperBoundsAsExclusive() {
        assertEquals(RecencyBucket.RECENT, RecencyBucket.ofHours(24));
        assertEquals(RecencyBucket.THIS_WEEK, RecencyBucket.ofHours(72));
        assertEquals(RecencyBucket.THIS_MONTH, RecencyBucket.ofHours(168));
        assertEquals(RecencyBucket.OLDER, RecencyBucket.ofHours(720));
    }

    @Test
    void shouldComputeBucketBetweenInstants() {
        Instant now = Instant.parse("2026-03-01T12:00:00Z");

        assertEquals(RecencyBucket.VERY_RECENT, RecencyBucket.between(now.minus(Duration.ofMinutes(5)), now));
        assertEquals(RecencyBucket.RECENT, RecencyBucket.between(now.minus(Duration.ofHours(48)), now));
        assertEquals(RecencyBucket.OLDER, RecencyBucket.between(now.minus(Duration.ofDays(40)), now));
    }

    @Test
    void shouldBucketExtremeTimestampsWithoutOverflow() {
        Instant now = Instant.parse("2026-03-01T12:00:00Z");

        assertEquals(RecencyBucket.OLDER, RecencyBucket.between(Instant.MIN, now));
        assertEquals(RecencyBucket.VERY_RECENT, RecencyBucket.between(Instant.MAX, now));
    }

    @Test
    void shouldTreatMissingTimestampAsVeryRecent() {
        assertEquals(RecencyBucket.VERY_RECENT, RecencyBucket.between(null, Instant.now()));
    }

    @Test
    void shouldExposeWireLabels() {
        assertEquals("very_recent", RecencyBucket.VERY_RECENT.label());
        assertEquals("this_week", RecencyBucket.THIS_WEEK.label());
        assertEquals("older", RecencyBucket.OLDER.label());
    }
}
