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

import java.time.Duration;
import java.time.Instant;

/**
 * Coarse recency of an event relative to "now". Thresholds are exclusive upper
 * bounds in hours: 24, 72, 168, 720.
 */
public enum RecencyBucket {

    VERY_RECENT("very_recent", 24),
    RECENT("recent", 72),
    THIS_WEEK("this_week", 168),
    THIS_MONTH("this_month", 720),
    OLDER("older", Double.POSITIVE_INFINITY);

    private static final double SECONDS_PER_HOUR = 3_600d;

    private final String label;
    private final double upperBoundHours;

    RecencyBucket(String label, double upperBoundHours) {
        this.label = label;
        this.upperBoundHours = upperBoundHours;
    }

    public String label() {
        return label;
    }

    public static RecencyBucket ofHours(double elapsedHours) {
        for (RecencyBucket bucket : values()) {
            if (elapsedHours < bucket.upperBoundHours) {
                return bucket;
            }
        }
        return OLDER;
    }

    public static RecencyBucket of(Duration elapsed) {
        return ofHours(elapsed.getSeconds() / SECONDS_PER_HOUR);
    }

    public static RecencyBucket between(Instant timestamp, Instant now) {
        if (timestamp == null) {
            return VERY_RECENT;
        }
        return of(Duration.between(timestamp, now));
    }
}
