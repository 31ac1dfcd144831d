package com.wirefeed.backend.scraper.model;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import lombok.Value;

/**
 * Recency filter: accepts timestamps newer than {@code reference - duration}.
 * <p>
 * Future-dated timestamps are always accepted. Clock skew or a mis-parsed date
 * can therefore keep an item "recent" indefinitely.
 */
@Value
public class TimeWindow {
    OffsetDateTime reference;
    Duration duration;

    public static TimeWindow lastDays(Clock clock, int days) {
        return new TimeWindow(OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC), Duration.ofDays(days));
    }

    public static TimeWindow lastHours(Clock clock, int hours) {
        return new TimeWindow(OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC), Duration.ofHours(hours));
    }

    public OffsetDateTime getCutoff() {
        return reference.minus(duration);
    }

    public boolean accepts(OffsetDateTime publishedAt) {
        if (publishedAt == null) return false;
        return publishedAt.isAfter(getCutoff());
    }
}
