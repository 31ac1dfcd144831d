package com.wirefeed.backend.scraper.model;

import java.time.OffsetDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Lightweight listing-page record, discovered before the full article is fetched.
 */
@Value
@Builder
public class TeaserRecord {
    public static final String UNKNOWN_AUTHOR = "Unknown";

    String url;
    String title;
    @Builder.Default
    String standfirst = "";
    @Builder.Default
    String author = UNKNOWN_AUTHOR;
    OffsetDateTime publishedAt;
}
