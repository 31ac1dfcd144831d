package com.wirefeed.backend.scraper.model;

import java.time.OffsetDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Immutable result of extracting one article page.
 */
@Value
@Builder(toBuilder = true)
public class ArticleFields {
    public static final int MAX_TAGS = 10;
    public static final int MAX_RELATED_URLS = 5;
    private static final int WORDS_PER_MINUTE = 200;

    String url;
    String title;
    String content;
    String author;
    OffsetDateTime publishedAt;
    String subtitle;
    String imageUrl;
    @Singular
    List<String> tags;
    @Singular
    List<String> relatedUrls;
    Integer wordCount;
    String readingTime;
    OffsetDateTime scrapedAt;

    public boolean hasRequiredFields() {
        return url != null && !url.isBlank()
                && title != null && !title.isBlank()
                && content != null && !content.isBlank();
    }

    public static int countWords(String content) {
        if (content == null || content.isBlank()) return 0;
        return content.trim().split("\\s+").length;
    }

    public static String readingTime(int wordCount) {
        return Math.max(1, wordCount / WORDS_PER_MINUTE) + " min read";
    }
}
