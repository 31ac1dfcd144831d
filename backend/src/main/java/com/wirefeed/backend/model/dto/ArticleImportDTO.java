package com.wirefeed.backend.model.dto;

import com.wirefeed.backend.scraper.model.ArticleFields;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An already extracted article submitted through the import endpoint.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ArticleImportDTO {
    @NotBlank
    @Size(max = 1024)
    private String url;
    private String title;
    private String content;
    private String author;
    private String publishedAt; // ISO-8601 with offset
    private String subtitle;
    private String imageUrl;
    private List<String> tags = new ArrayList<>();
    private List<String> relatedUrls = new ArrayList<>();

    // Unparseable dates yield null, which the store rejects as invalid
    public OffsetDateTime getParsedPublishedAt() {
        if (publishedAt == null || publishedAt.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(publishedAt.trim());
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public ArticleFields toFields(OffsetDateTime scrapedAt) {
        int wordCount = ArticleFields.countWords(content);
        return ArticleFields.builder()
                .url(url)
                .title(title)
                .content(content)
                .author(author)
                .publishedAt(getParsedPublishedAt())
                .subtitle(subtitle)
                .imageUrl(imageUrl)
                .tags(tags != null ? tags : List.of())
                .relatedUrls(relatedUrls != null ? relatedUrls : List.of())
                .wordCount(wordCount)
                .readingTime(ArticleFields.readingTime(wordCount))
                .scrapedAt(scrapedAt)
                .build();
    }
}
