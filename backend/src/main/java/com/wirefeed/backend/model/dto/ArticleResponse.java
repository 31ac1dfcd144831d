package com.wirefeed.backend.model.dto;

import com.wirefeed.backend.db.entity.Article;
import com.wirefeed.backend.db.entity.RelatedArticle;
import com.wirefeed.backend.db.entity.Tag;
import java.time.OffsetDateTime;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArticleResponse {
    private Long id;
    private String url;
    private String title;
    private String content;
    private String author;
    private OffsetDateTime publishedAt;
    private OffsetDateTime scrapedAt;
    private String subtitle;
    private String imageUrl;
    private Integer wordCount;
    private String readingTime;
    private List<String> tags;
    private List<String> relatedUrls;

    public static ArticleResponse from(Article article) {
        return ArticleResponse.builder()
                .id(article.getId())
                .url(article.getUrl())
                .title(article.getTitle())
                .content(article.getContent())
                .author(article.getAuthor())
                .publishedAt(article.getPublishedAt())
                .scrapedAt(article.getScrapedAt())
                .subtitle(article.getSubtitle())
                .imageUrl(article.getImageUrl())
                .wordCount(article.getWordCount())
                .readingTime(article.getReadingTime())
                .tags(article.getTags().stream().map(Tag::getName).toList())
                .relatedUrls(article.getRelatedArticles().stream().map(RelatedArticle::getRelatedUrl).toList())
                .build();
    }
}
