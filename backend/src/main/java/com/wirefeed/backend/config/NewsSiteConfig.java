package com.wirefeed.backend.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Selector configuration for the crawled news site.
 * <p>
 * Every list is an ordered fallback chain: the first selector that matches
 * wins. Defaults target the Financial Times "World" section and can be
 * overridden from application.yml when the site markup drifts.
 */
@Data
@ConfigurationProperties(prefix = "site")
@Component
public class NewsSiteConfig {
    private String name = "Financial Times";
    private String baseUrl = "https://www.ft.com";
    private String listingPath = "/world";
    private String titleSuffix = " | Financial Times";

    // Listing page
    private List<String> listingContainerSelectors = new ArrayList<>(List.of(
            "ul.o-teaser-collection__list",
            "div.o-teaser-collection",
            "div.stream-list",
            "main"));
    private List<String> listingItemSelectors = new ArrayList<>(List.of(
            "li.o-teaser-collection__item",
            "div.o-teaser",
            "article"));
    private List<String> premiumLabelSelectors = new ArrayList<>(List.of(
            ".o-labels--premium",
            ".o-teaser__premium-label",
            "[data-trackable=premium-label]"));
    private List<String> teaserHeadingSelectors = new ArrayList<>(List.of(
            ".o-teaser__heading a",
            "a.js-teaser-heading-link",
            "h3 a"));
    private List<String> teaserStandfirstSelectors = new ArrayList<>(List.of(
            ".o-teaser__standfirst",
            "p.standfirst"));
    private List<String> teaserAuthorSelectors = new ArrayList<>(List.of(
            ".o-teaser__tag",
            ".o-teaser__meta a"));
    private List<String> teaserTimeSelectors = new ArrayList<>(List.of(
            ".o-teaser__timestamp time",
            "time"));

    // Article page
    private List<String> paywallSelectors = new ArrayList<>(List.of(
            ".barrier-page",
            ".subscription-banner",
            "[data-trackable=subscribe-banner]",
            ".o-banner--subscription"));
    private List<String> paywallPhrases = new ArrayList<>(List.of(
            "Subscribe to read",
            "Premium subscribers only",
            "Try full digital access"));
    private List<String> titleSelectors = new ArrayList<>(List.of(
            "h1.n-content-header--headline",
            "h1[data-trackable=headline]",
            ".article-headline h1",
            "h1.o-typography-headline--large"));
    private List<String> contentSelectors = new ArrayList<>(List.of(
            ".n-content-body",
            "[data-trackable=story-body]",
            ".article-body",
            ".o-editorial-typography-body"));
    private List<String> contentIgnoreSelectors = new ArrayList<>(List.of(
            "script", "style", "aside", "nav"));
    private List<String> authorSelectors = new ArrayList<>(List.of(
            "[data-trackable=author]",
            ".n-content-header--byline a",
            ".article-author",
            ".byline a"));
    private List<String> publishedTimeSelectors = new ArrayList<>(List.of(
            "time[datetime]",
            "[data-trackable=timestamp]",
            ".article-timestamp"));
    private List<String> subtitleSelectors = new ArrayList<>(List.of(
            ".n-content-header--standfirst",
            "[data-trackable=standfirst]",
            ".article-subtitle",
            ".o-editorial-typography-standfirst"));
    private List<String> imageSelectors = new ArrayList<>(List.of(
            ".n-image img",
            ".article-image img",
            ".o-editorial-layout-wrapper img"));
    private List<String> tagSelectors = new ArrayList<>(List.of(
            "[data-trackable=topic] a",
            ".article-tags a",
            ".topics a"));
    private List<String> relatedArticleSelectors = new ArrayList<>(List.of(
            ".related-articles a[href*='/content/']",
            ".recommended-articles a[href*='/content/']",
            ".more-on a[href*='/content/']"));

    // URL patterns that never point at an article
    private List<String> excludedUrlPatterns = new ArrayList<>(List.of(
            "/video/", "/podcast/", "/live-news/", "/markets/", "/opinion/", "/lex/",
            "mailto:", "javascript:", "#", "?"));

    public String getListingUrl(int page) {
        return baseUrl.replaceAll("/$", "") + listingPath + "?page=" + page;
    }

    /**
     * Check if a link looks like an article on this site
     */
    public boolean isArticleUrl(String url) {
        if (url == null || url.isBlank()) return false;
        String lowerUrl = url.toLowerCase();
        for (String pattern : excludedUrlPatterns) {
            if (lowerUrl.contains(pattern.toLowerCase())) {
                return false;
            }
        }
        return url.contains("/content/") || url.startsWith("/world/");
    }
}
