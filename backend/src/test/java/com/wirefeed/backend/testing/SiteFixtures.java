package com.wirefeed.backend.testing;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * HTML fixtures shaped like the default site selectors.
 */
public final class SiteFixtures {

    public static final String BASE_URL = "https://www.ft.com";
    public static final OffsetDateTime NOW = OffsetDateTime.of(2024, 1, 16, 12, 0, 0, 0, ZoneOffset.UTC);
    public static final Clock CLOCK = Clock.fixed(Instant.from(NOW), ZoneOffset.UTC);

    private SiteFixtures() {
    }

    public static String listingUrl(int page) {
        return BASE_URL + "/world?page=" + page;
    }

    public static String articleUrl(String id) {
        return BASE_URL + "/content/" + id;
    }

    public static String teaser(String id, String title, OffsetDateTime publishedAt) {
        return "<li class=\"o-teaser-collection__item\"><div class=\"o-teaser\">"
                + "<div class=\"o-teaser__heading\"><a href=\"/content/" + id + "\">" + title + "</a></div>"
                + "<p class=\"o-teaser__standfirst\">Standfirst for " + title + "</p>"
                + "<a class=\"o-teaser__tag\" href=\"/world\">World</a>"
                + "<div class=\"o-teaser__timestamp\"><time datetime=\"" + publishedAt + "\"></time></div>"
                + "</div></li>";
    }

    public static String premiumTeaser(String id, String title, OffsetDateTime publishedAt) {
        return teaser(id, title, publishedAt)
                .replace("<div class=\"o-teaser\">",
                        "<div class=\"o-teaser\"><span class=\"o-labels--premium\">Premium</span>");
    }

    public static String listing(String... teasers) {
        return "<html><body><ul class=\"o-teaser-collection__list\">"
                + String.join("", teasers)
                + "</ul></body></html>";
    }

    public static String article(String title, OffsetDateTime publishedAt, String... paragraphs) {
        String body = Arrays.stream(paragraphs)
                .map(p -> "<p>" + p + "</p>")
                .collect(Collectors.joining());
        return "<html><head><title>" + title + " | Financial Times</title></head><body>"
                + "<h1 class=\"n-content-header--headline\">" + title + "</h1>"
                + "<a data-trackable=\"author\" href=\"/stream/author\">Jane Reporter</a>"
                + "<time datetime=\"" + publishedAt + "\"></time>"
                + "<div class=\"n-content-body\">" + body + "</div>"
                + "</body></html>";
    }

    public static String article(String title, OffsetDateTime publishedAt) {
        return article(title, publishedAt,
                "Officials met on Monday to discuss the outcome of the negotiations.",
                "Markets reacted calmly as investors weighed the consequences for trade.");
    }

    public static String paywalledArticle(String title) {
        return "<html><head><title>" + title + " | Financial Times</title></head><body>"
                + "<h1 class=\"n-content-header--headline\">" + title + "</h1>"
                + "<div class=\"barrier-page\">Subscribe to read</div>"
                + "</body></html>";
    }
}
