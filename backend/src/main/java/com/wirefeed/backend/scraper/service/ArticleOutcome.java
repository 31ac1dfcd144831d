package com.wirefeed.backend.scraper.service;

import lombok.Value;

/**
 * What happened to one teaser in the article pool.
 */
@Value
public class ArticleOutcome {

    public enum Status {
        SAVED,
        SKIPPED,
        ERRORED
    }

    String url;
    Status status;
    /** True once the article page was fetched and extracted successfully. */
    boolean scraped;

    public static ArticleOutcome saved(String url) {
        return new ArticleOutcome(url, Status.SAVED, true);
    }

    public static ArticleOutcome skippedBeforeScrape(String url) {
        return new ArticleOutcome(url, Status.SKIPPED, false);
    }

    public static ArticleOutcome skippedAfterScrape(String url) {
        return new ArticleOutcome(url, Status.SKIPPED, true);
    }

    public static ArticleOutcome errored(String url) {
        return new ArticleOutcome(url, Status.ERRORED, true);
    }
}
