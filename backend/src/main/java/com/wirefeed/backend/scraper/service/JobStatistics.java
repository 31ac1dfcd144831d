package com.wirefeed.backend.scraper.service;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-safe counters for one job run. Updates are commutative, so article
 * tasks may record their outcomes in any order.
 */
public class JobStatistics {

    private final AtomicInteger found = new AtomicInteger();
    private final AtomicInteger scraped = new AtomicInteger();
    private final AtomicInteger saved = new AtomicInteger();
    private final AtomicInteger skippedBeforeScrape = new AtomicInteger();
    private final AtomicInteger skippedAfterScrape = new AtomicInteger();
    private final AtomicInteger errors = new AtomicInteger();

    public void addFound(int count) {
        found.addAndGet(count);
    }

    public void record(ArticleOutcome outcome) {
        if (outcome.isScraped()) {
            scraped.incrementAndGet();
        }
        switch (outcome.getStatus()) {
            case SAVED -> saved.incrementAndGet();
            case SKIPPED -> (outcome.isScraped() ? skippedAfterScrape : skippedBeforeScrape).incrementAndGet();
            case ERRORED -> errors.incrementAndGet();
        }
    }

    /**
     * A failure outside any article task, such as a browser that cannot be launched.
     */
    public void recordJobError() {
        errors.incrementAndGet();
    }

    public int getFound() {
        return found.get();
    }

    public int getScraped() {
        return scraped.get();
    }

    public int getSaved() {
        return saved.get();
    }

    public int getSkipped() {
        return skippedBeforeScrape.get() + skippedAfterScrape.get();
    }

    public int getSkippedBeforeScrape() {
        return skippedBeforeScrape.get();
    }

    public int getSkippedAfterScrape() {
        return skippedAfterScrape.get();
    }

    public int getErrors() {
        return errors.get();
    }
}
