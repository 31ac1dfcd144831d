package com.wirefeed.backend.scraper.service;

import com.wirefeed.backend.config.NewsSiteConfig;
import com.wirefeed.backend.config.ScrapingConfig;
import com.wirefeed.backend.exception.PageFetchException;
import com.wirefeed.backend.scraper.browser.PageFetcher;
import com.wirefeed.backend.scraper.model.ListingPage;
import com.wirefeed.backend.scraper.model.TeaserRecord;
import com.wirefeed.backend.scraper.model.TimeWindow;
import com.wirefeed.backend.scraper.parser.ListingParser;
import com.wirefeed.backend.scraper.support.Backoff;
import com.wirefeed.backend.scraper.support.Sleeper;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Walks listing pages in order and collects teasers until a stop condition holds.
 * <p>
 * Stop conditions, checked after each page in this order: the page bound is
 * reached; too many consecutive pages had no matching teaser; the last teaser
 * of the page is already older than the time window.
 */
@Service
@Slf4j
public class PaginationWalker {

    private final ListingParser listingParser;
    private final NewsSiteConfig siteConfig;
    private final ScrapingConfig scrapingConfig;
    private final Sleeper sleeper;

    @Autowired
    public PaginationWalker(ListingParser listingParser, NewsSiteConfig siteConfig, ScrapingConfig scrapingConfig) {
        this(listingParser, siteConfig, scrapingConfig, Sleeper.THREAD);
    }

    public PaginationWalker(ListingParser listingParser, NewsSiteConfig siteConfig,
                            ScrapingConfig scrapingConfig, Sleeper sleeper) {
        this.listingParser = listingParser;
        this.siteConfig = siteConfig;
        this.scrapingConfig = scrapingConfig;
        this.sleeper = sleeper;
    }

    public List<TeaserRecord> walk(PageFetcher fetcher, int maxPages, TimeWindow window) throws InterruptedException {
        log.info("Collecting teasers from up to {} listing pages{}", maxPages,
                window != null ? " published after " + window.getCutoff() : "");

        List<TeaserRecord> result = new ArrayList<>();
        int consecutiveEmptyPages = 0;
        int emptyPageLimit = Math.max(1, scrapingConfig.getEmptyPageLimit());
        int page = 1;

        while (true) {
            ListingPage listing = fetchListingPage(fetcher, page);
            List<TeaserRecord> matching = listing.matching(window);
            result.addAll(matching);
            log.info("Page {}: {} teasers, {} within window (total {})",
                    page, listing.getTeasers().size(), matching.size(), result.size());

            consecutiveEmptyPages = matching.isEmpty() ? consecutiveEmptyPages + 1 : 0;
            page++;

            if (page > maxPages) {
                log.info("Stopping: page bound {} reached", maxPages);
                break;
            }
            if (consecutiveEmptyPages >= emptyPageLimit) {
                log.info("Stopping: {} consecutive pages without matching articles", consecutiveEmptyPages);
                break;
            }
            if (listing.crossesWindow(window)) {
                log.info("Stopping: reached articles older than {}", window.getCutoff());
                break;
            }

            sleeper.sleep(scrapingConfig.getInterPageDelayDuration());
        }

        return result;
    }

    /**
     * Fetch and parse one listing page, retrying the fetch when it fails or the
     * listing container is missing. Exhausted retries yield an empty page.
     */
    private ListingPage fetchListingPage(PageFetcher fetcher, int page) throws InterruptedException {
        String url = siteConfig.getListingUrl(page);
        Backoff backoff = new Backoff(scrapingConfig.getPageMaxRetries(), scrapingConfig.getBackoffCap(), sleeper);

        for (int attempt = 0; attempt < backoff.getMaxAttempts(); attempt++) {
            try {
                ListingPage listing = listingParser.parsePage(fetcher.fetch(url));
                if (listing.isContainerFound()) {
                    return listing;
                }
                log.warn("No listing container on {} (attempt {}/{})", url, attempt + 1, backoff.getMaxAttempts());
            } catch (PageFetchException e) {
                log.warn("Error loading {} (attempt {}/{}): {}", url, attempt + 1, backoff.getMaxAttempts(), e.getMessage());
            }
            if (attempt < backoff.getMaxAttempts() - 1) {
                backoff.pause(attempt);
            }
        }

        log.error("Giving up on listing page {} after {} attempts, treating it as empty", page, backoff.getMaxAttempts());
        return ListingPage.missing();
    }
}
