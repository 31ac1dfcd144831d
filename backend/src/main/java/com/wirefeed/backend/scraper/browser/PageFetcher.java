package com.wirefeed.backend.scraper.browser;

import com.wirefeed.backend.exception.PageFetchException;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;

/**
 * Navigates one page and returns its rendered HTML, falling back to the
 * {@link WaitStrategy#LOAD} strategy when the requested one times out.
 */
@Slf4j
public class PageFetcher {

    private static final WaitStrategy FALLBACK_STRATEGY = WaitStrategy.LOAD;

    private final BrowserPage page;
    private final Duration timeout;

    public PageFetcher(BrowserPage page, Duration timeout) {
        this.page = page;
        this.timeout = timeout;
    }

    public String fetch(String url) {
        return fetch(url, WaitStrategy.NETWORK_IDLE);
    }

    public String fetch(String url, WaitStrategy waitStrategy) {
        try {
            page.navigate(url, waitStrategy, timeout);
        } catch (PageFetchException e) {
            if (waitStrategy == FALLBACK_STRATEGY) throw e;
            log.debug("Wait strategy {} failed for {}, falling back to {}: {}",
                    waitStrategy, url, FALLBACK_STRATEGY, e.getMessage());
            page.navigate(url, FALLBACK_STRATEGY, timeout);
        }
        String html = page.content();
        if (html == null || html.isBlank()) {
            throw new PageFetchException("Empty page content for " + url);
        }
        return html;
    }
}
