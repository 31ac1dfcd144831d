package com.wirefeed.backend.scraper.browser;

import com.wirefeed.backend.exception.PageFetchException;
import java.time.Duration;

/**
 * One browser tab. Not safe for concurrent use; each worker owns its own page.
 */
public interface BrowserPage extends AutoCloseable {

    void navigate(String url, WaitStrategy waitStrategy, Duration timeout) throws PageFetchException;

    String content() throws PageFetchException;

    /**
     * Release the tab. Never throws.
     */
    @Override
    void close();
}
