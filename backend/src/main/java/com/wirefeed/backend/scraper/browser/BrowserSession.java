package com.wirefeed.backend.scraper.browser;

/**
 * A launched browser. Pages opened from it are closed together with it.
 */
public interface BrowserSession extends AutoCloseable {

    BrowserPage newPage();

    /**
     * Release every page and the browser itself. Close failures are logged, never thrown.
     */
    @Override
    void close();
}
