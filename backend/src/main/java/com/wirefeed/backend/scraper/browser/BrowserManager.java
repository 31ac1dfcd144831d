package com.wirefeed.backend.scraper.browser;

import com.wirefeed.backend.config.ScrapingConfig;
import com.wirefeed.backend.exception.BrowserLaunchException;
import com.wirefeed.backend.scraper.support.Backoff;
import com.wirefeed.backend.scraper.support.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Opens browser sessions and page fetchers with the configured retry and timeout policy.
 */
@Component
@Slf4j
public class BrowserManager {

    private final BrowserLauncher launcher;
    private final ScrapingConfig scrapingConfig;
    private final Sleeper sleeper;

    @Autowired
    public BrowserManager(BrowserLauncher launcher, ScrapingConfig scrapingConfig) {
        this(launcher, scrapingConfig, Sleeper.THREAD);
    }

    public BrowserManager(BrowserLauncher launcher, ScrapingConfig scrapingConfig, Sleeper sleeper) {
        this.launcher = launcher;
        this.scrapingConfig = scrapingConfig;
        this.sleeper = sleeper;
    }

    public BrowserSession openSession() {
        Backoff backoff = new Backoff(scrapingConfig.getLaunchMaxRetries(), scrapingConfig.getBackoffCap(), sleeper);
        try {
            return backoff.execute("Browser launch", launcher::launch);
        } catch (RuntimeException e) {
            throw new BrowserLaunchException(
                    "Could not launch browser after " + backoff.getMaxAttempts() + " attempts: " + e.getMessage(), e);
        }
    }

    public PageFetcher fetcherFor(BrowserPage page) {
        return new PageFetcher(page, scrapingConfig.getNavigationTimeoutDuration());
    }
}
