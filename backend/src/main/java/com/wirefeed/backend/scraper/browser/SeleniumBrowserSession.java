package com.wirefeed.backend.scraper.browser;

import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.WebDriver;

/**
 * Selenium has no tab-level isolation between threads, so every page is its own WebDriver.
 */
@Slf4j
class SeleniumBrowserSession implements BrowserSession {

    private final WebDriverFactory driverFactory;
    private final List<BrowserPage> pages = new ArrayList<>();
    private WebDriver launchedDriver;

    SeleniumBrowserSession(WebDriverFactory driverFactory, WebDriver launchedDriver) {
        this.driverFactory = driverFactory;
        this.launchedDriver = launchedDriver;
    }

    @Override
    public synchronized BrowserPage newPage() {
        WebDriver driver;
        if (launchedDriver != null) {
            driver = launchedDriver;
            launchedDriver = null;
        } else {
            driver = driverFactory.createDriver();
        }
        BrowserPage page = new SeleniumBrowserPage(driver);
        pages.add(page);
        return page;
    }

    @Override
    public synchronized void close() {
        log.debug("Closing browser session with {} page(s)", pages.size());
        for (BrowserPage page : pages) {
            page.close();
        }
        pages.clear();
        if (launchedDriver != null) {
            try {
                launchedDriver.quit();
            } catch (Exception e) {
                log.warn("Error closing browser: {}", e.getMessage());
            }
            launchedDriver = null;
        }
    }
}
