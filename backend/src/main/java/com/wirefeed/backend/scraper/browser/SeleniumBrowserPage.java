package com.wirefeed.backend.scraper.browser;

import com.wirefeed.backend.exception.PageFetchException;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.support.ui.WebDriverWait;

@Slf4j
class SeleniumBrowserPage implements BrowserPage {

    private static final Duration QUIET_PERIOD = Duration.ofMillis(500);

    private final WebDriver driver;

    SeleniumBrowserPage(WebDriver driver) {
        this.driver = driver;
    }

    @Override
    public void navigate(String url, WaitStrategy waitStrategy, Duration timeout) {
        try {
            driver.manage().timeouts().pageLoadTimeout(timeout);
            driver.get(url);

            switch (waitStrategy) {
                case NETWORK_IDLE -> awaitNetworkIdle(timeout);
                case LOAD -> new WebDriverWait(driver, timeout).until(SeleniumBrowserPage::isDocumentComplete);
                case DOM_CONTENT_LOADED -> {
                    // driver.get already returns at DOMContentLoaded with the EAGER strategy
                }
            }
        } catch (WebDriverException e) {
            throw new PageFetchException("Navigation to " + url + " failed (" + waitStrategy + "): " + e.getMessage(), e);
        }
    }

    @Override
    public String content() {
        try {
            return driver.getPageSource();
        } catch (WebDriverException e) {
            throw new PageFetchException("Could not read page source: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        try {
            driver.quit();
        } catch (Exception e) {
            log.warn("Error closing browser page: {}", e.getMessage());
        }
    }

    private void awaitNetworkIdle(Duration timeout) {
        long[] lastCount = {-1L};
        new WebDriverWait(driver, timeout, QUIET_PERIOD).until(d -> {
            if (!isDocumentComplete(d)) return false;
            Object entries = ((JavascriptExecutor) d)
                    .executeScript("return window.performance.getEntriesByType('resource').length;");
            long count = entries instanceof Number ? ((Number) entries).longValue() : 0L;
            boolean idle = count == lastCount[0];
            lastCount[0] = count;
            return idle;
        });
    }

    private static boolean isDocumentComplete(WebDriver d) {
        Object state = ((JavascriptExecutor) d).executeScript("return document.readyState;");
        return "complete".equals(state);
    }
}
