package com.wirefeed.backend.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "scraping")
@Data
public class ScrapingConfig {

    // Scheduling
    private int intervalHours = 1;
    private boolean autoStart = true;

    // Mode selection
    private int initialDaysBack = 30;
    private int bulkMaxPages = 50;
    private int incrementalWindowHours = 1;
    private int incrementalMaxPages = 5;

    // Fetching and pacing (seconds)
    private int maxConcurrentRequests = 5;
    private double requestDelay = 2.0;
    private double interPageDelay = 1.0;
    private int navigationTimeout = 30;

    // Retry policy
    private int launchMaxRetries = 3;
    private int pageMaxRetries = 3;
    private int articleMaxRetries = 2;
    private int backoffCapSeconds = 10;

    // Stop and abort heuristics
    private int emptyPageLimit = 3;
    private int batchAbortThreshold = 5;

    public Duration getRequestDelayDuration() {
        return Duration.ofMillis((long) (requestDelay * 1000));
    }

    public Duration getInterPageDelayDuration() {
        return Duration.ofMillis((long) (interPageDelay * 1000));
    }

    public Duration getNavigationTimeoutDuration() {
        return Duration.ofSeconds(navigationTimeout);
    }

    public Duration getBackoffCap() {
        return Duration.ofSeconds(backoffCapSeconds);
    }
}
