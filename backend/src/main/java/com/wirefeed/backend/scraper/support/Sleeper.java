package com.wirefeed.backend.scraper.support;

import java.time.Duration;

/**
 * Blocking pause used for request pacing and retry backoff.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> {
        if (!duration.isZero() && !duration.isNegative()) {
            Thread.sleep(duration.toMillis());
        }
    };

    Sleeper NONE = duration -> {
    };

    void sleep(Duration duration) throws InterruptedException;
}
