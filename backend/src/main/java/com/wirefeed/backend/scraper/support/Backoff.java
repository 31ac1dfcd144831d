package com.wirefeed.backend.scraper.support;

import java.time.Duration;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Capped exponential backoff: the pause after attempt {@code n} (0-based) is
 * {@code min(2^n seconds, cap)}.
 */
@Slf4j
public class Backoff {

    private final int maxAttempts;
    private final Duration cap;
    private final Sleeper sleeper;

    public Backoff(int maxAttempts, Duration cap, Sleeper sleeper) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.cap = cap;
        this.sleeper = sleeper;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration delayFor(int attempt) {
        long seconds = attempt >= 62 ? Long.MAX_VALUE : 1L << attempt;
        return seconds >= cap.getSeconds() ? cap : Duration.ofSeconds(seconds);
    }

    public void pause(int attempt) throws InterruptedException {
        sleeper.sleep(delayFor(attempt));
    }

    /**
     * Run {@code action} until it succeeds or attempts are exhausted; the last
     * failure is rethrown. Interruption during a pause aborts immediately.
     */
    public <T> T execute(String description, Supplier<T> action) {
        RuntimeException last = null;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (RuntimeException e) {
                last = e;
                if (attempt == maxAttempts - 1) break;
                Duration delay = delayFor(attempt);
                log.warn("{} failed (attempt {}/{}): {} - retrying in {}s",
                        description, attempt + 1, maxAttempts, e.getMessage(), delay.getSeconds());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
        throw last;
    }
}
