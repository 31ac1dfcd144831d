package com.wirefeed.backend.scheduler;

import com.wirefeed.backend.config.ScrapingConfig;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Starts the recurring scraping job once the application is ready.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScrapingScheduler {

    private final ThreadPoolTaskScheduler scrapingTaskScheduler;
    private final ScrapingJobService jobService;
    private final ScrapingConfig scrapingConfig;

    private volatile ScheduledFuture<?> scheduledRun;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!scrapingConfig.isAutoStart()) {
            log.info("🔕 Automatic scraping disabled via configuration");
            return;
        }
        start();
    }

    /**
     * Run a job now, then every {@code interval-hours}.
     */
    public synchronized void start() {
        if (isRunning()) {
            return;
        }
        Duration interval = Duration.ofHours(Math.max(1, scrapingConfig.getIntervalHours()));
        scheduledRun = scrapingTaskScheduler.scheduleAtFixedRate(this::runScheduledJob, Instant.now(), interval);
        log.info("⏰ Scraping scheduled every {} hour(s)", interval.toHours());
    }

    @PreDestroy
    public synchronized void stop() {
        if (scheduledRun != null) {
            scheduledRun.cancel(false);
            scheduledRun = null;
            log.info("Scraping schedule stopped");
        }
    }

    public boolean isRunning() {
        ScheduledFuture<?> run = scheduledRun;
        return run != null && !run.isCancelled();
    }

    void runScheduledJob() {
        if (jobService.isJobInProgress()) {
            log.info("⏳ Skipping scheduled run, previous job still in progress");
            return;
        }
        // An exception escaping here would cancel every later run
        try {
            jobService.runJob();
        } catch (RuntimeException e) {
            log.error("❌ Scheduled scraping run failed: {}", e.getMessage(), e);
        }
    }
}
