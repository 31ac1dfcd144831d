package com.wirefeed.backend.scheduler;

import com.wirefeed.backend.config.ScrapingConfig;
import com.wirefeed.backend.ingest.IngestStore;
import com.wirefeed.backend.scraper.model.TimeWindow;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Chooses between a bulk backfill and an incremental refresh.
 * <p>
 * Bulk mode is only possible on the first run of the process, and only when the
 * store is empty. Once any run has completed the selector stays incremental.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ModeSelector {

    private final IngestStore ingestStore;
    private final ScrapingConfig scrapingConfig;
    private final Clock clock;

    private final AtomicBoolean firstRun = new AtomicBoolean(true);

    public ScrapePlan select() {
        if (firstRun.get() && storeIsEmpty()) {
            return new ScrapePlan(RunMode.BULK,
                    TimeWindow.lastDays(clock, scrapingConfig.getInitialDaysBack()),
                    scrapingConfig.getBulkMaxPages());
        }
        return new ScrapePlan(RunMode.INCREMENTAL,
                TimeWindow.lastHours(clock, scrapingConfig.getIncrementalWindowHours()),
                scrapingConfig.getIncrementalMaxPages());
    }

    public ScrapePlan manual(int daysBack) {
        return new ScrapePlan(RunMode.MANUAL, TimeWindow.lastDays(clock, daysBack), scrapingConfig.getBulkMaxPages());
    }

    public void markCompleted() {
        if (firstRun.compareAndSet(true, false)) {
            log.info("First run finished, later runs are incremental");
        }
    }

    public boolean isFirstRun() {
        return firstRun.get();
    }

    private boolean storeIsEmpty() {
        try {
            return ingestStore.isEmpty();
        } catch (RuntimeException e) {
            log.warn("Could not check whether the article store is empty, using incremental mode: {}", e.getMessage());
            return false;
        }
    }
}
