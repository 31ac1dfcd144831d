package com.wirefeed.backend.scheduler;

import com.wirefeed.backend.config.ScrapingConfig;
import com.wirefeed.backend.exception.BrowserLaunchException;
import com.wirefeed.backend.model.dto.ScrapingRunReport;
import com.wirefeed.backend.scraper.browser.BrowserManager;
import com.wirefeed.backend.scraper.browser.BrowserSession;
import com.wirefeed.backend.scraper.browser.PageFetcher;
import com.wirefeed.backend.scraper.model.TeaserRecord;
import com.wirefeed.backend.scraper.service.ConcurrentFetchPool;
import com.wirefeed.backend.scraper.service.JobStatistics;
import com.wirefeed.backend.scraper.service.PaginationWalker;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs one scraping job end to end: listing walk, article pool, run report.
 * <p>
 * At most one job runs at a time. A job that cannot start because another is
 * in flight is skipped, not queued.
 */
@Service
@Slf4j
public class ScrapingJobService {

    private final BrowserManager browserManager;
    private final PaginationWalker paginationWalker;
    private final ConcurrentFetchPool fetchPool;
    private final ModeSelector modeSelector;
    private final ScrapingConfig scrapingConfig;
    private final Clock clock;
    private final Executor manualExecutor;

    private final AtomicBoolean jobInProgress = new AtomicBoolean(false);
    private final AtomicReference<ScrapingRunReport> lastReport = new AtomicReference<>();

    public ScrapingJobService(BrowserManager browserManager,
                              PaginationWalker paginationWalker,
                              ConcurrentFetchPool fetchPool,
                              ModeSelector modeSelector,
                              ScrapingConfig scrapingConfig,
                              Clock clock,
                              @Qualifier("manualScrapingExecutor") Executor manualExecutor) {
        this.browserManager = browserManager;
        this.paginationWalker = paginationWalker;
        this.fetchPool = fetchPool;
        this.modeSelector = modeSelector;
        this.scrapingConfig = scrapingConfig;
        this.clock = clock;
        this.manualExecutor = manualExecutor;
    }

    /**
     * Run a job in the mode picked by {@link ModeSelector}.
     *
     * @return the run report, or empty when another job was already in progress
     */
    public Optional<ScrapingRunReport> runJob() {
        return runExclusively(null);
    }

    /**
     * Run a manual job covering the last {@code daysBack} days.
     */
    public Optional<ScrapingRunReport> runJob(int daysBack) {
        return runExclusively(daysBack);
    }

    /**
     * Start a manual job on a background thread.
     *
     * @return false when a job is already in progress
     */
    public boolean startManualRun(int daysBack) {
        if (!jobInProgress.compareAndSet(false, true)) {
            return false;
        }
        try {
            manualExecutor.execute(() -> {
                try {
                    execute(modeSelector.manual(daysBack));
                } finally {
                    jobInProgress.set(false);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            jobInProgress.set(false);
            log.warn("Manual run rejected: {}", e.getMessage());
            return false;
        }
    }

    public boolean isJobInProgress() {
        return jobInProgress.get();
    }

    public Optional<ScrapingRunReport> getLastReport() {
        return Optional.ofNullable(lastReport.get());
    }

    private Optional<ScrapingRunReport> runExclusively(Integer daysBack) {
        if (!jobInProgress.compareAndSet(false, true)) {
            log.info("⏳ Skipping run, a scraping job is already in progress");
            return Optional.empty();
        }
        try {
            ScrapePlan plan = daysBack != null ? modeSelector.manual(daysBack) : modeSelector.select();
            return Optional.of(execute(plan));
        } finally {
            jobInProgress.set(false);
        }
    }

    private ScrapingRunReport execute(ScrapePlan plan) {
        OffsetDateTime startedAt = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
        long startNanos = System.nanoTime();
        JobStatistics statistics = new JobStatistics();
        String failureMessage = null;

        log.info("🚀 Starting {} scraping run: articles since {}, up to {} listing pages",
                plan.getMode().getRunType(), plan.getWindow().getCutoff(), plan.getMaxPages());

        try (BrowserSession session = browserManager.openSession()) {
            PageFetcher listingFetcher = browserManager.fetcherFor(session.newPage());
            List<TeaserRecord> teasers = paginationWalker.walk(listingFetcher, plan.getMaxPages(), plan.getWindow());
            statistics.addFound(teasers.size());
            log.info("🔗 Found {} candidate articles", teasers.size());

            fetchPool.run(session, teasers, scrapingConfig.getMaxConcurrentRequests(),
                    scrapingConfig.getRequestDelayDuration(), statistics);
        } catch (BrowserLaunchException e) {
            statistics.recordJobError();
            failureMessage = e.getMessage();
            log.error("❌ Browser could not be started: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            statistics.recordJobError();
            failureMessage = "Interrupted";
            log.warn("Scraping run interrupted");
        } catch (RuntimeException e) {
            statistics.recordJobError();
            failureMessage = e.getMessage();
            log.error("❌ Scraping run failed: {}", e.getMessage(), e);
        } finally {
            modeSelector.markCompleted();
        }

        ScrapingRunReport report = ScrapingRunReport.builder()
                .found(statistics.getFound())
                .scraped(statistics.getScraped())
                .saved(statistics.getSaved())
                .skipped(statistics.getSkipped())
                .errors(statistics.getErrors())
                .durationSeconds((System.nanoTime() - startNanos) / 1_000_000_000.0)
                .runType(plan.getMode().getRunType())
                .startedAt(startedAt)
                .failed(failureMessage != null)
                .failureMessage(failureMessage)
                .build();
        lastReport.set(report);
        logReport(report);
        return report;
    }

    private void logReport(ScrapingRunReport report) {
        log.info("🎯 Scraping run ({}) finished in {}s: found={}, scraped={}, saved={}, skipped={}, errors={}{}",
                report.getRunType(), String.format("%.1f", report.getDurationSeconds()),
                report.getFound(), report.getScraped(), report.getSaved(), report.getSkipped(), report.getErrors(),
                report.isFailed() ? " (failed: " + report.getFailureMessage() + ")" : "");
    }
}
