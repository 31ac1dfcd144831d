package com.wirefeed.backend.scraper.service;

import com.wirefeed.backend.config.ScrapingConfig;
import com.wirefeed.backend.exception.PageFetchException;
import com.wirefeed.backend.ingest.IngestStore;
import com.wirefeed.backend.ingest.SaveResult;
import com.wirefeed.backend.scraper.browser.BrowserManager;
import com.wirefeed.backend.scraper.browser.BrowserSession;
import com.wirefeed.backend.scraper.browser.PageFetcher;
import com.wirefeed.backend.scraper.model.ArticleParseResult;
import com.wirefeed.backend.scraper.model.TeaserRecord;
import com.wirefeed.backend.scraper.parser.ArticleParser;
import com.wirefeed.backend.scraper.support.Backoff;
import com.wirefeed.backend.scraper.support.Sleeper;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Fetches, extracts and stores articles with a bounded number of tasks in flight.
 * <p>
 * Tasks run on the shared article executor; the semaphore admits at most the
 * requested number of them at once. Each admitted task borrows a browser page
 * from the run's idle queue. A failure in
 * one article never affects the others: every task resolves to an
 * {@link ArticleOutcome}.
 */
@Service
@Slf4j
public class ConcurrentFetchPool {

    private final BrowserManager browserManager;
    private final ArticleParser articleParser;
    private final IngestStore ingestStore;
    private final ScrapingConfig scrapingConfig;
    private final AsyncTaskExecutor articleTaskExecutor;
    private final Sleeper sleeper;

    @Autowired
    public ConcurrentFetchPool(BrowserManager browserManager, ArticleParser articleParser,
                               IngestStore ingestStore, ScrapingConfig scrapingConfig,
                               @Qualifier("articleTaskExecutor") AsyncTaskExecutor articleTaskExecutor) {
        this(browserManager, articleParser, ingestStore, scrapingConfig, articleTaskExecutor, Sleeper.THREAD);
    }

    public ConcurrentFetchPool(BrowserManager browserManager, ArticleParser articleParser,
                               IngestStore ingestStore, ScrapingConfig scrapingConfig,
                               AsyncTaskExecutor articleTaskExecutor, Sleeper sleeper) {
        this.browserManager = browserManager;
        this.articleParser = articleParser;
        this.ingestStore = ingestStore;
        this.scrapingConfig = scrapingConfig;
        this.articleTaskExecutor = articleTaskExecutor;
        this.sleeper = sleeper;
    }

    /**
     * Process every teaser and return the outcomes in input order.
     */
    public List<ArticleOutcome> run(BrowserSession session, List<TeaserRecord> teasers, int concurrencyLimit,
                                    Duration perRequestDelay, JobStatistics statistics) throws InterruptedException {
        if (teasers.isEmpty()) {
            return List.of();
        }

        int limit = Math.max(1, concurrencyLimit);
        log.info("Processing {} articles with up to {} in flight", teasers.size(), Math.min(limit, teasers.size()));

        Semaphore admission = new Semaphore(limit);
        ConcurrentLinkedQueue<PageFetcher> idleFetchers = new ConcurrentLinkedQueue<>();

        List<Future<ArticleOutcome>> futures = new ArrayList<>(teasers.size());
        for (TeaserRecord teaser : teasers) {
            futures.add(articleTaskExecutor.submit(() -> {
                ArticleOutcome outcome = processWithSlot(session, teaser, admission, idleFetchers, perRequestDelay);
                statistics.record(outcome);
                return outcome;
            }));
        }

        List<ArticleOutcome> outcomes = new ArrayList<>(futures.size());
        try {
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(awaitOutcome(futures.get(i), teasers.get(i).getUrl()));
            }
        } catch (InterruptedException e) {
            log.warn("Article pool interrupted, cancelling {} pending articles", futures.size() - outcomes.size());
            futures.forEach(future -> future.cancel(true));
            throw e;
        }
        return outcomes;
    }

    private ArticleOutcome awaitOutcome(Future<ArticleOutcome> future, String url) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            log.error("Unexpected failure in article pool for {}: {}", url, e.getCause().getMessage());
            return ArticleOutcome.errored(url);
        }
    }

    private ArticleOutcome processWithSlot(BrowserSession session, TeaserRecord teaser, Semaphore admission,
                                           ConcurrentLinkedQueue<PageFetcher> idleFetchers, Duration perRequestDelay) {
        String url = teaser.getUrl();
        try {
            admission.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ArticleOutcome.skippedBeforeScrape(url);
        }

        PageFetcher fetcher = null;
        try {
            fetcher = idleFetchers.poll();
            if (fetcher == null) {
                fetcher = browserManager.fetcherFor(session.newPage());
            }
            return processArticle(fetcher, url, perRequestDelay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ArticleOutcome.skippedBeforeScrape(url);
        } catch (RuntimeException e) {
            // Nothing was extracted, so this counts against the article rather than the store
            log.error("Error processing article {}: {}", url, e.getMessage());
            return ArticleOutcome.skippedBeforeScrape(url);
        } finally {
            if (fetcher != null) {
                idleFetchers.offer(fetcher);
            }
            admission.release();
        }
    }

    private ArticleOutcome processArticle(PageFetcher fetcher, String url, Duration perRequestDelay)
            throws InterruptedException {
        sleeper.sleep(perRequestDelay);

        String html;
        try {
            Backoff backoff = new Backoff(scrapingConfig.getArticleMaxRetries(), scrapingConfig.getBackoffCap(), sleeper);
            html = backoff.execute("Fetching " + url, () -> fetcher.fetch(url));
        } catch (PageFetchException e) {
            log.warn("Could not fetch article {}: {}", url, e.getMessage());
            return ArticleOutcome.skippedBeforeScrape(url);
        }

        ArticleParseResult parsed = articleParser.parse(url, html);
        if (!parsed.isOk()) {
            log.debug("Skipping article {}: {}", url, parsed.getStatus());
            return ArticleOutcome.skippedBeforeScrape(url);
        }

        try {
            SaveResult result = ingestStore.trySave(parsed.getFields());
            return result == SaveResult.INSERTED
                    ? ArticleOutcome.saved(url)
                    : ArticleOutcome.skippedAfterScrape(url);
        } catch (RuntimeException e) {
            log.error("Error saving article {}: {}", url, e.getMessage(), e);
            return ArticleOutcome.errored(url);
        }
    }
}
