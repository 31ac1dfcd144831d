package com.wirefeed.backend.scraper.service;

import static com.wirefeed.backend.testing.SiteFixtures.CLOCK;
import static com.wirefeed.backend.testing.SiteFixtures.NOW;
import static com.wirefeed.backend.testing.SiteFixtures.article;
import static com.wirefeed.backend.testing.SiteFixtures.articleUrl;
import static com.wirefeed.backend.testing.SiteFixtures.paywalledArticle;
import static org.assertj.core.api.Assertions.assertThat;

import com.wirefeed.backend.config.NewsSiteConfig;
import com.wirefeed.backend.config.ScrapingConfig;
import com.wirefeed.backend.scraper.browser.BrowserManager;
import com.wirefeed.backend.scraper.browser.BrowserSession;
import com.wirefeed.backend.scraper.model.TeaserRecord;
import com.wirefeed.backend.scraper.parser.ArticleParser;
import com.wirefeed.backend.scraper.support.Sleeper;
import com.wirefeed.backend.testing.FakeBrowser;
import com.wirefeed.backend.testing.InMemoryIngestStore;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

class ConcurrentFetchPoolTest {

    private FakeBrowser browser;
    private InMemoryIngestStore store;
    private ConcurrentFetchPool pool;
    private JobStatistics statistics;
    private ThreadPoolTaskExecutor executor;

    @BeforeEach
    void setUp() {
        browser = new FakeBrowser();
        store = new InMemoryIngestStore();
        statistics = new JobStatistics();
        ScrapingConfig scrapingConfig = new ScrapingConfig();
        BrowserManager browserManager = new BrowserManager(browser, scrapingConfig, Sleeper.NONE);
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(8);
        executor.setThreadNamePrefix("Article-");
        executor.initialize();
        pool = new ConcurrentFetchPool(browserManager, new ArticleParser(new NewsSiteConfig(), CLOCK),
                store, scrapingConfig, executor, Sleeper.NONE);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private static TeaserRecord teaser(String id) {
        return TeaserRecord.builder()
                .url(articleUrl(id))
                .title("Story " + id)
                .publishedAt(NOW.minusMinutes(10))
                .build();
    }

    private List<TeaserRecord> servedArticles(int count) {
        List<TeaserRecord> teasers = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            String id = "story-" + i;
            browser.page(articleUrl(id), article("Story " + i, NOW.minusMinutes(10)));
            teasers.add(teaser(id));
        }
        return teasers;
    }

    private List<ArticleOutcome> run(List<TeaserRecord> teasers, int limit) throws InterruptedException {
        try (BrowserSession session = browser.launch()) {
            statistics.addFound(teasers.size());
            return pool.run(session, teasers, limit, Duration.ZERO, statistics);
        }
    }

    @Test
    @DisplayName("should never have more fetches in flight than the concurrency limit")
    void shouldBoundConcurrency() throws Exception {
        browser.navigationDelay(Duration.ofMillis(40));
        List<TeaserRecord> teasers = servedArticles(10);

        List<ArticleOutcome> outcomes = run(teasers, 3);

        assertThat(outcomes).hasSize(10).allMatch(outcome -> outcome.getStatus() == ArticleOutcome.Status.SAVED);
        assertThat(browser.getMaxActiveNavigations()).isBetween(1, 3);
        assertThat(store.size()).isEqualTo(10);
        assertThat(browser.getSessions().get(0).getOpenedPages()).hasSizeLessThanOrEqualTo(3);
    }

    @Test
    @DisplayName("should return outcomes in input order")
    void shouldPreserveInputOrder() throws Exception {
        List<TeaserRecord> teasers = servedArticles(5);

        List<ArticleOutcome> outcomes = run(teasers, 2);

        assertThat(outcomes).extracting(ArticleOutcome::getUrl)
                .containsExactlyElementsOf(teasers.stream().map(TeaserRecord::getUrl).toList());
    }

    @Test
    @DisplayName("should isolate failures and keep processing the other articles")
    void shouldIsolateFailures() throws Exception {
        List<TeaserRecord> teasers = new ArrayList<>(servedArticles(3));
        browser.failing(articleUrl("broken"));
        teasers.add(1, teaser("broken"));
        browser.page(articleUrl("locked"), paywalledArticle("Locked"));
        teasers.add(teaser("locked"));

        List<ArticleOutcome> outcomes = run(teasers, 2);

        assertThat(outcomes).extracting(ArticleOutcome::getStatus).containsExactly(
                ArticleOutcome.Status.SAVED,
                ArticleOutcome.Status.SKIPPED,
                ArticleOutcome.Status.SAVED,
                ArticleOutcome.Status.SAVED,
                ArticleOutcome.Status.SKIPPED);
        assertThat(store.urls()).doesNotContain(articleUrl("broken"), articleUrl("locked"));
        // two attempts, each trying the primary and the fallback wait strategy
        assertThat(browser.navigationsTo(articleUrl("broken"))).isEqualTo(4);
    }

    @Test
    @DisplayName("should keep counters consistent across every outcome")
    void shouldKeepCountersConsistent() throws Exception {
        List<TeaserRecord> teasers = new ArrayList<>(servedArticles(4));
        teasers.add(teaser("story-0"));
        browser.failing(articleUrl("gone"));
        teasers.add(teaser("gone"));
        browser.page(articleUrl("db-error"), article("Database error", NOW.minusMinutes(3)));
        store.failing(articleUrl("db-error"));
        teasers.add(teaser("db-error"));

        run(teasers, 3);

        assertThat(statistics.getFound()).isEqualTo(7);
        assertThat(statistics.getScraped()).isEqualTo(6);
        assertThat(statistics.getSaved()).isEqualTo(4);
        assertThat(statistics.getSkippedBeforeScrape()).isEqualTo(1);
        assertThat(statistics.getSkippedAfterScrape()).isEqualTo(1);
        assertThat(statistics.getErrors()).isEqualTo(1);
        assertThat(statistics.getScraped() + statistics.getSkippedBeforeScrape()).isEqualTo(statistics.getFound());
        assertThat(statistics.getSaved() + statistics.getSkippedAfterScrape() + statistics.getErrors())
                .isEqualTo(statistics.getScraped());
    }

    @Test
    @DisplayName("should store a URL listed twice only once")
    void shouldDeduplicateWithinRun() throws Exception {
        List<TeaserRecord> teasers = new ArrayList<>(servedArticles(1));
        teasers.add(teaser("story-0"));

        List<ArticleOutcome> outcomes = run(teasers, 2);

        assertThat(store.size()).isEqualTo(1);
        assertThat(outcomes).extracting(ArticleOutcome::getStatus)
                .containsExactlyInAnyOrder(ArticleOutcome.Status.SAVED, ArticleOutcome.Status.SKIPPED);
    }

    @Test
    @DisplayName("should do nothing for an empty teaser list")
    void shouldHandleEmptyInput() throws Exception {
        assertThat(run(List.of(), 5)).isEmpty();
        assertThat(browser.getSessions().get(0).getOpenedPages()).isEmpty();
    }
}
