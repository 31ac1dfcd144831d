package com.wirefeed.backend.scraper.service;

import static com.wirefeed.backend.testing.SiteFixtures.CLOCK;
import static com.wirefeed.backend.testing.SiteFixtures.NOW;
import static com.wirefeed.backend.testing.SiteFixtures.listing;
import static com.wirefeed.backend.testing.SiteFixtures.listingUrl;
import static com.wirefeed.backend.testing.SiteFixtures.teaser;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.wirefeed.backend.config.NewsSiteConfig;
import com.wirefeed.backend.config.ScrapingConfig;
import com.wirefeed.backend.exception.PageFetchException;
import com.wirefeed.backend.scraper.browser.PageFetcher;
import com.wirefeed.backend.scraper.model.TeaserRecord;
import com.wirefeed.backend.scraper.model.TimeWindow;
import com.wirefeed.backend.scraper.parser.ListingParser;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PaginationWalkerTest {

    private static final String EMPTY_LISTING = listing();

    @Mock
    private PageFetcher fetcher;

    private final List<Duration> pauses = new ArrayList<>();
    private PaginationWalker walker;

    @BeforeEach
    void setUp() {
        NewsSiteConfig siteConfig = new NewsSiteConfig();
        walker = new PaginationWalker(new ListingParser(siteConfig, CLOCK), siteConfig, new ScrapingConfig(), pauses::add);
    }

    private static String page(String prefix, int count) {
        String[] teasers = new String[count];
        for (int i = 0; i < count; i++) {
            teasers[i] = teaser(prefix + i, "Story " + prefix + i, NOW.minusMinutes(i + 1));
        }
        return listing(teasers);
    }

    @Nested
    @DisplayName("stop conditions")
    class StopConditions {

        @Test
        @DisplayName("should stop after three consecutive empty pages")
        void shouldStopAfterThreeEmptyPages() throws Exception {
            when(fetcher.fetch(listingUrl(1))).thenReturn(page("a", 2));
            when(fetcher.fetch(listingUrl(2))).thenReturn(page("b", 2));
            when(fetcher.fetch(listingUrl(3))).thenReturn(page("c", 2));
            when(fetcher.fetch(listingUrl(4))).thenReturn(EMPTY_LISTING);
            when(fetcher.fetch(listingUrl(5))).thenReturn(EMPTY_LISTING);
            when(fetcher.fetch(listingUrl(6))).thenReturn(EMPTY_LISTING);

            List<TeaserRecord> result = walker.walk(fetcher, 20, null);

            assertThat(result).hasSize(6);
            verify(fetcher, times(6)).fetch(anyString());
            verify(fetcher, never()).fetch(listingUrl(7));
        }

        @Test
        @DisplayName("should reset the empty counter when a page has matches")
        void shouldResetEmptyCounter() throws Exception {
            when(fetcher.fetch(listingUrl(1))).thenReturn(EMPTY_LISTING);
            when(fetcher.fetch(listingUrl(2))).thenReturn(EMPTY_LISTING);
            when(fetcher.fetch(listingUrl(3))).thenReturn(page("a", 1));
            when(fetcher.fetch(listingUrl(4))).thenReturn(EMPTY_LISTING);
            when(fetcher.fetch(listingUrl(5))).thenReturn(EMPTY_LISTING);

            assertThat(walker.walk(fetcher, 5, null)).hasSize(1);
            verify(fetcher, times(5)).fetch(anyString());
        }

        @Test
        @DisplayName("should never fetch beyond the page bound")
        void shouldRespectPageBound() throws Exception {
            when(fetcher.fetch(listingUrl(1))).thenReturn(page("a", 3));
            when(fetcher.fetch(listingUrl(2))).thenReturn(page("b", 3));

            List<TeaserRecord> result = walker.walk(fetcher, 2, null);

            assertThat(result).extracting(TeaserRecord::getTitle)
                    .containsExactly("Story a0", "Story a1", "Story a2", "Story b0", "Story b1", "Story b2");
            verify(fetcher, never()).fetch(listingUrl(3));
            assertThat(pauses).containsExactly(Duration.ofSeconds(1));
        }

        @Test
        @DisplayName("should stop once the last teaser of a page falls outside the window")
        void shouldStopAtWindowBoundary() throws Exception {
            when(fetcher.fetch(listingUrl(1))).thenReturn(listing(
                    teaser("new", "Fresh", NOW.minusMinutes(5)),
                    teaser("mid", "Stale", NOW.minusHours(3)),
                    teaser("late", "Also fresh", NOW.minusMinutes(20)),
                    teaser("old", "Old", NOW.minusHours(6))));

            List<TeaserRecord> result = walker.walk(fetcher, 5, TimeWindow.lastHours(CLOCK, 1));

            assertThat(result).extracting(TeaserRecord::getTitle).containsExactly("Fresh", "Also fresh");
            verify(fetcher, times(1)).fetch(anyString());
        }
    }

    @Nested
    @DisplayName("listing retries")
    class Retries {

        @Test
        @DisplayName("should retry a failed listing fetch")
        void shouldRetryFailedFetch() throws Exception {
            when(fetcher.fetch(listingUrl(1)))
                    .thenThrow(new PageFetchException("timeout"))
                    .thenThrow(new PageFetchException("timeout"))
                    .thenReturn(page("a", 2));

            assertThat(walker.walk(fetcher, 1, null)).hasSize(2);
            verify(fetcher, times(3)).fetch(listingUrl(1));
            assertThat(pauses).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
        }

        @Test
        @DisplayName("should treat a page without container as empty after retries")
        void shouldTreatMissingContainerAsEmpty() throws Exception {
            when(fetcher.fetch(listingUrl(1))).thenReturn("<html><body><p>Please wait</p></body></html>");

            assertThat(walker.walk(fetcher, 1, null)).isEmpty();
            verify(fetcher, times(3)).fetch(listingUrl(1));
        }
    }
}
