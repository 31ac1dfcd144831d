package com.wirefeed.backend.scraper.parser;

import com.wirefeed.backend.config.NewsSiteConfig;
import com.wirefeed.backend.scraper.model.ListingPage;
import com.wirefeed.backend.scraper.model.TeaserRecord;
import com.wirefeed.backend.scraper.model.TimeWindow;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

/**
 * Extracts article teasers from a listing page.
 */
@Component
@Slf4j
public class ListingParser {

    // "January 15 2024 10:30 am"
    static final DateTimeFormatter TEASER_DATE_FORMAT = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("MMMM d yyyy h:mm a")
            .toFormatter(Locale.ENGLISH);

    private final NewsSiteConfig siteConfig;
    private final Clock clock;

    public ListingParser(NewsSiteConfig siteConfig, Clock clock) {
        this.siteConfig = siteConfig;
        this.clock = clock;
    }

    public List<TeaserRecord> parse(String html) {
        return parse(html, null);
    }

    /**
     * Teasers on the page that pass {@code window} (all of them when null), in page order.
     */
    public List<TeaserRecord> parse(String html, TimeWindow window) {
        return parsePage(html).matching(window);
    }

    public ListingPage parsePage(String html) {
        if (html == null || html.isBlank()) return ListingPage.missing();

        Document doc = Jsoup.parse(html, siteConfig.getBaseUrl());
        Element container = Selectors.first(doc, siteConfig.getListingContainerSelectors());
        if (container == null) {
            log.debug("No listing container matched");
            return ListingPage.missing();
        }

        Elements items = Selectors.firstMatching(container, siteConfig.getListingItemSelectors());
        List<TeaserRecord> teasers = new ArrayList<>();
        for (Element item : items) {
            TeaserRecord teaser = parseItem(item);
            if (teaser != null) {
                teasers.add(teaser);
            }
        }
        log.debug("Parsed {} teasers from {} listing items", teasers.size(), items.size());
        return new ListingPage(true, teasers);
    }

    private TeaserRecord parseItem(Element item) {
        if (Selectors.anyMatch(item, siteConfig.getPremiumLabelSelectors())) {
            log.debug("Skipping premium teaser");
            return null;
        }

        Element link = Selectors.first(item, siteConfig.getTeaserHeadingSelectors());
        if (link == null) return null;

        String href = link.attr("href").trim();
        String title = link.text().trim();
        if (href.isEmpty() || title.isEmpty()) return null;

        String url = link.absUrl("href");
        if (url.isEmpty()) url = href;

        String standfirst = Selectors.text(item, siteConfig.getTeaserStandfirstSelectors());
        String author = Selectors.text(item, siteConfig.getTeaserAuthorSelectors());

        return TeaserRecord.builder()
                .url(url)
                .title(title)
                .standfirst(standfirst != null ? standfirst : "")
                .author(author != null ? author : TeaserRecord.UNKNOWN_AUTHOR)
                .publishedAt(parseTimestamp(Selectors.first(item, siteConfig.getTeaserTimeSelectors())))
                .build();
    }

    private OffsetDateTime parseTimestamp(Element time) {
        if (time != null) {
            String title = time.attr("title").trim();
            if (!title.isEmpty()) {
                try {
                    return parsePublishedDate(title);
                } catch (DateTimeParseException e) {
                    log.debug("Could not parse teaser date '{}', using current time", title);
                    return now();
                }
            }
            String datetime = time.attr("datetime").trim();
            if (!datetime.isEmpty()) {
                OffsetDateTime parsed = IsoDateTimes.parse(datetime);
                if (parsed != null) return parsed;
                log.debug("Could not parse teaser datetime '{}', using current time", datetime);
            }
        }
        return now();
    }

    /**
     * Parse a listing timestamp such as "March 1 2024 1:15 pm" as UTC.
     *
     * @throws DateTimeParseException if the text does not match the listing format
     */
    public static OffsetDateTime parsePublishedDate(String text) {
        if (text == null) throw new DateTimeParseException("Date text is null", "", 0);
        return LocalDateTime.parse(text.trim(), TEASER_DATE_FORMAT).atOffset(ZoneOffset.UTC);
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
    }
}
