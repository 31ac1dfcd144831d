package com.wirefeed.backend.scraper.model;

import java.util.List;
import java.util.stream.Collectors;
import lombok.Value;

/**
 * Parsed listing page: every non-premium teaser in page order, before any time filter.
 */
@Value
public class ListingPage {
    boolean containerFound;
    List<TeaserRecord> teasers;

    public static ListingPage missing() {
        return new ListingPage(false, List.of());
    }

    public List<TeaserRecord> matching(TimeWindow window) {
        if (window == null) return teasers;
        return teasers.stream()
                .filter(t -> window.accepts(t.getPublishedAt()))
                .collect(Collectors.toList());
    }

    /**
     * True when the oldest (last) teaser on this page is already outside the window.
     */
    public boolean crossesWindow(TimeWindow window) {
        if (window == null || teasers.isEmpty()) return false;
        return !window.accepts(teasers.get(teasers.size() - 1).getPublishedAt());
    }
}
