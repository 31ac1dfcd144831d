package com.wirefeed.backend.scraper.parser;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;

/**
 * Ordered selector fallback over a jsoup element tree.
 */
@Slf4j
final class Selectors {

    private Selectors() {
    }

    /**
     * First element matched by the first selector that matches anything.
     */
    static Element first(Element root, List<String> selectors) {
        Elements elements = firstMatching(root, selectors);
        return elements.isEmpty() ? null : elements.first();
    }

    /**
     * All elements of the first selector that matches anything.
     */
    static Elements firstMatching(Element root, List<String> selectors) {
        if (root == null || selectors == null) return new Elements();
        for (String selector : selectors) {
            try {
                Elements elements = root.select(selector);
                if (!elements.isEmpty()) {
                    return elements;
                }
            } catch (Selector.SelectorParseException e) {
                log.debug("Invalid selector '{}': {}", selector, e.getMessage());
            }
        }
        return new Elements();
    }

    /**
     * Trimmed text of the first non-blank match, or null.
     */
    static String text(Element root, List<String> selectors) {
        if (root == null || selectors == null) return null;
        for (String selector : selectors) {
            try {
                Element element = root.selectFirst(selector);
                if (element != null) {
                    String text = element.text().trim();
                    if (!text.isEmpty()) return text;
                }
            } catch (Selector.SelectorParseException e) {
                log.debug("Invalid selector '{}': {}", selector, e.getMessage());
            }
        }
        return null;
    }

    static boolean anyMatch(Element root, List<String> selectors) {
        if (root == null || selectors == null) return false;
        for (String selector : selectors) {
            try {
                if (root.selectFirst(selector) != null) return true;
            } catch (Selector.SelectorParseException e) {
                log.debug("Invalid selector '{}': {}", selector, e.getMessage());
            }
        }
        return false;
    }
}
