package com.wirefeed.backend.scraper.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wirefeed.backend.config.NewsSiteConfig;
import com.wirefeed.backend.scraper.model.ArticleFields;
import com.wirefeed.backend.scraper.model.ArticleParseResult;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.Elements;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Extracts a full article from its page, using priority-based selectors per field.
 */
@Component
@Slf4j
public class ArticleParser {

    static final int DEFAULT_MIN_FRAGMENT_LENGTH = 20;

    private static final String BLOCK_SELECTOR = "p, div, li, blockquote, h2, h3";
    private static final Set<String> ARTICLE_JSON_LD_TYPES = Set.of("article", "newsarticle", "reportagenewsarticle");

    private final NewsSiteConfig siteConfig;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final int minFragmentLength;

    @Autowired
    public ArticleParser(NewsSiteConfig siteConfig, Clock clock) {
        this(siteConfig, clock, DEFAULT_MIN_FRAGMENT_LENGTH);
    }

    public ArticleParser(NewsSiteConfig siteConfig, Clock clock, int minFragmentLength) {
        this.siteConfig = siteConfig;
        this.clock = clock;
        this.minFragmentLength = minFragmentLength;
    }

    public ArticleParseResult parse(String url, String html) {
        if (html == null || html.isBlank()) {
            return ArticleParseResult.incomplete(null);
        }

        Document doc = Jsoup.parse(html, siteConfig.getBaseUrl());

        if (isPaywalled(doc)) {
            log.warn("Paywall detected, skipping: {}", url);
            return ArticleParseResult.paywalled();
        }

        String content = extractContent(doc);
        int wordCount = ArticleFields.countWords(content);

        ArticleFields fields = ArticleFields.builder()
                .url(url)
                .title(extractTitle(doc))
                .content(content)
                .author(extractAuthor(doc))
                .publishedAt(extractPublishedDate(doc))
                .subtitle(Selectors.text(doc, siteConfig.getSubtitleSelectors()))
                .imageUrl(extractImageUrl(doc))
                .tags(extractTags(doc))
                .relatedUrls(extractRelatedUrls(doc))
                .wordCount(wordCount)
                .readingTime(ArticleFields.readingTime(wordCount))
                .scrapedAt(now())
                .build();

        if (!fields.hasRequiredFields()) {
            log.warn("Missing required fields for: {}", url);
            return ArticleParseResult.incomplete(fields);
        }

        log.debug("Extracted article {}: title={}, words={}", url, abbreviate(fields.getTitle()), wordCount);
        return ArticleParseResult.ok(fields);
    }

    boolean isPaywalled(Document doc) {
        if (Selectors.anyMatch(doc, siteConfig.getPaywallSelectors())) {
            return true;
        }
        String bodyText = doc.body() != null ? doc.body().text() : "";
        return siteConfig.getPaywallPhrases().stream().anyMatch(bodyText::contains);
    }

    private String extractTitle(Document doc) {
        String title = Selectors.text(doc, siteConfig.getTitleSelectors());
        if (title != null) return title;

        // Fallback to the page title
        String pageTitle = doc.title().trim();
        String suffix = siteConfig.getTitleSuffix();
        if (suffix != null && !suffix.isEmpty() && pageTitle.endsWith(suffix)) {
            pageTitle = pageTitle.substring(0, pageTitle.length() - suffix.length()).trim();
        }
        return pageTitle;
    }

    /**
     * Text fragments of the first matching content container in document order, noise removed,
     * blank-line separated. Text written directly inside a block that also holds nested blocks
     * becomes its own fragment.
     */
    private String extractContent(Document doc) {
        Element container = Selectors.first(doc, siteConfig.getContentSelectors());
        if (container == null) return "";

        for (String ignoreSelector : siteConfig.getContentIgnoreSelectors()) {
            container.select(ignoreSelector).remove();
        }

        List<String> parts = new ArrayList<>();
        collectFragments(container, parts);
        return String.join("\n\n", parts);
    }

    private void collectFragments(Element element, List<String> parts) {
        StringBuilder run = new StringBuilder();
        for (Node child : element.childNodes()) {
            if (child instanceof Element && !((Element) child).select(BLOCK_SELECTOR).isEmpty()) {
                addFragment(run, parts);
                collectFragments((Element) child, parts);
            } else if (child instanceof TextNode) {
                run.append(((TextNode) child).getWholeText());
            } else if (child instanceof Element) {
                Element inline = (Element) child;
                run.append("br".equals(inline.normalName()) ? " " : inline.text());
            }
        }
        addFragment(run, parts);
    }

    private void addFragment(StringBuilder run, List<String> parts) {
        String text = run.toString().replaceAll("\\s+", " ").trim();
        run.setLength(0);
        if (text.length() >= minFragmentLength) {
            parts.add(text);
        }
    }

    private String extractAuthor(Document doc) {
        String author = Selectors.text(doc, siteConfig.getAuthorSelectors());
        if (author != null) return author;

        JsonNode article = findJsonLdArticle(doc);
        if (article == null) return null;
        JsonNode authorNode = article.get("author");
        if (authorNode == null) return null;
        if (authorNode.isArray() && !authorNode.isEmpty()) {
            authorNode = authorNode.get(0);
        }
        if (authorNode.isObject()) {
            JsonNode name = authorNode.get("name");
            return name != null && !name.asText().isBlank() ? name.asText().trim() : null;
        }
        return authorNode.asText().isBlank() ? null : authorNode.asText().trim();
    }

    private OffsetDateTime extractPublishedDate(Document doc) {
        for (String selector : siteConfig.getPublishedTimeSelectors()) {
            Element element = doc.selectFirst(selector);
            if (element == null) continue;
            OffsetDateTime parsed = IsoDateTimes.parse(element.attr("datetime"));
            if (parsed != null) return parsed;
        }

        JsonNode article = findJsonLdArticle(doc);
        if (article != null && article.hasNonNull("datePublished")) {
            OffsetDateTime parsed = IsoDateTimes.parse(article.get("datePublished").asText());
            if (parsed != null) return parsed;
        }

        log.debug("No parseable publish date, using current time");
        return now();
    }

    private String extractImageUrl(Document doc) {
        for (String selector : siteConfig.getImageSelectors()) {
            Element img = doc.selectFirst(selector);
            if (img == null) continue;
            String src = img.hasAttr("src") ? img.absUrl("src") : "";
            if (src.isEmpty() && img.hasAttr("data-src")) {
                src = img.absUrl("data-src");
            }
            if (!src.isEmpty()) return src;
        }
        return null;
    }

    private List<String> extractTags(Document doc) {
        Set<String> tags = new LinkedHashSet<>();
        for (String selector : siteConfig.getTagSelectors()) {
            for (Element element : doc.select(selector)) {
                String tag = element.text().trim();
                if (!tag.isEmpty()) tags.add(tag);
            }
        }
        return tags.stream().limit(ArticleFields.MAX_TAGS).toList();
    }

    private List<String> extractRelatedUrls(Document doc) {
        Set<String> urls = new LinkedHashSet<>();
        for (String selector : siteConfig.getRelatedArticleSelectors()) {
            Elements links = doc.select(selector);
            for (Element link : links) {
                String href = link.attr("href").trim();
                if (!siteConfig.isArticleUrl(href)) continue;
                String absolute = link.absUrl("href");
                urls.add(absolute.isEmpty() ? href : absolute);
            }
        }
        return urls.stream().limit(ArticleFields.MAX_RELATED_URLS).toList();
    }

    private JsonNode findJsonLdArticle(Document doc) {
        for (Element script : doc.select("script[type=application/ld+json]")) {
            try {
                JsonNode node = objectMapper.readTree(script.data());
                if (node == null) continue;
                if (node.isArray()) {
                    for (JsonNode item : node) {
                        if (isArticleNode(item)) return item;
                    }
                } else if (isArticleNode(node)) {
                    return node;
                }
            } catch (Exception e) {
                log.debug("Error parsing JSON-LD: {}", e.getMessage());
            }
        }
        return null;
    }

    private static boolean isArticleNode(JsonNode node) {
        JsonNode type = node.get("@type");
        return type != null && ARTICLE_JSON_LD_TYPES.contains(type.asText().toLowerCase());
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
    }

    private static String abbreviate(String text) {
        return text.length() <= 50 ? text : text.substring(0, 50) + "...";
    }
}
