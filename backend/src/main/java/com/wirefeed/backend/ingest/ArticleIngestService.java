package com.wirefeed.backend.ingest;

import com.wirefeed.backend.config.ScrapingConfig;
import com.wirefeed.backend.db.entity.Article;
import com.wirefeed.backend.db.entity.Tag;
import com.wirefeed.backend.db.repository.ArticleRepository;
import com.wirefeed.backend.db.repository.TagRepository;
import com.wirefeed.backend.exception.IngestException;
import com.wirefeed.backend.scraper.model.ArticleFields;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@Slf4j
public class ArticleIngestService implements IngestStore {

    private static final int MAX_TAG_LENGTH = 100;

    private final ArticleRepository articleRepository;
    private final TagRepository tagRepository;
    private final ScrapingConfig scrapingConfig;
    private final TransactionTemplate transactionTemplate;

    public ArticleIngestService(ArticleRepository articleRepository,
                                TagRepository tagRepository,
                                ScrapingConfig scrapingConfig,
                                PlatformTransactionManager transactionManager) {
        this.articleRepository = articleRepository;
        this.tagRepository = tagRepository;
        this.scrapingConfig = scrapingConfig;
        // Every save commits or rolls back on its own
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public SaveResult trySave(ArticleFields fields) {
        if (fields == null || !fields.hasRequiredFields() || fields.getPublishedAt() == null) {
            log.warn("Article validation failed for URL: {}", fields != null ? fields.getUrl() : null);
            return SaveResult.VALIDATION_SKIPPED;
        }

        String url = fields.getUrl().trim();
        try {
            return insert(fields, url);
        } catch (DataIntegrityViolationException e) {
            if (articleRepository.existsByUrl(url)) {
                log.warn("Duplicate article: {}", url);
                return SaveResult.DUPLICATE_SKIPPED;
            }
            // A concurrent worker created one of our tags first; the tag now exists
            log.debug("Integrity violation for {} not caused by its URL, retrying once: {}", url, e.getMessage());
            try {
                return insert(fields, url);
            } catch (DataIntegrityViolationException retryFailure) {
                if (articleRepository.existsByUrl(url)) {
                    return SaveResult.DUPLICATE_SKIPPED;
                }
                throw new IngestException("Could not save article " + url + ": " + retryFailure.getMessage(), retryFailure);
            } catch (DataAccessException retryFailure) {
                throw new IngestException("Could not save article " + url + ": " + retryFailure.getMessage(), retryFailure);
            }
        } catch (DataAccessException e) {
            throw new IngestException("Could not save article " + url + ": " + e.getMessage(), e);
        }
    }

    private SaveResult insert(ArticleFields fields, String url) {
        return transactionTemplate.execute(status -> {
            if (articleRepository.existsByUrl(url)) {
                log.debug("Article already exists: {}", url);
                return SaveResult.DUPLICATE_SKIPPED;
            }

            Article article = toEntity(fields, url);
            articleRepository.saveAndFlush(article);
            log.info("Saved article: {}", abbreviate(article.getTitle()));
            return SaveResult.INSERTED;
        });
    }

    private Article toEntity(ArticleFields fields, String url) {
        Article article = Article.builder()
                .url(url)
                .title(fields.getTitle().trim())
                .content(fields.getContent().trim())
                .author(fields.getAuthor())
                .publishedAt(fields.getPublishedAt())
                .scrapedAt(fields.getScrapedAt() != null ? fields.getScrapedAt() : fields.getPublishedAt())
                .subtitle(fields.getSubtitle())
                .imageUrl(fields.getImageUrl())
                .wordCount(fields.getWordCount())
                .readingTime(fields.getReadingTime())
                .build();

        fields.getTags().stream()
                .map(String::trim)
                .filter(name -> !name.isEmpty() && name.length() <= MAX_TAG_LENGTH)
                .distinct()
                .limit(ArticleFields.MAX_TAGS)
                .forEach(name -> article.getTags().add(getOrCreateTag(name)));

        fields.getRelatedUrls().stream()
                .distinct()
                .limit(ArticleFields.MAX_RELATED_URLS)
                .forEach(article::addRelatedUrl);

        return article;
    }

    private Tag getOrCreateTag(String name) {
        return tagRepository.findByName(name)
                .orElseGet(() -> tagRepository.save(Tag.builder().name(name).build()));
    }

    @Override
    public BatchSaveResult saveAll(List<ArticleFields> articles) {
        int inserted = 0;
        int duplicates = 0;
        int invalid = 0;
        int failed = 0;
        int consecutiveFailures = 0;
        int threshold = scrapingConfig.getBatchAbortThreshold();

        for (ArticleFields article : articles) {
            try {
                switch (trySave(article)) {
                    case INSERTED -> inserted++;
                    case DUPLICATE_SKIPPED -> duplicates++;
                    case VALIDATION_SKIPPED -> invalid++;
                }
                consecutiveFailures = 0;
            } catch (RuntimeException e) {
                failed++;
                consecutiveFailures++;
                log.error("Error saving article {}: {}", article != null ? article.getUrl() : null, e.getMessage());
                if (consecutiveFailures > threshold) {
                    log.error("Aborting batch after {} consecutive failures ({} of {} saved)",
                            consecutiveFailures, inserted, articles.size());
                    return BatchSaveResult.builder()
                            .inserted(inserted)
                            .duplicates(duplicates)
                            .invalid(invalid)
                            .failed(failed)
                            .aborted(true)
                            .build();
                }
            }
        }

        log.info("Batch save finished: {} inserted, {} duplicates, {} invalid, {} failed",
                inserted, duplicates, invalid, failed);
        return BatchSaveResult.builder()
                .inserted(inserted)
                .duplicates(duplicates)
                .invalid(invalid)
                .failed(failed)
                .aborted(false)
                .build();
    }

    @Override
    public boolean isEmpty() {
        return articleRepository.count() == 0;
    }

    @Override
    public Optional<Article> findByUrl(String url) {
        return articleRepository.findByUrl(url);
    }

    private static String abbreviate(String text) {
        return text.length() <= 50 ? text : text.substring(0, 50) + "...";
    }
}
