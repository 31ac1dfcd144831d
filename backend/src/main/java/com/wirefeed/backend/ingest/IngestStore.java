package com.wirefeed.backend.ingest;

import com.wirefeed.backend.db.entity.Article;
import com.wirefeed.backend.exception.IngestException;
import com.wirefeed.backend.scraper.model.ArticleFields;
import java.util.List;
import java.util.Optional;

/**
 * Deduplicating article persistence used by the scraping pipeline.
 */
public interface IngestStore {

    /**
     * Persist one article in its own transaction.
     *
     * @throws IngestException on persistence failures other than a duplicate URL
     */
    SaveResult trySave(ArticleFields article);

    /**
     * Save each article independently, stopping early after too many consecutive failures.
     */
    BatchSaveResult saveAll(List<ArticleFields> articles);

    boolean isEmpty();

    Optional<Article> findByUrl(String url);
}
