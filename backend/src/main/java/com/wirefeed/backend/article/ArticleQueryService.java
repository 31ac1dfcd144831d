package com.wirefeed.backend.article;

import static com.wirefeed.backend.db.repository.ArticleSpecifications.authorContains;
import static com.wirefeed.backend.db.repository.ArticleSpecifications.publishedFrom;
import static com.wirefeed.backend.db.repository.ArticleSpecifications.publishedTo;
import static com.wirefeed.backend.db.repository.ArticleSpecifications.titleOrContentContains;

import com.wirefeed.backend.db.entity.Article;
import com.wirefeed.backend.db.repository.ArticleRepository;
import com.wirefeed.backend.ingest.BatchSaveResult;
import com.wirefeed.backend.ingest.IngestStore;
import com.wirefeed.backend.model.dto.ArticleImportDTO;
import com.wirefeed.backend.model.dto.ArticleListResponse;
import com.wirefeed.backend.model.dto.ArticleResponse;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Slf4j
public class ArticleQueryService {

    private final ArticleRepository articleRepository;
    private final IngestStore ingestStore;
    private final Clock clock;

    /**
     * Filtered article listing, newest first. {@code page} is 1-based.
     */
    @Transactional(readOnly = true)
    public ArticleListResponse listArticles(int page, int pageSize, String search, String author,
                                            LocalDate dateFrom, LocalDate dateTo) {
        Specification<Article> filter = Specification.where(titleOrContentContains(search))
                .and(authorContains(author))
                .and(publishedFrom(dateFrom != null ? dateFrom.atStartOfDay().atOffset(ZoneOffset.UTC) : null))
                .and(publishedTo(dateTo != null ? dateTo.atTime(LocalTime.of(23, 59, 59)).atOffset(ZoneOffset.UTC) : null));

        PageRequest pageable = PageRequest.of(page - 1, pageSize, Sort.by("publishedAt").descending());
        Page<Article> result = articleRepository.findAll(filter, pageable);

        List<ArticleResponse> articles = result.getContent().stream()
                .map(ArticleResponse::from)
                .toList();
        return new ArticleListResponse(articles, result.getTotalElements(), page, pageSize, result.getTotalPages());
    }

    @Transactional(readOnly = true)
    public Optional<ArticleResponse> findArticle(Long id) {
        return articleRepository.findWithDetailsById(id).map(ArticleResponse::from);
    }

    public BatchSaveResult importArticles(List<ArticleImportDTO> articles) {
        OffsetDateTime now = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
        log.info("Importing {} articles", articles.size());
        return ingestStore.saveAll(articles.stream()
                .map(article -> article.toFields(now))
                .toList());
    }
}
