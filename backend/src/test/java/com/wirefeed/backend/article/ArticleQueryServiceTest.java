package com.wirefeed.backend.article;

import static com.wirefeed.backend.testing.SiteFixtures.CLOCK;
import static com.wirefeed.backend.testing.SiteFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.wirefeed.backend.db.entity.Article;
import com.wirefeed.backend.db.entity.Tag;
import com.wirefeed.backend.db.repository.ArticleRepository;
import com.wirefeed.backend.ingest.BatchSaveResult;
import com.wirefeed.backend.ingest.IngestStore;
import com.wirefeed.backend.model.dto.ArticleImportDTO;
import com.wirefeed.backend.model.dto.ArticleListResponse;
import com.wirefeed.backend.model.dto.ArticleResponse;
import com.wirefeed.backend.scraper.model.ArticleFields;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

@ExtendWith(MockitoExtension.class)
class ArticleQueryServiceTest {

    @Mock
    private ArticleRepository articleRepository;

    @Mock
    private IngestStore ingestStore;

    @Captor
    private ArgumentCaptor<List<ArticleFields>> batchCaptor;

    private ArticleQueryService queryService;

    @BeforeEach
    void setUp() {
        queryService = new ArticleQueryService(articleRepository, ingestStore, CLOCK);
    }

    private static Article storedArticle() {
        Article article = Article.builder()
                .id(3L)
                .url("https://www.ft.com/content/abc")
                .title("Trade talks resume")
                .content("Officials met on Monday.")
                .publishedAt(NOW)
                .scrapedAt(NOW)
                .build();
        article.getTags().add(Tag.builder().name("Trade").build());
        article.addRelatedUrl("https://www.ft.com/content/rel-1");
        return article;
    }

    @Test
    @DisplayName("should translate the 1-based page and sort newest first")
    @SuppressWarnings("unchecked")
    void shouldListNewestFirst() {
        ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
        when(articleRepository.findAll(any(Specification.class), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(storedArticle()), PageRequest.of(1, 10), 11));

        ArticleListResponse response = queryService.listArticles(2, 10, "trade", null, null, null);

        verify(articleRepository).findAll(any(Specification.class), pageable.capture());
        assertThat(pageable.getValue().getPageNumber()).isEqualTo(1);
        assertThat(pageable.getValue().getPageSize()).isEqualTo(10);
        assertThat(pageable.getValue().getSort().getOrderFor("publishedAt").getDirection())
                .isEqualTo(Sort.Direction.DESC);
        assertThat(response.getTotal()).isEqualTo(11);
        assertThat(response.getPage()).isEqualTo(2);
        assertThat(response.getTotalPages()).isEqualTo(2);
        assertThat(response.getArticles()).extracting(ArticleResponse::getTitle).containsExactly("Trade talks resume");
    }

    @Test
    @DisplayName("should expose tags and related URLs of a single article")
    void shouldFindArticle() {
        when(articleRepository.findWithDetailsById(3L)).thenReturn(Optional.of(storedArticle()));

        ArticleResponse article = queryService.findArticle(3L).orElseThrow();

        assertThat(article.getTags()).containsExactly("Trade");
        assertThat(article.getRelatedUrls()).containsExactly("https://www.ft.com/content/rel-1");
    }

    @Test
    @DisplayName("should convert imported articles and derive reading time")
    void shouldImportArticles() {
        ArticleImportDTO valid = new ArticleImportDTO();
        valid.setUrl("https://www.ft.com/content/imp-1");
        valid.setTitle("Imported");
        valid.setContent("A short imported body");
        valid.setPublishedAt("2024-01-15T10:30:00Z");
        valid.setTags(List.of("Trade"));
        ArticleImportDTO badDate = new ArticleImportDTO();
        badDate.setUrl("https://www.ft.com/content/imp-2");
        badDate.setTitle("Bad date");
        badDate.setContent("Body");
        badDate.setPublishedAt("15/01/2024");
        BatchSaveResult expected = BatchSaveResult.builder().inserted(1).invalid(1).build();
        when(ingestStore.saveAll(batchCaptor.capture())).thenReturn(expected);

        assertThat(queryService.importArticles(List.of(valid, badDate))).isSameAs(expected);

        List<ArticleFields> batch = batchCaptor.getValue();
        assertThat(batch.get(0).getPublishedAt()).isEqualTo(OffsetDateTime.of(2024, 1, 15, 10, 30, 0, 0, ZoneOffset.UTC));
        assertThat(batch.get(0).getWordCount()).isEqualTo(4);
        assertThat(batch.get(0).getReadingTime()).isEqualTo("1 min read");
        assertThat(batch.get(0).getTags()).containsExactly("Trade");
        assertThat(batch.get(0).getScrapedAt()).isEqualTo(NOW);
        assertThat(batch.get(1).getPublishedAt()).isNull();
    }
}
