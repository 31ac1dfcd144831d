package com.wirefeed.backend.article;

import com.wirefeed.backend.ingest.BatchSaveResult;
import com.wirefeed.backend.model.dto.ArticleImportRequest;
import com.wirefeed.backend.model.dto.ArticleListResponse;
import com.wirefeed.backend.model.dto.ArticleResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/articles")
@RequiredArgsConstructor
@Slf4j
@Validated
public class ArticleController {

    private final ArticleQueryService articleQueryService;

    /**
     * List stored articles, newest first
     */
    @GetMapping
    public ResponseEntity<ArticleListResponse> getArticles(
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int pageSize,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String author,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateFrom,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateTo) {

        return ResponseEntity.ok(articleQueryService.listArticles(page, pageSize, search, author, dateFrom, dateTo));
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getArticle(@PathVariable Long id) {
        Optional<ArticleResponse> article = articleQueryService.findArticle(id);
        if (article.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("error", "Article not found: " + id));
        }
        return ResponseEntity.ok(article.get());
    }

    /**
     * Import already extracted articles, at most 100 per batch
     */
    @PostMapping("/import")
    public ResponseEntity<?> importArticles(@Valid @RequestBody @NotNull ArticleImportRequest request) {
        try {
            log.info("Received import batch with {} articles", request.getArticles().size());
            BatchSaveResult result = articleQueryService.importArticles(request.getArticles());

            return ResponseEntity.ok(Map.of(
                    "message", result.isAborted() ? "Import aborted after repeated failures" : "Articles processed",
                    "totalReceived", request.getArticles().size(),
                    "inserted", result.getInserted(),
                    "duplicates", result.getDuplicates(),
                    "invalid", result.getInvalid(),
                    "failed", result.getFailed(),
                    "aborted", result.isAborted()
            ));
        } catch (Exception e) {
            log.error("Error importing articles", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Failed to import articles. Please try again later."));
        }
    }
}
