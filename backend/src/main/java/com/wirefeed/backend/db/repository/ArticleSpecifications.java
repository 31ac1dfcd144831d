package com.wirefeed.backend.db.repository;

import com.wirefeed.backend.db.entity.Article;
import java.time.OffsetDateTime;
import org.springframework.data.jpa.domain.Specification;

/**
 * Query filters for the article listing endpoint. A null argument means "no filter".
 */
public final class ArticleSpecifications {

    private ArticleSpecifications() {
    }

    public static Specification<Article> titleOrContentContains(String search) {
        return (root, query, cb) -> {
            if (search == null || search.isBlank()) return null;
            String pattern = "%" + search.trim().toLowerCase() + "%";
            return cb.or(
                    cb.like(cb.lower(root.get("title")), pattern),
                    cb.like(cb.lower(root.get("content")), pattern));
        };
    }

    public static Specification<Article> authorContains(String author) {
        return (root, query, cb) -> {
            if (author == null || author.isBlank()) return null;
            return cb.like(cb.lower(root.get("author")), "%" + author.trim().toLowerCase() + "%");
        };
    }

    public static Specification<Article> publishedFrom(OffsetDateTime from) {
        return (root, query, cb) -> from == null ? null : cb.greaterThanOrEqualTo(root.get("publishedAt"), from);
    }

    public static Specification<Article> publishedTo(OffsetDateTime to) {
        return (root, query, cb) -> to == null ? null : cb.lessThanOrEqualTo(root.get("publishedAt"), to);
    }
}
