package com.wirefeed.backend.db.repository;

import com.wirefeed.backend.db.entity.Article;
import java.util.Optional;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

@Repository
public interface ArticleRepository extends JpaRepository<Article, Long>, JpaSpecificationExecutor<Article> {

    Optional<Article> findByUrl(String url);

    boolean existsByUrl(String url);

    @EntityGraph(attributePaths = {"tags", "relatedArticles"})
    Optional<Article> findWithDetailsById(Long id);

    @EntityGraph(attributePaths = {"tags", "relatedArticles"})
    Optional<Article> findWithDetailsByUrl(String url);
}
