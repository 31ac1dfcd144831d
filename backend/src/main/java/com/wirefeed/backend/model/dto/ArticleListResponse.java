package com.wirefeed.backend.model.dto;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One page of articles. {@code page} is 1-based.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ArticleListResponse {
    private List<ArticleResponse> articles;
    private long total;
    private int page;
    private int pageSize;
    private int totalPages;
}
