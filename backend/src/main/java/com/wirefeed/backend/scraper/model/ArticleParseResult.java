package com.wirefeed.backend.scraper.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ArticleParseResult {

    public enum Status {
        OK,
        PAYWALLED,
        INCOMPLETE
    }

    Status status;
    ArticleFields fields;

    public static ArticleParseResult ok(ArticleFields fields) {
        return new ArticleParseResult(Status.OK, fields);
    }

    public static ArticleParseResult paywalled() {
        return new ArticleParseResult(Status.PAYWALLED, null);
    }

    public static ArticleParseResult incomplete(ArticleFields partial) {
        return new ArticleParseResult(Status.INCOMPLETE, partial);
    }

    public boolean isOk() {
        return status == Status.OK;
    }
}
