package com.wirefeed.backend.exception;

public class PageFetchException extends ScrapingException {

    public PageFetchException(String message) {
        super(message);
    }

    public PageFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
