package com.wirefeed.backend.exception;

public class IngestException extends ScrapingException {

    public IngestException(String message) {
        super(message);
    }

    public IngestException(String message, Throwable cause) {
        super(message, cause);
    }
}
