package com.wirefeed.backend.exception;

public class BrowserLaunchException extends ScrapingException {

    public BrowserLaunchException(String message) {
        super(message);
    }

    public BrowserLaunchException(String message, Throwable cause) {
        super(message, cause);
    }
}
