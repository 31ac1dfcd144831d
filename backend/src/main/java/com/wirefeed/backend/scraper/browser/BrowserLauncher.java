package com.wirefeed.backend.scraper.browser;

public interface BrowserLauncher {

    BrowserSession launch();
}
