package com.wirefeed.backend.scraper.browser;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.WebDriver;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class SeleniumBrowserLauncher implements BrowserLauncher {

    private final WebDriverFactory driverFactory;

    @Override
    public BrowserSession launch() {
        WebDriver driver = driverFactory.createDriver();
        log.info("Browser launched");
        return new SeleniumBrowserSession(driverFactory, driver);
    }
}
