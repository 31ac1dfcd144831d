package com.wirefeed.backend.controller;

import com.wirefeed.backend.scheduler.ScrapingJobService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/scraping")
@RequiredArgsConstructor
@Slf4j
@Validated
public class ScrapingController {

    private final ScrapingJobService jobService;

    /**
     * Start a manual run over the last {@code daysBack} days in the background
     */
    @PostMapping("/run")
    public ResponseEntity<Map<String, Object>> runScraping(
            @RequestParam(defaultValue = "1") @Min(1) @Max(365) int daysBack) {

        if (!jobService.startManualRun(daysBack)) {
            log.warn("Manual run requested while a scraping job is in progress");
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "A scraping job is already in progress"));
        }

        log.info("🚀 Manual scraping run started for the last {} day(s)", daysBack);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of(
                        "message", "Scraping started",
                        "daysBack", daysBack
                ));
    }
}
