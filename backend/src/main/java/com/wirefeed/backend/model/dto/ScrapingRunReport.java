package com.wirefeed.backend.model.dto;

import java.time.OffsetDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Final counters of one job run
 */
@Value
@Builder
public class ScrapingRunReport {
    int found;
    int scraped;
    int saved;
    int skipped;
    int errors;
    double durationSeconds;
    String runType;
    OffsetDateTime startedAt;
    boolean failed;
    String failureMessage;
}
