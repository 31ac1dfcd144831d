package com.wirefeed.backend.scheduler;

import com.wirefeed.backend.scraper.model.TimeWindow;
import lombok.Value;

/**
 * Time window and page bound for one job run.
 */
@Value
public class ScrapePlan {
    RunMode mode;
    TimeWindow window;
    int maxPages;
}
