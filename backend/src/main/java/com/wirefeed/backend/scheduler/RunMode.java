package com.wirefeed.backend.scheduler;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum RunMode {
    BULK("initial"),
    INCREMENTAL("hourly"),
    MANUAL("manual");

    /** Run type as it appears in run reports. */
    private final String runType;
}
