package com.wirefeed.backend.ingest;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BatchSaveResult {
    int inserted;
    int duplicates;
    int invalid;
    int failed;
    /** True when the batch stopped early after too many consecutive failures. */
    boolean aborted;
}
