package com.wirefeed.backend.ingest;

public enum SaveResult {
    INSERTED,
    DUPLICATE_SKIPPED,
    VALIDATION_SKIPPED
}
