package com.storeshots.service.batch;

public enum ProcessingStatus {
    SUCCEEDED,
    FAILED,
    SKIPPED
}
