package com.docverify.model;

public enum BulkJobStatus {
    QUEUED,
    PROCESSING,
    COMPLETED,
    PARTIAL,
    FAILED;

    public boolean isFinished() {
        return this == COMPLETED || this == PARTIAL || this == FAILED;
    }

    public String value() {
        return name().toLowerCase();
    }
}
