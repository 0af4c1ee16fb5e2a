package com.framesmith.core.model;

/**
 * Overall status of a generation job.
 */
public enum JobStatus {
    LOADING,
    CLASSIFYING,
    PLANNING,
    GENERATING,
    MERGING,
    COMPLETED,
    PARTIALLY_COMPLETED,
    CANCELLED,
    FAILED
}
