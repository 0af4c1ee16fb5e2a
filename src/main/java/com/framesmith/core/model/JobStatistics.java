package com.framesmith.core.model;

import java.io.Serializable;

/**
 * Timing and usage totals for one generation job.
 */
public record JobStatistics(
    int screensAttempted,
    int screensSucceeded,
    int screensFailed,
    int screensSkipped,
    int totalFiles,
    int oracleCalls,
    long totalElapsedMs,
    long wallClockMs,
    long costUnits
) implements Serializable {

    public static JobStatistics empty() {
        return new JobStatistics(0, 0, 0, 0, 0, 0, 0L, 0L, 0L);
    }

    public JobStatistics withWallClockMs(long wallClock) {
        return new JobStatistics(screensAttempted, screensSucceeded, screensFailed, screensSkipped,
                totalFiles, oracleCalls, totalElapsedMs, wallClock, costUnits);
    }
}
