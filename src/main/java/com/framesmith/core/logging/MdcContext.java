package com.framesmith.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Framesmith-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String JOB_ID = "jobId";
    public static final String SCREEN_ID = "screenId";
    public static final String ORDINAL = "ordinal";

    private MdcContext() {}

    public static void setJob(String jobId) {
        MDC.put(JOB_ID, jobId);
    }

    public static void setScreen(String jobId, String screenId, int ordinal) {
        MDC.put(JOB_ID, jobId);
        MDC.put(SCREEN_ID, screenId);
        MDC.put(ORDINAL, String.valueOf(ordinal));
    }

    /** Drops the screen keys, keeping the job id for the rest of the thread's work. */
    public static void clearScreen() {
        MDC.remove(SCREEN_ID);
        MDC.remove(ORDINAL);
    }

    public static void clear() {
        MDC.remove(JOB_ID);
        MDC.remove(SCREEN_ID);
        MDC.remove(ORDINAL);
    }
}
