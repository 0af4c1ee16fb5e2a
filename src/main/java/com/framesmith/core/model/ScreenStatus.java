package com.framesmith.core.model;

/**
 * Lifecycle status of a single screen.
 * <pre>
 *   PENDING -> PROCESSING -> SUCCEEDED | FAILED
 *   PENDING -> SKIPPED   (cancelled before start, or filtered out)
 *   PENDING -> FAILED    (rejected during analysis)
 * </pre>
 */
public enum ScreenStatus {
    PENDING,
    PROCESSING,
    SUCCEEDED,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED;
    }

    public boolean canTransitionTo(ScreenStatus next) {
        return switch (this) {
            case PENDING -> next == PROCESSING || next == SKIPPED || next == FAILED;
            case PROCESSING -> next == SUCCEEDED || next == FAILED;
            case SUCCEEDED, FAILED, SKIPPED -> false;
        };
    }
}
