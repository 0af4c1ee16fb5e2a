package com.framesmith.core.model;

import java.io.Serializable;

/**
 * One row of the per-screen status table.
 */
public record ScreenOutcome(
    String screenId,
    String screenName,
    int ordinal,
    ScreenStatus status,
    String failureReason,
    int attempts,
    long elapsedMs
) implements Serializable {

    public static ScreenOutcome of(Screen screen, GeneratedArtifact artifact) {
        int attempts = artifact == null ? 0 : artifact.attempts();
        long elapsed = artifact == null ? 0L : artifact.elapsedMs();
        return new ScreenOutcome(screen.id(), screen.name(), screen.ordinal(), screen.status(),
                screen.failureReason(), attempts, elapsed);
    }
}
