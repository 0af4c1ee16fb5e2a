package com.framesmith.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during job execution, used for CLI progress output.
 *
 * @param eventType event type (e.g. "job.created", "screen.started", "screen.failed", "job.completed")
 * @param jobId     the job this event belongs to
 * @param screenId  the screen this event relates to (nullable for job-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record FramesmithEvent(
    String eventType,
    String jobId,
    String screenId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static FramesmithEvent of(String eventType, String jobId, String screenId, Map<String, Object> payload) {
        return new FramesmithEvent(eventType, jobId, screenId, payload, Instant.now());
    }
}
