package com.framesmith.core.engine;

import com.framesmith.core.registry.ComponentRegistry;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mutable, job-scoped collaborators that cannot live in graph state: the component registry shared by
 * screen workers and the cooperative cancellation flag.
 */
public final class JobContext {

    private final String jobId;
    private final ComponentRegistry registry;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Instant startedAt;

    public JobContext(String jobId, ComponentRegistry registry, Instant startedAt) {
        this.jobId = jobId;
        this.registry = registry;
        this.startedAt = startedAt;
    }

    public String jobId() {
        return jobId;
    }

    public ComponentRegistry registry() {
        return registry;
    }

    public Instant startedAt() {
        return startedAt;
    }

    /**
     * @return true if this call flipped the flag
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
