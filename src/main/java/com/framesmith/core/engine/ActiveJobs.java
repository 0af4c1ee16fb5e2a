package com.framesmith.core.engine;

import com.framesmith.core.registry.ComponentRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks the {@link JobContext} of every running job. Graph nodes look their context up by job id;
 * the engine opens it when a job starts and releases it when the job ends.
 */
@Component
public class ActiveJobs {

    private static final Logger log = LoggerFactory.getLogger(ActiveJobs.class);

    private final ConcurrentHashMap<String, JobContext> jobs = new ConcurrentHashMap<>();

    public JobContext open(String jobId) {
        var context = new JobContext(jobId, new ComponentRegistry(), Instant.now());
        if (jobs.putIfAbsent(jobId, context) != null) {
            throw new IllegalStateException("Job " + jobId + " is already running");
        }
        log.debug("Opened job context {}", jobId);
        return context;
    }

    public Optional<JobContext> get(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    public JobContext require(String jobId) {
        return get(jobId).orElseThrow(() -> new IllegalStateException("No active job " + jobId));
    }

    /**
     * Requests cooperative cancellation. Screens not yet started are skipped.
     *
     * @return false if the job is unknown or already finished
     */
    public boolean cancel(String jobId) {
        JobContext context = jobs.get(jobId);
        if (context == null) {
            return false;
        }
        if (context.cancel()) {
            log.info("Cancellation requested for job {}", jobId);
        }
        return true;
    }

    public void release(String jobId) {
        if (jobs.remove(jobId) != null) {
            log.debug("Released job context {}", jobId);
        }
    }

    public Set<String> activeJobIds() {
        return Set.copyOf(jobs.keySet());
    }
}
