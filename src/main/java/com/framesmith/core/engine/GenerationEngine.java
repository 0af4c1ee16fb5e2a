package com.framesmith.core.engine;

import com.framesmith.core.events.EventBus;
import com.framesmith.core.events.FramesmithEvent;
import com.framesmith.core.graph.FramesmithGraph;
import com.framesmith.core.loader.MalformedInputException;
import com.framesmith.core.logging.MdcContext;
import com.framesmith.core.metrics.FramesmithMetrics;
import com.framesmith.core.model.AggregateResult;
import com.framesmith.core.model.GenerationOptions;
import com.framesmith.core.model.JobStatus;
import com.framesmith.core.state.JobState;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs generation jobs by bridging callers (the CLI) to the LangGraph4j graph.
 * <p>
 * Opens the job's {@link JobContext} before the graph runs and always releases it afterwards, together with
 * the job's event subscriptions, so nothing a job opened outlives it. Malformed input is the only failure
 * that escapes; every screen-level failure is reported inside the {@link AggregateResult}.
 */
@Service
public class GenerationEngine {

    private static final Logger log = LoggerFactory.getLogger(GenerationEngine.class);
    private static final AtomicInteger JOB_COUNTER = new AtomicInteger(0);

    private final FramesmithGraph framesmithGraph;
    private final ActiveJobs activeJobs;
    private final EventBus eventBus;
    private final FramesmithMetrics metrics;

    public GenerationEngine(FramesmithGraph framesmithGraph, ActiveJobs activeJobs, EventBus eventBus,
                            FramesmithMetrics metrics) {
        this.framesmithGraph = framesmithGraph;
        this.activeJobs = activeJobs;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public AggregateResult generate(String designJson, GenerationOptions options) {
        return generate(generateJobId(), designJson, options);
    }

    /**
     * Runs the full pipeline for one design document.
     *
     * @throws MalformedInputException if the document cannot be loaded
     */
    public AggregateResult generate(String jobId, String designJson, GenerationOptions options) {
        JobState state = run(jobId, designJson, options, false);
        return state.result().orElseThrow(() ->
                new IllegalStateException("Graph execution produced no result for job " + jobId));
    }

    /**
     * Loads, classifies and plans screens without calling the oracle.
     *
     * @throws MalformedInputException if the document cannot be loaded
     */
    public JobState analyze(String designJson) {
        return run(generateJobId(), designJson, GenerationOptions.defaults(), true);
    }

    /**
     * Requests cooperative cancellation of a running job.
     *
     * @return false if no job with that id is running
     */
    public boolean cancel(String jobId) {
        boolean found = activeJobs.cancel(jobId);
        if (found) {
            eventBus.publish(FramesmithEvent.of("job.cancelling", jobId, null, Map.of()));
        }
        return found;
    }

    private JobState run(String jobId, String designJson, GenerationOptions options, boolean analyzeOnly) {
        MdcContext.setJob(jobId);
        activeJobs.open(jobId);
        try {
            log.info("Starting job {} (analyzeOnly={}, frontend={}, backend={})", jobId, analyzeOnly,
                    options.frontendFramework(), options.backendFramework());
            eventBus.publish(FramesmithEvent.of("job.created", jobId, null,
                    Map.of("analyzeOnly", analyzeOnly, "documentChars", designJson == null ? 0 : designJson.length())));

            var stateMap = new HashMap<String, Object>();
            stateMap.put(JobState.JOB_ID, jobId);
            stateMap.put(JobState.DESIGN_JSON, designJson == null ? "" : designJson);
            stateMap.put(JobState.OPTIONS, options);
            stateMap.put(JobState.ANALYZE_ONLY, analyzeOnly);
            stateMap.put(JobState.STATUS, JobStatus.LOADING.name());
            stateMap.put(JobState.STARTED_AT, System.currentTimeMillis());

            var config = RunnableConfig.builder()
                    .threadId(jobId)
                    .build();

            try {
                return framesmithGraph.getCompiledGraph()
                        .invoke(Map.copyOf(stateMap), config)
                        .orElseThrow(() -> new IllegalStateException(
                                "Graph execution returned empty state for job " + jobId));
            } catch (RuntimeException e) {
                MalformedInputException malformed = findCause(e, MalformedInputException.class);
                if (malformed != null) {
                    log.error("Job {} aborted: {}", jobId, malformed.getMessage());
                    metrics.recordJobResult(JobStatus.FAILED.name(), "UNKNOWN");
                    eventBus.publish(FramesmithEvent.of("job.failed", jobId, null,
                            Map.of("reason", malformed.getMessage())));
                    throw malformed;
                }
                throw e;
            }
        } finally {
            activeJobs.release(jobId);
            eventBus.closeJob(jobId);
            MdcContext.clear();
        }
    }

    private static <T extends Throwable> T findCause(Throwable error, Class<T> type) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (type.isInstance(t)) {
                return type.cast(t);
            }
        }
        return null;
    }

    /**
     * Generates a unique job ID in the format FSMT-YYYY-NNNN.
     */
    public String generateJobId() {
        int count = JOB_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(java.time.ZoneOffset.UTC).getYear();
        return String.format("FSMT-%d-%04d", year, count);
    }
}
