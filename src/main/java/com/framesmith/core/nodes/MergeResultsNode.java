package com.framesmith.core.nodes;

import com.framesmith.core.engine.ActiveJobs;
import com.framesmith.core.engine.JobContext;
import com.framesmith.core.events.EventBus;
import com.framesmith.core.events.FramesmithEvent;
import com.framesmith.core.merge.ResultMerger;
import com.framesmith.core.metrics.FramesmithMetrics;
import com.framesmith.core.model.AggregateResult;
import com.framesmith.core.state.JobState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * LangGraph4j node that merges all screen artifacts into the final {@link AggregateResult}, derives the
 * job status and publishes {@code job.completed} with the statistics block.
 */
@Component
public class MergeResultsNode {

    private static final Logger log = LoggerFactory.getLogger(MergeResultsNode.class);

    private final ResultMerger merger;
    private final ActiveJobs activeJobs;
    private final EventBus eventBus;
    private final FramesmithMetrics metrics;

    public MergeResultsNode(ResultMerger merger, ActiveJobs activeJobs, EventBus eventBus,
                            FramesmithMetrics metrics) {
        this.merger = merger;
        this.activeJobs = activeJobs;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(JobState state) {
        JobContext context = activeJobs.require(state.jobId());
        String documentName = state.design().map(d -> d.documentName()).orElse("");

        AggregateResult merged = merger.merge(state.jobId(), documentName, state.mode(), state.screens(),
                state.artifacts(), context.registry(), state.navigation(), context.isCancelled(), state.warnings());
        long wallClock = state.startedAt() > 0 ? System.currentTimeMillis() - state.startedAt() : 0L;
        AggregateResult result = merged.withStatistics(merged.statistics().withWallClockMs(wallClock));

        var stats = result.statistics();
        log.info("Job {} finished {}: {}, {} files, {} components, {} cost units",
                state.jobId(), result.status(), result.summary(), stats.totalFiles(),
                result.components().size(), stats.costUnits());

        if (metrics != null) {
            metrics.recordJobResult(result.status().name(), result.mode().name());
            metrics.recordJobCost(stats.costUnits());
            metrics.recordScreenCount(stats.screensAttempted());
        }

        var eventData = new HashMap<String, Object>();
        eventData.put("status", result.status().name());
        eventData.put("summary", result.summary());
        eventData.put("screensSucceeded", stats.screensSucceeded());
        eventData.put("screensFailed", stats.screensFailed());
        eventData.put("screensSkipped", stats.screensSkipped());
        eventData.put("totalFiles", stats.totalFiles());
        eventData.put("costUnits", stats.costUnits());
        eventData.put("wallClockMs", stats.wallClockMs());
        eventData.put("warnings", result.warnings().size());
        eventBus.publish(FramesmithEvent.of("job.completed", state.jobId(), null, eventData));

        return Map.of(
                JobState.RESULT, result,
                JobState.STATUS, result.status().name()
        );
    }
}
