package com.framesmith.core.nodes;

import com.framesmith.core.chunking.ScreenExtractor;
import com.framesmith.core.chunking.ScreenPlan;
import com.framesmith.core.chunking.StructureAnalyzer;
import com.framesmith.core.loader.MalformedInputException;
import com.framesmith.core.model.DesignGraph;
import com.framesmith.core.model.JobStatus;
import com.framesmith.core.model.Screen;
import com.framesmith.core.model.ScreenStatus;
import com.framesmith.core.state.JobState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Analyzes the design and extracts its screens. Subtrees that cannot be split below capacity come out
 * as FAILED screens and are never dispatched.
 */
@Component
public class PlanScreensNode {

    private static final Logger log = LoggerFactory.getLogger(PlanScreensNode.class);

    private final StructureAnalyzer analyzer;
    private final ScreenExtractor extractor;

    public PlanScreensNode(StructureAnalyzer analyzer, ScreenExtractor extractor) {
        this.analyzer = analyzer;
        this.extractor = extractor;
    }

    public Map<String, Object> apply(JobState state) {
        DesignGraph graph = state.design()
                .orElseThrow(() -> new MalformedInputException("No design loaded for job " + state.jobId()));
        ScreenPlan plan = analyzer.plan(graph, state.mode());
        List<Screen> screens = extractor.extractAll(graph, plan);

        for (Screen screen : screens) {
            if (screen.status() == ScreenStatus.FAILED) {
                log.warn("Job {}: screen {} rejected: {}", state.jobId(), screen.id(), screen.failureReason());
            }
        }
        log.info("Job {}: {} screens planned", state.jobId(), screens.size());
        return Map.of(
                JobState.SCREENS, screens,
                JobState.SHARED_NODE_IDS, List.copyOf(plan.sharedNodeIds()),
                JobState.STATUS, JobStatus.GENERATING.name()
        );
    }
}
