package com.framesmith.core.nodes;

import com.framesmith.core.chunking.SizeClassifier;
import com.framesmith.core.loader.MalformedInputException;
import com.framesmith.core.model.DesignGraph;
import com.framesmith.core.model.JobStatus;
import com.framesmith.core.model.ProcessingMode;
import com.framesmith.core.state.JobState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class ClassifyDesignNode {

    private static final Logger log = LoggerFactory.getLogger(ClassifyDesignNode.class);

    private final SizeClassifier classifier;

    public ClassifyDesignNode(SizeClassifier classifier) {
        this.classifier = classifier;
    }

    public Map<String, Object> apply(JobState state) {
        DesignGraph graph = state.design()
                .orElseThrow(() -> new MalformedInputException("No design loaded for job " + state.jobId()));
        ProcessingMode mode = classifier.classify(graph);
        log.info("Job {}: {} nodes -> {} mode", state.jobId(), graph.nodeCount(), mode);
        return Map.of(
                JobState.MODE, mode.name(),
                JobState.STATUS, JobStatus.PLANNING.name()
        );
    }
}
