package com.framesmith.core.nodes;

import com.framesmith.core.loader.DesignGraphLoader;
import com.framesmith.core.loader.MalformedInputException;
import com.framesmith.core.model.DesignGraph;
import com.framesmith.core.model.JobStatus;
import com.framesmith.core.state.JobState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Parses the raw design document into a {@link DesignGraph}.
 * {@link MalformedInputException} propagates and aborts the job.
 */
@Component
public class LoadDesignNode {

    private static final Logger log = LoggerFactory.getLogger(LoadDesignNode.class);

    private final DesignGraphLoader loader;

    public LoadDesignNode(DesignGraphLoader loader) {
        this.loader = loader;
    }

    public Map<String, Object> apply(JobState state) {
        DesignGraph graph = loader.load(state.designJson());
        log.info("Job {}: design '{}' loaded ({} nodes)", state.jobId(), graph.documentName(), graph.nodeCount());
        return Map.of(
                JobState.DESIGN, graph,
                JobState.STATUS, JobStatus.CLASSIFYING.name()
        );
    }
}
