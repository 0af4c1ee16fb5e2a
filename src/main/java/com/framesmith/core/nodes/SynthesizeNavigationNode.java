package com.framesmith.core.nodes;

import com.framesmith.core.engine.ActiveJobs;
import com.framesmith.core.model.NavigationMap;
import com.framesmith.core.navigation.NavigationSynthesizer;
import com.framesmith.core.state.JobState;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class SynthesizeNavigationNode {

    private final NavigationSynthesizer synthesizer;
    private final ActiveJobs activeJobs;

    public SynthesizeNavigationNode(NavigationSynthesizer synthesizer, ActiveJobs activeJobs) {
        this.synthesizer = synthesizer;
        this.activeJobs = activeJobs;
    }

    public Map<String, Object> apply(JobState state) {
        var registry = activeJobs.require(state.jobId()).registry();
        NavigationMap navigation = synthesizer.synthesize(state.screens(), state.artifacts(), registry);
        return Map.of(JobState.NAVIGATION, navigation);
    }
}
