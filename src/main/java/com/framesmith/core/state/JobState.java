package com.framesmith.core.state;

import com.framesmith.core.model.AggregateResult;
import com.framesmith.core.model.DesignGraph;
import com.framesmith.core.model.GeneratedArtifact;
import com.framesmith.core.model.GenerationOptions;
import com.framesmith.core.model.JobStatus;
import com.framesmith.core.model.NavigationMap;
import com.framesmith.core.model.ProcessingMode;
import com.framesmith.core.model.Screen;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Graph state for one generation job.
 * <p>
 * Every channel is a plain replace channel: nodes that extend a list (warnings) return the full new list.
 * Enums are stored by name.
 */
public class JobState extends AgentState {

    public static final String JOB_ID = "jobId";
    public static final String DESIGN_JSON = "designJson";
    public static final String OPTIONS = "options";
    public static final String ANALYZE_ONLY = "analyzeOnly";
    public static final String STATUS = "status";
    public static final String DESIGN = "design";
    public static final String MODE = "mode";
    public static final String SHARED_NODE_IDS = "sharedNodeIds";
    public static final String SCREENS = "screens";
    public static final String ARTIFACTS = "artifacts";
    public static final String NAVIGATION = "navigation";
    public static final String RESULT = "result";
    public static final String WARNINGS = "warnings";
    public static final String STARTED_AT = "startedAt";

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        Map.entry(JOB_ID,          Channels.base(() -> "")),
        Map.entry(DESIGN_JSON,     Channels.base(() -> "")),
        Map.entry(OPTIONS,         Channels.base(GenerationOptions::defaults)),
        Map.entry(ANALYZE_ONLY,    Channels.base(() -> false)),
        Map.entry(STATUS,          Channels.base(() -> JobStatus.LOADING.name())),
        Map.entry(DESIGN,          Channels.base((Reducer<DesignGraph>) null)),
        Map.entry(MODE,            Channels.base(() -> ProcessingMode.STANDARD.name())),
        Map.entry(SHARED_NODE_IDS, Channels.base((Supplier<List<String>>) List::of)),
        Map.entry(SCREENS,         Channels.base((Supplier<List<Screen>>) List::of)),
        Map.entry(ARTIFACTS,       Channels.base((Supplier<List<GeneratedArtifact>>) List::of)),
        Map.entry(NAVIGATION,      Channels.base(NavigationMap::empty)),
        Map.entry(RESULT,          Channels.base((Reducer<AggregateResult>) null)),
        Map.entry(WARNINGS,        Channels.base((Supplier<List<String>>) List::of)),
        Map.entry(STARTED_AT,      Channels.base(() -> 0L))
    );

    public JobState(Map<String, Object> initData) {
        super(initData);
    }

    public String jobId() {
        return this.<String>value(JOB_ID).orElse("");
    }

    public String designJson() {
        return this.<String>value(DESIGN_JSON).orElse("");
    }

    public GenerationOptions options() {
        return this.<GenerationOptions>value(OPTIONS).orElse(GenerationOptions.defaults());
    }

    public boolean analyzeOnly() {
        return this.<Boolean>value(ANALYZE_ONLY).orElse(false);
    }

    public JobStatus status() {
        return JobStatus.valueOf(this.<String>value(STATUS).orElse(JobStatus.LOADING.name()));
    }

    public Optional<DesignGraph> design() {
        return this.value(DESIGN);
    }

    public ProcessingMode mode() {
        return ProcessingMode.valueOf(this.<String>value(MODE).orElse(ProcessingMode.STANDARD.name()));
    }

    public List<String> sharedNodeIds() {
        return this.<List<String>>value(SHARED_NODE_IDS).orElse(List.of());
    }

    public List<Screen> screens() {
        return this.<List<Screen>>value(SCREENS).orElse(List.of());
    }

    public List<GeneratedArtifact> artifacts() {
        return this.<List<GeneratedArtifact>>value(ARTIFACTS).orElse(List.of());
    }

    public NavigationMap navigation() {
        return this.<NavigationMap>value(NAVIGATION).orElse(NavigationMap.empty());
    }

    public Optional<AggregateResult> result() {
        return this.value(RESULT);
    }

    public List<String> warnings() {
        return this.<List<String>>value(WARNINGS).orElse(List.of());
    }

    public long startedAt() {
        return this.<Long>value(STARTED_AT).orElse(0L);
    }
}
