package com.framesmith.core.nodes;

import com.framesmith.core.chunking.ChunkingProperties;
import com.framesmith.core.chunking.ScreenExtractor;
import com.framesmith.core.chunking.SizeClassifier;
import com.framesmith.core.chunking.StructureAnalyzer;
import com.framesmith.core.loader.DesignGraphLoader;
import com.framesmith.core.loader.MalformedInputException;
import com.framesmith.core.model.DesignGraph;
import com.framesmith.core.model.JobStatus;
import com.framesmith.core.model.ProcessingMode;
import com.framesmith.core.model.Screen;
import com.framesmith.core.state.JobState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the load, classify and plan nodes run one after another on hand-built state.
 */
class PlanningNodesTest {

    private static final String DESIGN = """
            {"name": "Tiny", "document": {"id": "0:0", "type": "DOCUMENT", "children": [
              {"id": "1:1", "type": "CANVAS", "children": [
                {"id": "2:1", "type": "FRAME", "name": "Home", "children": [{"id": "3:1", "type": "TEXT"}]},
                {"id": "2:2", "type": "FRAME", "name": "About", "children": [{"id": "3:2", "type": "TEXT"}]}
              ]}
            ]}}
            """;

    private final ChunkingProperties chunking = new ChunkingProperties();

    @Test
    @DisplayName("Load, classify and plan produce chunked screens for a document over the threshold")
    void loadClassifyPlan() {
        chunking.setNodeThreshold(5);
        var data = new HashMap<String, Object>(Map.of(JobState.JOB_ID, "FSMT-NODE-0001", JobState.DESIGN_JSON, DESIGN));

        data.putAll(new LoadDesignNode(new DesignGraphLoader()).apply(new JobState(data)));
        assertEquals(JobStatus.CLASSIFYING.name(), data.get(JobState.STATUS));
        assertEquals(6, ((DesignGraph) data.get(JobState.DESIGN)).nodeCount());

        data.putAll(new ClassifyDesignNode(new SizeClassifier(chunking)).apply(new JobState(data)));
        assertEquals(ProcessingMode.CHUNKED.name(), data.get(JobState.MODE));

        data.putAll(new PlanScreensNode(new StructureAnalyzer(chunking), new ScreenExtractor()).apply(new JobState(data)));
        JobState state = new JobState(data);
        assertEquals(List.of("Home", "About"), state.screens().stream().map(Screen::name).toList());
        assertEquals(List.of("0:0", "1:1"), state.sharedNodeIds());
        assertEquals(JobStatus.GENERATING, state.status());
    }

    @Test
    @DisplayName("Classify without a loaded design is malformed input")
    void classifyWithoutDesign() {
        var state = new JobState(Map.of(JobState.JOB_ID, "FSMT-NODE-0002"));
        assertThrows(MalformedInputException.class,
                () -> new ClassifyDesignNode(new SizeClassifier(chunking)).apply(state));
    }

    @Test
    @DisplayName("Load rejects a document that is not JSON")
    void loadRejectsGarbage() {
        var state = new JobState(Map.of(JobState.JOB_ID, "FSMT-NODE-0003", JobState.DESIGN_JSON, "<xml/>"));
        assertThrows(MalformedInputException.class, () -> new LoadDesignNode(new DesignGraphLoader()).apply(state));
    }
}
