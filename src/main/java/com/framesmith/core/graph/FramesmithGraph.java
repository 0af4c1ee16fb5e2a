package com.framesmith.core.graph;

import com.framesmith.core.nodes.ClassifyDesignNode;
import com.framesmith.core.nodes.DispatchScreensNode;
import com.framesmith.core.nodes.LoadDesignNode;
import com.framesmith.core.nodes.MergeResultsNode;
import com.framesmith.core.nodes.PlanScreensNode;
import com.framesmith.core.nodes.SynthesizeNavigationNode;
import com.framesmith.core.state.JobState;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} that drives a generation job.
 * <pre>
 *   START -> load_design -> classify_design -> plan_screens -> [routeAfterPlan]
 *            -> END                                  (analysis only)
 *            -> dispatch_screens -> synthesize_navigation -> merge_results -> END
 * </pre>
 */
@Component
public class FramesmithGraph {

    private static final Logger log = LoggerFactory.getLogger(FramesmithGraph.class);

    private final CompiledGraph<JobState> compiledGraph;

    public FramesmithGraph(
            LoadDesignNode loadNode,
            ClassifyDesignNode classifyNode,
            PlanScreensNode planNode,
            DispatchScreensNode dispatchNode,
            SynthesizeNavigationNode navigationNode,
            MergeResultsNode mergeNode) throws Exception {

        var graph = new StateGraph<>(JobState.SCHEMA, JobState::new)
                .addNode("load_design", node_async(loadNode::apply))
                .addNode("classify_design", node_async(classifyNode::apply))
                .addNode("plan_screens", node_async(planNode::apply))
                .addNode("dispatch_screens", node_async(dispatchNode::apply))
                .addNode("synthesize_navigation", node_async(navigationNode::apply))
                .addNode("merge_results", node_async(mergeNode::apply))
                .addEdge(START, "load_design")
                .addEdge("load_design", "classify_design")
                .addEdge("classify_design", "plan_screens")
                .addConditionalEdges("plan_screens",
                        edge_async(this::routeAfterPlan),
                        Map.of("dispatch_screens", "dispatch_screens",
                                END, END))
                .addEdge("dispatch_screens", "synthesize_navigation")
                .addEdge("synthesize_navigation", "merge_results")
                .addEdge("merge_results", END);

        // acyclic graph, so the default step limit is never reached
        this.compiledGraph = graph.compile(CompileConfig.builder().build());
        log.info("Generation graph compiled");
    }

    /**
     * Analysis-only jobs stop once screens are planned.
     */
    String routeAfterPlan(JobState state) {
        return state.analyzeOnly() ? END : "dispatch_screens";
    }

    public CompiledGraph<JobState> getCompiledGraph() {
        return compiledGraph;
    }
}
