package com.framesmith.core.chunking;

import com.framesmith.core.model.DesignGraph;
import com.framesmith.core.model.DesignNode;
import com.framesmith.core.model.Screen;
import com.framesmith.core.model.ScreenStatus;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Turns planned candidates into self-contained {@link Screen}s. Ordinals follow plan order, which is
 * depth-first document order.
 */
@Service
public class ScreenExtractor {

    public List<Screen> extractAll(DesignGraph graph, ScreenPlan plan) {
        var screens = new ArrayList<Screen>(plan.candidates().size());
        int ordinal = 0;
        for (ScreenCandidate candidate : plan.candidates()) {
            screens.add(extract(graph, candidate, ordinal++));
        }
        return screens;
    }

    public Screen extract(DesignGraph graph, ScreenCandidate candidate, int ordinal) {
        DesignNode node = graph.node(candidate.rootId())
                .orElseThrow(() -> new IllegalArgumentException("Unknown screen root: " + candidate.rootId()));
        List<DesignNode> ancestors = graph.ancestors(node.id());
        List<String> ancestorIds = ancestors.stream().map(DesignNode::id).toList();
        List<String> ancestorPath = ancestors.stream().map(DesignNode::name).toList();

        DesignNode root = node;
        String name = node.name();
        if (candidate.isVirtual()) {
            Set<String> keep = Set.copyOf(candidate.partChildIds());
            root = node.withChildren(node.children().stream().filter(c -> keep.contains(c.id())).toList());
            name = node.name() + " (" + candidate.screenId().substring(candidate.screenId().indexOf('#') + 1) + ")";
        }

        Screen screen = Screen.pending(candidate.screenId(), name, root, ordinal, ancestorIds, ancestorPath);
        // rejected roots keep the full subtree for coverage; FAILED screens are never dispatched
        if (candidate.isRejected()) {
            screen = screen.transitionTo(ScreenStatus.FAILED, candidate.rejection());
        }
        return screen;
    }
}
