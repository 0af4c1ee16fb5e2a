package com.framesmith.core.chunking;

import com.framesmith.core.model.DesignGraph;
import com.framesmith.core.model.DesignNode;
import com.framesmith.core.model.ProcessingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Partitions a design graph into capacity-bounded screen candidates.
 * <p>
 * Screen roots are the nodes at the configured screen depth (document, page, frame). A node above that
 * depth whose subtree never reaches it is a screen root itself. Every node above a screen root is a
 * shared container, listed as an ancestor by each screen below it. Screen roots that exceed the oracle
 * capacity are re-split into virtual parts, up to the configured split depth.
 */
@Service
public class StructureAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(StructureAnalyzer.class);

    private final ChunkingProperties properties;

    public StructureAnalyzer(ChunkingProperties properties) {
        this.properties = properties;
    }

    public ScreenPlan plan(DesignGraph graph, ProcessingMode mode) {
        int capacity = properties.getScreenCapacity();
        if (capacity < 2) {
            throw new IllegalStateException("framesmith.chunking.screen-capacity must be at least 2, was " + capacity);
        }
        var shared = new LinkedHashSet<String>();
        List<DesignNode> roots = mode == ProcessingMode.STANDARD
                ? List.of(graph.root())
                : screenRoots(graph.root(), shared);

        var candidates = new ArrayList<ScreenCandidate>();
        for (DesignNode root : roots) {
            if (root.subtreeSize() <= capacity) {
                candidates.add(ScreenCandidate.whole(root.id(), root.subtreeSize()));
                continue;
            }
            log.info("Screen {} has {} nodes, over capacity {}; splitting", root.id(), root.subtreeSize(), capacity);
            split(root, 1, capacity, candidates, shared);
        }

        long rejected = candidates.stream().filter(ScreenCandidate::isRejected).count();
        log.info("Planned {} screens ({} rejected, {} shared containers) for '{}' in {} mode",
                candidates.size(), rejected, shared.size(), graph.documentName(), mode);
        return new ScreenPlan(mode, candidates, shared);
    }

    /**
     * Screen roots in depth-first document order. Containers passed on the way are added to {@code shared}.
     */
    List<DesignNode> screenRoots(DesignNode documentRoot, Set<String> shared) {
        int screenDepth = properties.getScreenDepth();
        var roots = new ArrayList<DesignNode>();
        Deque<Positioned> stack = new ArrayDeque<>();
        stack.push(new Positioned(documentRoot, 0));
        while (!stack.isEmpty()) {
            Positioned current = stack.pop();
            DesignNode node = current.node();
            if (current.depth() >= screenDepth || !reachesDepth(node, screenDepth - current.depth())) {
                roots.add(node);
                continue;
            }
            shared.add(node.id());
            for (int i = node.children().size() - 1; i >= 0; i--) {
                stack.push(new Positioned(node.children().get(i), current.depth() + 1));
            }
        }
        return roots;
    }

    private static boolean reachesDepth(DesignNode node, int remaining) {
        if (remaining <= 0) {
            return true;
        }
        for (DesignNode child : node.children()) {
            if (reachesDepth(child, remaining - 1)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Packs the children of an oversized node into consecutive bins. Each bin also carries a stripped copy of
     * the node itself. Children that are oversized on their own are split one level further down.
     */
    private void split(DesignNode node, int splitDepth, int capacity,
                       List<ScreenCandidate> out, Set<String> shared) {
        try {
            var parts = new ArrayList<ScreenCandidate>();
            var splitNodes = new LinkedHashSet<String>();
            splitInto(node, splitDepth, capacity, parts, splitNodes);
            out.addAll(parts);
            shared.addAll(splitNodes);
        } catch (OversizedUnsplittableScreenException e) {
            log.warn("Rejecting subtree {}: {}", node.id(), e.getMessage());
            out.add(ScreenCandidate.rejected(node.id(), node.subtreeSize(), e.getMessage()));
        }
    }

    private void splitInto(DesignNode node, int splitDepth, int capacity,
                           List<ScreenCandidate> out, Set<String> shared) {
        if (splitDepth > properties.getMaxSplitDepth()) {
            throw new OversizedUnsplittableScreenException(node.id(), node.subtreeSize(), capacity,
                    properties.getMaxSplitDepth());
        }
        shared.add(node.id());
        int part = 0;
        var bin = new ArrayList<String>();
        int binSize = 1;
        for (DesignNode child : node.children()) {
            if (child.subtreeSize() + 1 > capacity) {
                if (!bin.isEmpty()) {
                    out.add(ScreenCandidate.part(node.id(), ++part, bin, binSize));
                    bin = new ArrayList<>();
                    binSize = 1;
                }
                if (child.subtreeSize() <= capacity) {
                    out.add(ScreenCandidate.whole(child.id(), child.subtreeSize()));
                } else {
                    split(child, splitDepth + 1, capacity, out, shared);
                }
                continue;
            }
            if (binSize + child.subtreeSize() > capacity) {
                out.add(ScreenCandidate.part(node.id(), ++part, bin, binSize));
                bin = new ArrayList<>();
                binSize = 1;
            }
            bin.add(child.id());
            binSize += child.subtreeSize();
        }
        if (!bin.isEmpty()) {
            out.add(ScreenCandidate.part(node.id(), ++part, bin, binSize));
        }
    }

    private record Positioned(DesignNode node, int depth) {}
}
