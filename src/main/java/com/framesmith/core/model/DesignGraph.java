package com.framesmith.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable in-memory design document: the root node plus lookup indexes built once at load.
 */
public final class DesignGraph implements Serializable {

    private final String documentName;
    private final DesignNode root;
    private final Map<String, DesignNode> nodesById;
    private final Map<String, String> parentIds;
    private final Map<String, Integer> depths;

    public DesignGraph(String documentName, DesignNode root) {
        this.documentName = documentName;
        this.root = root;
        var nodes = new HashMap<String, DesignNode>(root.subtreeSize() * 2);
        var parents = new HashMap<String, String>(root.subtreeSize() * 2);
        var depthIndex = new HashMap<String, Integer>(root.subtreeSize() * 2);
        index(root, nodes, parents, depthIndex);
        this.nodesById = Collections.unmodifiableMap(nodes);
        this.parentIds = Collections.unmodifiableMap(parents);
        this.depths = Collections.unmodifiableMap(depthIndex);
    }

    private static void index(DesignNode root, Map<String, DesignNode> nodes,
                              Map<String, String> parents, Map<String, Integer> depthIndex) {
        var stack = new ArrayList<DesignNode>();
        stack.add(root);
        depthIndex.put(root.id(), 0);
        while (!stack.isEmpty()) {
            var node = stack.remove(stack.size() - 1);
            nodes.put(node.id(), node);
            int depth = depthIndex.get(node.id());
            for (var child : node.children()) {
                parents.put(child.id(), node.id());
                depthIndex.put(child.id(), depth + 1);
                stack.add(child);
            }
        }
    }

    public String documentName() {
        return documentName;
    }

    public DesignNode root() {
        return root;
    }

    public int nodeCount() {
        return root.subtreeSize();
    }

    public Optional<DesignNode> node(String id) {
        return Optional.ofNullable(nodesById.get(id));
    }

    public Optional<String> parentId(String id) {
        return Optional.ofNullable(parentIds.get(id));
    }

    public int depth(String id) {
        Integer depth = depths.get(id);
        if (depth == null) {
            throw new IllegalArgumentException("Unknown node id: " + id);
        }
        return depth;
    }

    public boolean contains(String id) {
        return nodesById.containsKey(id);
    }

    public Set<String> nodeIds() {
        return nodesById.keySet();
    }

    /**
     * Ancestors of the given node, outermost first (root ... parent).
     */
    public List<DesignNode> ancestors(String id) {
        var chain = new ArrayList<DesignNode>();
        String current = parentIds.get(id);
        while (current != null) {
            chain.add(nodesById.get(current));
            current = parentIds.get(current);
        }
        Collections.reverse(chain);
        return chain;
    }
}
