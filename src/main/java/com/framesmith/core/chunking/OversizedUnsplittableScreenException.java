package com.framesmith.core.chunking;

/**
 * Thrown when a subtree still exceeds oracle capacity after the maximum number of re-splits.
 * Scoped to that subtree: it becomes a FAILED screen and its siblings proceed.
 */
public class OversizedUnsplittableScreenException extends RuntimeException {

    private final String nodeId;
    private final int nodeCount;

    public OversizedUnsplittableScreenException(String nodeId, int nodeCount, int capacity, int splitDepth) {
        super("Subtree " + nodeId + " has " + nodeCount + " nodes, over capacity " + capacity
                + " after " + splitDepth + " split levels");
        this.nodeId = nodeId;
        this.nodeCount = nodeCount;
    }

    public String getNodeId() {
        return nodeId;
    }

    public int getNodeCount() {
        return nodeCount;
    }
}
