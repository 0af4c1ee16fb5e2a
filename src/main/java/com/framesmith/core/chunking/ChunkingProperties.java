package com.framesmith.core.chunking;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "framesmith.chunking")
public class ChunkingProperties {

    /** Node count at or above which a document is processed screen by screen. */
    private int nodeThreshold = 10_000;

    /** Maximum node count the oracle accepts in a single call. */
    private int screenCapacity = 10_000;

    /** Depth of screen roots: document (0), page (1), frame (2). */
    private int screenDepth = 2;

    /** How many times an oversized subtree may be re-split before it is rejected. */
    private int maxSplitDepth = 4;

    public int getNodeThreshold() {
        return nodeThreshold;
    }

    public void setNodeThreshold(int nodeThreshold) {
        this.nodeThreshold = nodeThreshold;
    }

    public int getScreenCapacity() {
        return screenCapacity;
    }

    public void setScreenCapacity(int screenCapacity) {
        this.screenCapacity = screenCapacity;
    }

    public int getScreenDepth() {
        return screenDepth;
    }

    public void setScreenDepth(int screenDepth) {
        this.screenDepth = screenDepth;
    }

    public int getMaxSplitDepth() {
        return maxSplitDepth;
    }

    public void setMaxSplitDepth(int maxSplitDepth) {
        this.maxSplitDepth = maxSplitDepth;
    }
}
