package com.framesmith.core.chunking;

import java.io.Serializable;
import java.util.List;

/**
 * A planned screen before extraction.
 *
 * @param screenId     final screen id; {@code rootId} or {@code rootId#partN}
 * @param rootId       id of the node the screen is rooted at
 * @param partChildIds for virtual parts, the ids of the root's children this part holds; empty otherwise
 * @param nodeCount    nodes the extracted screen will contain
 * @param rejection    why the candidate cannot be dispatched, or null
 */
public record ScreenCandidate(
    String screenId,
    String rootId,
    List<String> partChildIds,
    int nodeCount,
    String rejection
) implements Serializable {

    public ScreenCandidate {
        partChildIds = partChildIds == null ? List.of() : List.copyOf(partChildIds);
    }

    public static ScreenCandidate whole(String rootId, int nodeCount) {
        return new ScreenCandidate(rootId, rootId, List.of(), nodeCount, null);
    }

    public static ScreenCandidate part(String rootId, int partNumber, List<String> childIds, int nodeCount) {
        return new ScreenCandidate(rootId + "#part" + partNumber, rootId, childIds, nodeCount, null);
    }

    public static ScreenCandidate rejected(String rootId, int nodeCount, String reason) {
        return new ScreenCandidate(rootId, rootId, List.of(), nodeCount, reason);
    }

    public boolean isVirtual() {
        return !partChildIds.isEmpty();
    }

    public boolean isRejected() {
        return rejection != null;
    }
}
