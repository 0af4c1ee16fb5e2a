package com.framesmith.core.chunking;

import com.framesmith.core.model.ProcessingMode;

import java.io.Serializable;
import java.util.List;
import java.util.Set;

/**
 * Ordered screen candidates for one design, plus the container nodes they share.
 */
public record ScreenPlan(
    ProcessingMode mode,
    List<ScreenCandidate> candidates,
    Set<String> sharedNodeIds
) implements Serializable {

    public ScreenPlan {
        candidates = List.copyOf(candidates);
        sharedNodeIds = Set.copyOf(sharedNodeIds);
    }

    public long rejectedCount() {
        return candidates.stream().filter(ScreenCandidate::isRejected).count();
    }
}
