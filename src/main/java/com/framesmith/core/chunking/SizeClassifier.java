package com.framesmith.core.chunking;

import com.framesmith.core.model.DesignGraph;
import com.framesmith.core.model.ProcessingMode;
import org.springframework.stereotype.Service;

/**
 * Decides whether a design fits a single oracle call.
 */
@Service
public class SizeClassifier {

    private final ChunkingProperties properties;

    public SizeClassifier(ChunkingProperties properties) {
        this.properties = properties;
    }

    public ProcessingMode classify(DesignGraph graph) {
        return classify(graph.nodeCount(), properties.getNodeThreshold());
    }

    public static ProcessingMode classify(int nodeCount, int threshold) {
        return nodeCount < threshold ? ProcessingMode.STANDARD : ProcessingMode.CHUNKED;
    }
}
