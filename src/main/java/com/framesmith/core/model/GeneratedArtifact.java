package com.framesmith.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Per-screen result of an oracle round trip. Written by the dispatch node, read by the merge node.
 *
 * @param screenId      screen the artifact belongs to
 * @param ordinal       screen ordinal, used for merge ordering and collision suffixes
 * @param uiFiles       generated UI component files
 * @param apiFiles      generated API handler files
 * @param components    descriptors this screen produced
 * @param componentRefs normalized names of registry components this screen referenced
 * @param rawResponse   raw oracle text of the last attempt, may be null
 * @param success       whether generation succeeded
 * @param error         failure detail when {@code success} is false
 * @param attempts      oracle calls made, including retries
 * @param elapsedMs     wall time spent on this screen
 * @param costUnits     oracle usage units consumed
 */
public record GeneratedArtifact(
    String screenId,
    int ordinal,
    List<GeneratedFile> uiFiles,
    List<GeneratedFile> apiFiles,
    List<ComponentDescriptor> components,
    List<String> componentRefs,
    String rawResponse,
    boolean success,
    String error,
    int attempts,
    long elapsedMs,
    long costUnits
) implements Serializable {

    public GeneratedArtifact {
        uiFiles = uiFiles == null ? List.of() : List.copyOf(uiFiles);
        apiFiles = apiFiles == null ? List.of() : List.copyOf(apiFiles);
        components = components == null ? List.of() : List.copyOf(components);
        componentRefs = componentRefs == null ? List.of() : List.copyOf(componentRefs);
    }

    public static GeneratedArtifact failed(Screen screen, String error, String rawResponse,
                                           int attempts, long elapsedMs, long costUnits) {
        return new GeneratedArtifact(screen.id(), screen.ordinal(), List.of(), List.of(), List.of(), List.of(),
                rawResponse, false, error, attempts, elapsedMs, costUnits);
    }

    public int fileCount() {
        return uiFiles.size() + apiFiles.size();
    }
}
