package com.framesmith.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Registry record for a deduplicated, reusable generated component.
 *
 * @param name         normalized name, the registry key
 * @param displayName  name as the oracle reported it
 * @param filePath     path of the generated component file
 * @param designTokens design tokens the component uses
 * @param variants     known variants (merged across registrations)
 * @param screensUsed  ids of screens using the component (merged across registrations)
 * @param dependencies other components this one depends on
 * @param apiEndpoints API endpoints the component calls
 * @param generatedAt  when the first registration happened
 */
public record ComponentDescriptor(
    String name,
    String displayName,
    String filePath,
    List<String> designTokens,
    Set<String> variants,
    Set<String> screensUsed,
    List<String> dependencies,
    List<String> apiEndpoints,
    Instant generatedAt
) implements Serializable {

    public ComponentDescriptor {
        designTokens = designTokens == null ? List.of() : List.copyOf(designTokens);
        variants = variants == null ? Set.of() : orderedCopy(variants);
        screensUsed = screensUsed == null ? Set.of() : orderedCopy(screensUsed);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        apiEndpoints = apiEndpoints == null ? List.of() : List.copyOf(apiEndpoints);
    }

    /**
     * Whether two descriptors carry the same generated content. Variants and screen usage
     * are merge-able metadata and do not count.
     */
    public boolean sameContentAs(ComponentDescriptor other) {
        return Objects.equals(filePath, other.filePath)
                && Objects.equals(new LinkedHashSet<>(designTokens), new LinkedHashSet<>(other.designTokens))
                && Objects.equals(new LinkedHashSet<>(dependencies), new LinkedHashSet<>(other.dependencies))
                && Objects.equals(new LinkedHashSet<>(apiEndpoints), new LinkedHashSet<>(other.apiEndpoints));
    }

    public ComponentDescriptor withUsage(Set<String> mergedVariants, Set<String> mergedScreens) {
        return new ComponentDescriptor(name, displayName, filePath, designTokens,
                mergedVariants, mergedScreens, dependencies, apiEndpoints, generatedAt);
    }

    private static Set<String> orderedCopy(Set<String> source) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(source));
    }
}
