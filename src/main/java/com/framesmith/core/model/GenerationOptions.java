package com.framesmith.core.model;

import java.io.Serializable;
import java.util.Set;

/**
 * Caller-supplied options for a generation job.
 *
 * @param frontendFramework target UI stack (e.g. "react")
 * @param backendFramework  target API stack (e.g. "nodejs")
 * @param includeTests      ask the oracle for test files
 * @param includeDocs       ask the oracle for documentation
 * @param userMessage       free-form extra requirements, may be null
 * @param targetScreens     screen ids or names to process; empty means all
 */
public record GenerationOptions(
    String frontendFramework,
    String backendFramework,
    boolean includeTests,
    boolean includeDocs,
    String userMessage,
    Set<String> targetScreens
) implements Serializable {

    public GenerationOptions {
        targetScreens = targetScreens == null ? Set.of() : Set.copyOf(targetScreens);
    }

    public static GenerationOptions defaults() {
        return new GenerationOptions("react", "nodejs", false, false, null, Set.of());
    }

    /**
     * True when the screen should be processed under the target filter.
     */
    public boolean selects(Screen screen) {
        if (targetScreens.isEmpty()) {
            return true;
        }
        String rootId = screen.isVirtual() ? screen.id().substring(0, screen.id().indexOf('#')) : screen.id();
        return targetScreens.contains(screen.id())
                || targetScreens.contains(rootId)
                || targetScreens.stream().anyMatch(t -> t.equalsIgnoreCase(screen.name().trim()));
    }
}
