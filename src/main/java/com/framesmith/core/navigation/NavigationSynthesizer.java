package com.framesmith.core.navigation;

import com.framesmith.core.model.ComponentDescriptor;
import com.framesmith.core.model.GeneratedArtifact;
import com.framesmith.core.model.GeneratedFile;
import com.framesmith.core.model.NavigationMap;
import com.framesmith.core.model.RouteEntry;
import com.framesmith.core.model.Screen;
import com.framesmith.core.model.ScreenStatus;
import com.framesmith.core.registry.ComponentRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds the route map over the screens that succeeded. Failed and skipped screens get no route.
 */
@Service
public class NavigationSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(NavigationSynthesizer.class);

    public NavigationMap synthesize(List<Screen> screens, List<GeneratedArtifact> artifacts,
                                    ComponentRegistry registry) {
        Map<String, GeneratedArtifact> byScreen = new HashMap<>();
        for (GeneratedArtifact artifact : artifacts) {
            byScreen.put(artifact.screenId(), artifact);
        }

        List<Screen> succeeded = screens.stream()
                .filter(s -> s.status() == ScreenStatus.SUCCEEDED)
                .sorted(Comparator.comparingInt(Screen::ordinal))
                .toList();

        Set<String> used = new HashSet<>();
        var routes = new ArrayList<RouteEntry>(succeeded.size());
        for (Screen screen : succeeded) {
            String slug = uniqueSlug(slugify(screen.name()), screen.displayOrdinal(), used);
            String entry = entryFile(byScreen.get(screen.id()), registry);
            routes.add(new RouteEntry(slug, "/" + slug, screen.id(), screen.name(), screen.ordinal(), entry));
        }
        log.info("Synthesized {} routes ({} screens without a route)", routes.size(), screens.size() - routes.size());
        return new NavigationMap(routes);
    }

    /**
     * Lowercased, trimmed name with whitespace turned into hyphens and anything outside {@code [a-z0-9-]}
     * removed.
     */
    public static String slugify(String name) {
        if (name == null) {
            return "screen";
        }
        String slug = name.trim().toLowerCase(Locale.ROOT)
                .replaceAll("\\s+", "-")
                .replaceAll("[^a-z0-9-]", "")
                .replaceAll("-{2,}", "-")
                .replaceAll("^-|-$", "");
        return slug.isEmpty() ? "screen" : slug;
    }

    static String uniqueSlug(String base, int displayOrdinal, Set<String> used) {
        String slug = base;
        if (used.contains(slug)) {
            slug = base + "-" + displayOrdinal;
            int counter = 2;
            while (used.contains(slug)) {
                slug = base + "-" + displayOrdinal + "-" + counter++;
            }
        }
        used.add(slug);
        return slug;
    }

    /**
     * First page or screen UI file, else the first UI file, else the path of a component the screen
     * produced or referenced.
     */
    static String entryFile(GeneratedArtifact artifact, ComponentRegistry registry) {
        if (artifact == null) {
            return null;
        }
        for (GeneratedFile file : artifact.uiFiles()) {
            if (file.path().contains("pages/") || file.path().contains("screens/")) {
                return file.path();
            }
        }
        if (!artifact.uiFiles().isEmpty()) {
            return artifact.uiFiles().get(0).path();
        }
        for (ComponentDescriptor component : artifact.components()) {
            if (component.filePath() != null) {
                return component.filePath();
            }
        }
        if (registry != null) {
            for (String ref : artifact.componentRefs()) {
                var descriptor = registry.resolve(ref);
                if (descriptor.isPresent() && descriptor.get().filePath() != null) {
                    return descriptor.get().filePath();
                }
            }
        }
        return null;
    }
}
