package com.framesmith.core.navigation;

import com.framesmith.core.model.ComponentDescriptor;
import com.framesmith.core.model.DesignNode;
import com.framesmith.core.model.GeneratedArtifact;
import com.framesmith.core.model.GeneratedFile;
import com.framesmith.core.model.NavigationMap;
import com.framesmith.core.model.Screen;
import com.framesmith.core.model.ScreenStatus;
import com.framesmith.core.registry.ComponentRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class NavigationSynthesizerTest {

    private final NavigationSynthesizer synthesizer = new NavigationSynthesizer();

    private static Screen screen(String id, String name, int ordinal, ScreenStatus status) {
        Screen s = Screen.pending(id, name, DesignNode.leaf(id, "FRAME", name), ordinal, List.of(), List.of());
        return switch (status) {
            case PENDING -> s;
            case SKIPPED -> s.transitionTo(ScreenStatus.SKIPPED, "cancelled");
            case FAILED -> s.transitionTo(ScreenStatus.PROCESSING).transitionTo(ScreenStatus.FAILED, "ParseError: x");
            case PROCESSING -> s.transitionTo(ScreenStatus.PROCESSING);
            case SUCCEEDED -> s.transitionTo(ScreenStatus.PROCESSING).transitionTo(ScreenStatus.SUCCEEDED);
        };
    }

    private static GeneratedArtifact artifact(String screenId, int ordinal, List<GeneratedFile> ui, List<String> refs) {
        return new GeneratedArtifact(screenId, ordinal, ui, List.of(), List.of(), refs, "{}", true, null, 1, 10, 5);
    }

    @Nested
    @DisplayName("Slugs")
    class Slugs {

        @Test
        @DisplayName("Names are lowercased, trimmed and hyphenated")
        void slugify() {
            assertEquals("home", NavigationSynthesizer.slugify("Home"));
            assertEquals("home", NavigationSynthesizer.slugify("home "));
            assertEquals("order-history", NavigationSynthesizer.slugify("  Order   History "));
            assertEquals("faq-help", NavigationSynthesizer.slugify("FAQ / Help!"));
            assertEquals("screen", NavigationSynthesizer.slugify("???"));
            assertEquals("screen", NavigationSynthesizer.slugify(null));
        }

        @Test
        @DisplayName("\"Home\" and \"home \" become home and home-2")
        void duplicateNames() {
            var screens = List.of(
                    screen("1:1", "Home", 0, ScreenStatus.SUCCEEDED),
                    screen("1:2", "home ", 1, ScreenStatus.SUCCEEDED));

            NavigationMap map = synthesizer.synthesize(screens, List.of(), new ComponentRegistry());

            assertEquals(List.of("home", "home-2"), map.slugs());
            assertEquals("/home-2", map.route("1:2").orElseThrow().path());
        }

        @Test
        @DisplayName("A suffix that is itself taken gets a counter")
        void suffixTaken() {
            Set<String> used = new HashSet<>(Set.of("home", "home-3"));
            assertEquals("home-3-2", NavigationSynthesizer.uniqueSlug("home", 3, used));
            assertTrue(used.contains("home-3-2"));
        }
    }

    @Test
    @DisplayName("Only succeeded screens get routes, in ordinal order")
    void failedScreensExcluded() {
        var screens = List.of(
                screen("1:3", "Checkout", 2, ScreenStatus.FAILED),
                screen("1:2", "Catalog", 1, ScreenStatus.SUCCEEDED),
                screen("1:1", "Home", 0, ScreenStatus.SUCCEEDED),
                screen("1:4", "Help", 3, ScreenStatus.SKIPPED));

        NavigationMap map = synthesizer.synthesize(screens, List.of(), new ComponentRegistry());

        assertEquals(List.of("home", "catalog"), map.slugs());
        assertTrue(map.route("1:3").isEmpty());
        assertTrue(map.route("1:4").isEmpty());
    }

    @Nested
    @DisplayName("Entry files")
    class EntryFiles {

        @Test
        @DisplayName("A page file wins over other UI files")
        void pageFilePreferred() {
            var artifact = artifact("1:1", 0, List.of(
                    new GeneratedFile("src/components/Header.tsx", "h"),
                    new GeneratedFile("src/pages/Home.tsx", "p")), List.of());
            assertEquals("src/pages/Home.tsx", NavigationSynthesizer.entryFile(artifact, null));
        }

        @Test
        @DisplayName("A registry reference resolves to the component's file")
        void registryReference() {
            var registry = new ComponentRegistry();
            registry.register(new ComponentDescriptor("Button", "Button", "src/components/Button.tsx", List.of(),
                    Set.of(), Set.of(), List.of(), List.of(), Instant.now()));
            var artifact = artifact("1:5", 4, List.of(), List.of("button"));

            assertEquals("src/components/Button.tsx", NavigationSynthesizer.entryFile(artifact, registry));
        }

        @Test
        @DisplayName("No artifact means no entry file")
        void noArtifact() {
            assertNull(NavigationSynthesizer.entryFile(null, new ComponentRegistry()));
        }
    }
}
