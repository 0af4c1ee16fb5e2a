package com.framesmith.core.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.framesmith.core.model.AggregateResult;
import com.framesmith.core.model.ComponentDescriptor;
import com.framesmith.core.model.GeneratedFile;
import com.framesmith.core.model.JobStatistics;
import com.framesmith.core.model.JobStatus;
import com.framesmith.core.model.NavigationMap;
import com.framesmith.core.model.ProcessingMode;
import com.framesmith.core.model.RouteEntry;
import com.framesmith.core.model.ScreenOutcome;
import com.framesmith.core.model.ScreenStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ProjectWriterTest {

    private final ProjectWriter writer = new ProjectWriter();
    private final ObjectMapper mapper = new ObjectMapper();

    private static AggregateResult result() {
        var header = new ComponentDescriptor("header", "Header", "src/components/Header.tsx", List.of("color.primary"),
                Set.of("default"), Set.of("1:1", "1:2"), List.of(), List.of(), Instant.parse("2026-02-02T00:00:00Z"));
        return new AggregateResult("FSMT-2026-0001", "Shop", ProcessingMode.CHUNKED, JobStatus.PARTIALLY_COMPLETED,
                List.of(new GeneratedFile("src/pages/Home.tsx", "home"),
                        new GeneratedFile("src/components/Header.tsx", "header")),
                List.of(new GeneratedFile("routes/home.js", "api"),
                        new GeneratedFile("../escape.js", "nope")),
                List.of(header),
                new NavigationMap(List.of(new RouteEntry("home", "/home", "1:1", "Home", 0, "src/pages/Home.tsx"))),
                List.of(new ScreenOutcome("1:1", "Home", 0, ScreenStatus.SUCCEEDED, null, 1, 120),
                        new ScreenOutcome("1:2", "Cart", 1, ScreenStatus.FAILED, "ParseError: no JSON", 1, 80)),
                new JobStatistics(2, 1, 1, 0, 3, 2, 200, 150, 900),
                List.of("Screen 1:2 (Cart) failed: ParseError: no JSON"));
    }

    @Test
    @DisplayName("Writes frontend, backend and the three JSON documents")
    void writesLayout(@TempDir Path out) throws Exception {
        List<Path> written = writer.write(result(), out);

        assertEquals("home", Files.readString(out.resolve("frontend/src/pages/Home.tsx")));
        assertEquals("api", Files.readString(out.resolve("backend/routes/home.js")));
        assertTrue(Files.exists(out.resolve("component-registry.json")));
        assertTrue(Files.exists(out.resolve("navigation.json")));
        assertTrue(Files.exists(out.resolve("generation-report.json")));
        assertTrue(written.contains(Path.of("frontend/src/components/Header.tsx")));
        assertEquals(6, written.size());
    }

    @Test
    @DisplayName("Files resolving outside their base directory are skipped")
    void escapingPathSkipped(@TempDir Path out) {
        writer.write(result(), out);
        assertFalse(Files.exists(out.resolve("escape.js")));
    }

    @Test
    @DisplayName("Registry is keyed by display name and the report carries the status table")
    void jsonContents(@TempDir Path out) throws Exception {
        writer.write(result(), out);

        JsonNode registry = mapper.readTree(out.resolve("component-registry.json").toFile());
        assertEquals("src/components/Header.tsx", registry.get("Header").get("path").asText());
        assertEquals(2, registry.get("Header").get("screensUsed").size());

        JsonNode navigation = mapper.readTree(out.resolve("navigation.json").toFile());
        assertEquals("/home", navigation.get(0).get("path").asText());

        JsonNode report = mapper.readTree(out.resolve("generation-report.json").toFile());
        assertEquals("PARTIALLY_COMPLETED", report.get("status").asText());
        assertEquals("1/2 screens succeeded", report.get("summary").asText());
        assertEquals("ParseError: no JSON", report.get("screens").get(1).get("failureReason").asText());
        assertEquals(900, report.get("statistics").get("costUnits").asLong());
    }

    @Test
    @DisplayName("Registry JSON keeps every descriptor field")
    void registryJsonFields() {
        var json = ProjectWriter.registryJson(result().components());
        @SuppressWarnings("unchecked")
        var entry = (Map<String, Object>) json.get("Header");
        assertEquals(List.of("color.primary"), entry.get("tokens"));
        assertEquals("2026-02-02T00:00:00Z", entry.get("lastGenerated"));
    }
}
