package com.framesmith.core.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.framesmith.core.model.AggregateResult;
import com.framesmith.core.model.ComponentDescriptor;
import com.framesmith.core.model.GeneratedFile;
import com.framesmith.core.model.RouteEntry;
import com.framesmith.core.model.ScreenOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes an {@link AggregateResult} to disk:
 * <pre>
 *   out/frontend/...              UI files
 *   out/backend/...               API files
 *   out/component-registry.json   deduplicated components keyed by display name
 *   out/navigation.json           route map
 *   out/generation-report.json    status table, statistics and warnings
 * </pre>
 */
@Service
public class ProjectWriter {

    private static final Logger log = LoggerFactory.getLogger(ProjectWriter.class);

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * @return every file written, relative to {@code outputDir}
     */
    public List<Path> write(AggregateResult result, Path outputDir) {
        Path root = outputDir.toAbsolutePath().normalize();
        var written = new ArrayList<Path>();
        try {
            Files.createDirectories(root);
            writeFiles(root, root.resolve("frontend"), result.uiFiles(), written);
            writeFiles(root, root.resolve("backend"), result.apiFiles(), written);
            writeJson(root, "component-registry.json", registryJson(result.components()), written);
            writeJson(root, "navigation.json", navigationJson(result.navigation().routes()), written);
            writeJson(root, "generation-report.json", reportJson(result), written);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write generated project to " + root, e);
        }
        log.info("Wrote {} files for job {} to {}", written.size(), result.jobId(), root);
        return written;
    }

    private void writeFiles(Path root, Path base, List<GeneratedFile> files, List<Path> written) throws IOException {
        for (GeneratedFile file : files) {
            Path target = base.resolve(file.path()).normalize();
            if (!target.startsWith(base)) {
                log.warn("Skipping file outside the output directory: {}", file.path());
                continue;
            }
            Files.createDirectories(target.getParent());
            Files.writeString(target, file.content() == null ? "" : file.content(), StandardCharsets.UTF_8);
            written.add(root.relativize(target));
        }
    }

    private void writeJson(Path root, String name, Object value, List<Path> written) throws IOException {
        Path target = root.resolve(name);
        objectMapper.writeValue(target.toFile(), value);
        written.add(root.relativize(target));
    }

    static Map<String, Object> registryJson(List<ComponentDescriptor> components) {
        var registry = new LinkedHashMap<String, Object>();
        for (ComponentDescriptor c : components) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("path", c.filePath());
            entry.put("variants", List.copyOf(c.variants()));
            entry.put("tokens", c.designTokens());
            entry.put("screensUsed", List.copyOf(c.screensUsed()));
            entry.put("dependencies", c.dependencies());
            entry.put("apiEndpoints", c.apiEndpoints());
            entry.put("lastGenerated", c.generatedAt() == null ? null : c.generatedAt().toString());
            registry.put(c.displayName(), entry);
        }
        return registry;
    }

    private static List<Map<String, Object>> navigationJson(List<RouteEntry> routes) {
        var out = new ArrayList<Map<String, Object>>(routes.size());
        for (RouteEntry route : routes) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("path", route.path());
            entry.put("slug", route.slug());
            entry.put("screenId", route.screenId());
            entry.put("screenName", route.screenName());
            entry.put("entryFile", route.entryFile());
            out.add(entry);
        }
        return out;
    }

    private static Map<String, Object> reportJson(AggregateResult result) {
        var report = new LinkedHashMap<String, Object>();
        report.put("jobId", result.jobId());
        report.put("document", result.documentName());
        report.put("mode", result.mode().name());
        report.put("status", result.status().name());
        report.put("summary", result.summary());
        var stats = result.statistics();
        var statistics = new LinkedHashMap<String, Object>();
        statistics.put("screensAttempted", stats.screensAttempted());
        statistics.put("screensSucceeded", stats.screensSucceeded());
        statistics.put("screensFailed", stats.screensFailed());
        statistics.put("screensSkipped", stats.screensSkipped());
        statistics.put("totalFiles", stats.totalFiles());
        statistics.put("oracleCalls", stats.oracleCalls());
        statistics.put("totalElapsedMs", stats.totalElapsedMs());
        statistics.put("wallClockMs", stats.wallClockMs());
        statistics.put("costUnits", stats.costUnits());
        report.put("statistics", statistics);
        var screens = new ArrayList<Map<String, Object>>();
        for (ScreenOutcome outcome : result.statusTable()) {
            var row = new LinkedHashMap<String, Object>();
            row.put("screenId", outcome.screenId());
            row.put("name", outcome.screenName());
            row.put("ordinal", outcome.ordinal());
            row.put("status", outcome.status().name());
            row.put("failureReason", outcome.failureReason());
            row.put("attempts", outcome.attempts());
            row.put("elapsedMs", outcome.elapsedMs());
            screens.add(row);
        }
        report.put("screens", screens);
        report.put("warnings", result.warnings());
        return report;
    }
}
