package com.framesmith.core.merge;

import com.framesmith.core.model.AggregateResult;
import com.framesmith.core.model.GeneratedArtifact;
import com.framesmith.core.model.GeneratedFile;
import com.framesmith.core.model.JobStatistics;
import com.framesmith.core.model.JobStatus;
import com.framesmith.core.model.NavigationMap;
import com.framesmith.core.model.ProcessingMode;
import com.framesmith.core.model.RouteEntry;
import com.framesmith.core.model.Screen;
import com.framesmith.core.model.ScreenOutcome;
import com.framesmith.core.registry.ComponentRegistry;
import com.framesmith.core.registry.RegistryCollisionWarning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Combines per-screen artifacts, the final registry and the route map into one {@link AggregateResult}.
 * <p>
 * Files are merged in screen-ordinal order. When two screens produce the same path, the earlier file keeps
 * it and the later one is renamed with its screen's 1-based ordinal ({@code Header.tsx -> Header_3.tsx}).
 */
@Service
public class ResultMerger {

    private static final Logger log = LoggerFactory.getLogger(ResultMerger.class);

    public AggregateResult merge(String jobId, String documentName, ProcessingMode mode,
                                 List<Screen> screens, List<GeneratedArtifact> artifacts,
                                 ComponentRegistry registry, NavigationMap navigation,
                                 boolean cancelled, List<String> priorWarnings) {
        var warnings = new ArrayList<>(priorWarnings);
        for (RegistryCollisionWarning collision : registry.collisions()) {
            warnings.add(collision.message());
        }

        Map<String, GeneratedArtifact> byScreen = new HashMap<>();
        for (GeneratedArtifact artifact : artifacts) {
            byScreen.put(artifact.screenId(), artifact);
        }
        List<Screen> ordered = screens.stream().sorted(Comparator.comparingInt(Screen::ordinal)).toList();

        var uiFiles = new ArrayList<GeneratedFile>();
        var apiFiles = new ArrayList<GeneratedFile>();
        Set<String> uiPaths = new HashSet<>();
        Set<String> apiPaths = new HashSet<>();
        Map<String, Map<String, String>> uiRenames = new HashMap<>();
        var statusTable = new ArrayList<ScreenOutcome>(ordered.size());
        int succeeded = 0;
        int failed = 0;
        int skipped = 0;
        int oracleCalls = 0;
        long elapsed = 0;
        long cost = 0;

        for (Screen screen : ordered) {
            GeneratedArtifact artifact = byScreen.get(screen.id());
            statusTable.add(ScreenOutcome.of(screen, artifact));
            if (artifact != null) {
                oracleCalls += artifact.attempts();
                elapsed += artifact.elapsedMs();
                cost += artifact.costUnits();
            }
            switch (screen.status()) {
                case SUCCEEDED -> {
                    succeeded++;
                    if (artifact != null) {
                        mergeFiles(screen, artifact.uiFiles(), uiFiles, uiPaths, warnings)
                                .forEach((from, to) -> uiRenames.computeIfAbsent(screen.id(), k -> new HashMap<>())
                                        .put(from, to));
                        mergeFiles(screen, artifact.apiFiles(), apiFiles, apiPaths, warnings);
                    }
                }
                case FAILED -> {
                    failed++;
                    warnings.add("Screen " + screen.id() + " (" + screen.name() + ") failed: "
                            + screen.failureReason());
                }
                case SKIPPED -> skipped++;
                default -> throw new IllegalStateException("Screen " + screen.id()
                        + " reached merge in non-terminal status " + screen.status());
            }
        }
        if (cancelled && skipped > 0) {
            warnings.add("Job cancelled: " + skipped + " screens skipped");
        }

        JobStatus status = deriveStatus(succeeded, failed, skipped, cancelled);
        var statistics = new JobStatistics(ordered.size(), succeeded, failed, skipped,
                uiFiles.size() + apiFiles.size(), oracleCalls, elapsed, 0L, cost);
        log.info("Merged job {}: {}/{} screens succeeded, {} files, {} warnings, status {}",
                jobId, succeeded, ordered.size(), statistics.totalFiles(), warnings.size(), status);
        return new AggregateResult(jobId, documentName, mode, status, uiFiles, apiFiles,
                registry.descriptors(), followRenames(navigation, uiRenames), statusTable, statistics, warnings);
    }

    /**
     * Points each route at its screen's file after collision renames.
     */
    static NavigationMap followRenames(NavigationMap navigation, Map<String, Map<String, String>> renamesByScreen) {
        if (navigation == null || renamesByScreen.isEmpty()) {
            return navigation;
        }
        var routes = new ArrayList<RouteEntry>(navigation.routes().size());
        for (RouteEntry route : navigation.routes()) {
            String renamed = route.entryFile() == null ? null
                    : renamesByScreen.getOrDefault(route.screenId(), Map.of()).get(route.entryFile());
            routes.add(renamed == null ? route : route.withEntryFile(renamed));
        }
        return new NavigationMap(routes);
    }

    static JobStatus deriveStatus(int succeeded, int failed, int skipped, boolean cancelled) {
        if (cancelled && skipped > 0) {
            return JobStatus.CANCELLED;
        }
        if (succeeded == 0) {
            return JobStatus.FAILED;
        }
        return failed == 0 ? JobStatus.COMPLETED : JobStatus.PARTIALLY_COMPLETED;
    }

    /**
     * @return original path to renamed path for the files of {@code screen} that collided
     */
    private static Map<String, String> mergeFiles(Screen screen, List<GeneratedFile> incoming,
                                                  List<GeneratedFile> merged, Set<String> taken,
                                                  List<String> warnings) {
        var renames = new HashMap<String, String>();
        for (GeneratedFile file : incoming) {
            if (taken.add(file.path())) {
                merged.add(file);
                continue;
            }
            String renamed = suffixed(file.path(), "_" + screen.displayOrdinal());
            int counter = 2;
            while (!taken.add(renamed)) {
                renamed = suffixed(file.path(), "_" + screen.displayOrdinal() + "_" + counter++);
            }
            merged.add(file.withPath(renamed));
            renames.put(file.path(), renamed);
            warnings.add("Path collision: " + file.path() + " from screen " + screen.id()
                    + " renamed to " + renamed);
        }
        return renames;
    }

    /**
     * Inserts {@code suffix} before the extension of the file name.
     */
    static String suffixed(String path, String suffix) {
        int slash = path.lastIndexOf('/');
        int dot = path.lastIndexOf('.');
        if (dot <= slash + 1) {
            return path + suffix;
        }
        return path.substring(0, dot) + suffix + path.substring(dot);
    }
}
