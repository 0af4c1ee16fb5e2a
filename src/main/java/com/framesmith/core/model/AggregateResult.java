package com.framesmith.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Final merged output of a generation job.
 *
 * @param jobId        job identifier
 * @param documentName name of the source design document
 * @param mode         how the document was processed
 * @param status       final job status
 * @param uiFiles      merged UI files, unique by path
 * @param apiFiles     merged API files, unique by path
 * @param components   deduplicated components in registration order
 * @param navigation   route map over the succeeded screens
 * @param statusTable  exactly one row per extracted screen, in ordinal order
 * @param statistics   totals
 * @param warnings     non-fatal problems encountered during the job
 */
public record AggregateResult(
    String jobId,
    String documentName,
    ProcessingMode mode,
    JobStatus status,
    List<GeneratedFile> uiFiles,
    List<GeneratedFile> apiFiles,
    List<ComponentDescriptor> components,
    NavigationMap navigation,
    List<ScreenOutcome> statusTable,
    JobStatistics statistics,
    List<String> warnings
) implements Serializable {

    public AggregateResult {
        uiFiles = uiFiles == null ? List.of() : List.copyOf(uiFiles);
        apiFiles = apiFiles == null ? List.of() : List.copyOf(apiFiles);
        components = components == null ? List.of() : List.copyOf(components);
        navigation = navigation == null ? NavigationMap.empty() : navigation;
        statusTable = statusTable == null ? List.of() : List.copyOf(statusTable);
        statistics = statistics == null ? JobStatistics.empty() : statistics;
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /** Human-readable one-liner such as "4/5 screens succeeded". */
    public String summary() {
        return statistics.screensSucceeded() + "/" + statistics.screensAttempted() + " screens succeeded";
    }

    public List<ScreenOutcome> failures() {
        return statusTable.stream().filter(o -> o.status() == ScreenStatus.FAILED).toList();
    }

    public AggregateResult withStatistics(JobStatistics newStatistics) {
        return new AggregateResult(jobId, documentName, mode, status, uiFiles, apiFiles, components,
                navigation, statusTable, newStatistics, warnings);
    }
}
