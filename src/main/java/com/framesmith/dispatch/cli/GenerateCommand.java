package com.framesmith.dispatch.cli;

import com.framesmith.core.engine.DispatchProperties;
import com.framesmith.core.engine.GenerationEngine;
import com.framesmith.core.events.EventBus;
import com.framesmith.core.loader.MalformedInputException;
import com.framesmith.core.model.AggregateResult;
import com.framesmith.core.model.GenerationOptions;
import com.framesmith.core.model.JobStatus;
import com.framesmith.core.output.ProjectWriter;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: framesmith generate &lt;design.json&gt;
 * <p>
 * Runs the whole pipeline over one design document, writes the generated project and prints the
 * per-screen outcome. Exit code 0 means every screen succeeded, 2 a partial or cancelled job, 1 a failed
 * job or unreadable input.
 */
@Command(name = "generate", mixinStandardHelpOptions = true,
        description = "Generate UI and API source from a design document")
@Component
public class GenerateCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_PARTIAL = 2;

    @Parameters(index = "0", description = "Design document (JSON)")
    private Path designFile;

    @Option(names = {"--out", "-o"}, description = "Output directory", defaultValue = "framesmith-out")
    private Path outputDir;

    @Option(names = "--frontend", description = "Frontend framework", defaultValue = "react")
    private String frontend;

    @Option(names = "--backend", description = "Backend framework", defaultValue = "nodejs")
    private String backend;

    @Option(names = "--tests", description = "Ask for test files")
    private boolean includeTests;

    @Option(names = "--docs", description = "Ask for documentation")
    private boolean includeDocs;

    @Option(names = {"--concurrency", "-c"}, description = "Screens generated at the same time")
    private Integer concurrency;

    @Option(names = {"--screen", "-s"}, description = "Only generate this screen (id or name); repeatable")
    private List<String> screens;

    @Option(names = {"--message", "-m"}, description = "Additional requirements passed to every screen")
    private String message;

    private final GenerationEngine generationEngine;
    private final ProjectWriter projectWriter;
    private final EventBus eventBus;
    private final DispatchProperties dispatchProperties;

    public GenerateCommand(GenerationEngine generationEngine, ProjectWriter projectWriter, EventBus eventBus,
                           DispatchProperties dispatchProperties) {
        this.generationEngine = generationEngine;
        this.projectWriter = projectWriter;
        this.eventBus = eventBus;
        this.dispatchProperties = dispatchProperties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (concurrency != null) {
            if (concurrency < 1) {
                ConsoleOutput.error("--concurrency must be at least 1");
                return EXIT_FAILED;
            }
            dispatchProperties.setMaxConcurrency(concurrency);
        }

        String designJson;
        try {
            designJson = Files.readString(designFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + designFile + ": " + e.getMessage());
            return EXIT_FAILED;
        }

        var options = new GenerationOptions(frontend, backend, includeTests, includeDocs, message,
                screens == null ? null : new LinkedHashSet<>(screens));

        String jobId = generationEngine.generateJobId();
        ConsoleOutput.info("Job " + jobId + ": generating " + frontend + " + " + backend
                + " from " + designFile.getFileName());

        AggregateResult result;
        var subscription = eventBus.subscribe(jobId, ConsoleOutput::screenEvent);
        try {
            result = generationEngine.generate(jobId, designJson, options);
        } catch (MalformedInputException e) {
            ConsoleOutput.error("Malformed design document: " + e.getMessage());
            return EXIT_FAILED;
        } catch (Exception e) {
            ConsoleOutput.error("Generation failed: " + rootCauseMessage(e));
            return EXIT_FAILED;
        } finally {
            subscription.unsubscribe();
        }

        ConsoleOutput.info("Mode: " + result.mode() + " | Components: " + result.components().size()
                + " | Routes: " + result.navigation().routes().size());

        try {
            var written = projectWriter.write(result, outputDir);
            ConsoleOutput.info("Wrote " + written.size() + " files to " + outputDir);
        } catch (UncheckedIOException e) {
            ConsoleOutput.error("Failed to write output: " + rootCauseMessage(e));
            return EXIT_FAILED;
        }

        ConsoleOutput.summary(result);
        return exitCodeFor(result.status());
    }

    static int exitCodeFor(JobStatus status) {
        return switch (status) {
            case COMPLETED -> EXIT_OK;
            case PARTIALLY_COMPLETED, CANCELLED -> EXIT_PARTIAL;
            default -> EXIT_FAILED;
        };
    }

    static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
