package com.framesmith.dispatch.cli;

import com.framesmith.core.engine.GenerationEngine;
import com.framesmith.core.loader.MalformedInputException;
import com.framesmith.core.model.Screen;
import com.framesmith.core.model.ScreenStatus;
import com.framesmith.core.state.JobState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: framesmith analyze &lt;design.json&gt;
 * <p>
 * Loads, classifies and plans screens without calling the code oracle.
 */
@Command(name = "analyze", mixinStandardHelpOptions = true,
        description = "Show how a design document would be split into screens")
@Component
public class AnalyzeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Design document (JSON)")
    private Path designFile;

    private final GenerationEngine generationEngine;

    public AnalyzeCommand(GenerationEngine generationEngine) {
        this.generationEngine = generationEngine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        JobState state;
        try {
            state = generationEngine.analyze(Files.readString(designFile, StandardCharsets.UTF_8));
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + designFile + ": " + e.getMessage());
            return GenerateCommand.EXIT_FAILED;
        } catch (MalformedInputException e) {
            ConsoleOutput.error("Malformed design document: " + e.getMessage());
            return GenerateCommand.EXIT_FAILED;
        }

        state.design().ifPresent(design -> ConsoleOutput.info(String.format(
                "Document: %s | Nodes: %d | Mode: %s",
                design.documentName(), design.nodeCount(), state.mode())));

        var screens = state.screens();
        long rejected = screens.stream().filter(s -> s.status() == ScreenStatus.FAILED).count();
        ConsoleOutput.info(screens.size() + " screens planned"
                + (state.sharedNodeIds().isEmpty() ? "" : ", " + state.sharedNodeIds().size() + " shared containers"));
        System.out.println();
        ConsoleOutput.screenTable(screens);

        if (rejected > 0) {
            System.out.println();
            for (Screen s : screens) {
                if (s.status() == ScreenStatus.FAILED) {
                    ConsoleOutput.warn("Screen " + s.id() + " cannot be generated: " + s.failureReason());
                }
            }
        }
        return GenerateCommand.EXIT_OK;
    }
}
