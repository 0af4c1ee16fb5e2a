package com.framesmith.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Framesmith.
 * Routes to subcommands: generate, analyze.
 */
@Command(
        name = "framesmith",
        mixinStandardHelpOptions = true,
        version = "Framesmith 0.1.0",
        description = "Turns large design documents into generated UI and API source, screen by screen",
        subcommands = {
                GenerateCommand.class,
                AnalyzeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class FramesmithCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
