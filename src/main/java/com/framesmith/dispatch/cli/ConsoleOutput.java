package com.framesmith.dispatch.cli;

import com.framesmith.core.events.FramesmithEvent;
import com.framesmith.core.model.AggregateResult;
import com.framesmith.core.model.JobStatistics;
import com.framesmith.core.model.JobStatus;
import com.framesmith.core.model.Screen;
import com.framesmith.core.model.ScreenOutcome;
import picocli.CommandLine;

import java.util.List;

/**
 * ANSI-colored terminal output utilities for Framesmith CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) FRAMESMITH v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [FRAMESMITH]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void fileWritten(String path) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(green) +|@ " + path));
    }

    /**
     * One progress line per screen-level event.
     */
    public static void screenEvent(FramesmithEvent event) {
        Object name = event.payload().getOrDefault("name", event.screenId());
        Object reason = event.payload().get("reason");
        String prefix = switch (event.eventType()) {
            case "screen.started" -> "@|fg(blue) [SCREEN]|@";
            case "screen.succeeded" -> "@|fg(green) [DONE]|@";
            case "screen.failed" -> "@|fg(red) [FAILED]|@";
            case "screen.skipped" -> "@|fg(white) [SKIPPED]|@";
            case "job.cancelling" -> "@|fg(yellow),bold [CANCEL]|@";
            default -> null;
        };
        if (prefix == null) {
            return;
        }
        String line = prefix + " " + (event.screenId() == null ? event.jobId() : event.screenId() + " (" + name + ")");
        if (reason != null) {
            line += " " + reason;
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(line));
    }

    public static void screenTable(List<Screen> screens) {
        if (screens.isEmpty()) {
            return;
        }
        System.out.println("SCREENS:");
        for (Screen s : screens) {
            System.out.printf("  %3d. %-28s %-24s %6d nodes  %s%n",
                    s.displayOrdinal(), truncate(s.id(), 28), truncate(s.name(), 24), s.nodeCount(),
                    s.status() + (s.failureReason() != null ? " (" + s.failureReason() + ")" : ""));
        }
    }

    public static void statusTable(List<ScreenOutcome> outcomes) {
        for (ScreenOutcome o : outcomes) {
            String color = switch (o.status()) {
                case SUCCEEDED -> "fg(green)";
                case FAILED -> "fg(red)";
                default -> "fg(white)";
            };
            System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                    "  @|%s %-9s|@ %s (%s)", color, o.status(), o.screenId(), o.screenName())));
        }
    }

    public static void summary(AggregateResult result) {
        System.out.println("──────────────────────────────────");
        String line = "Job " + result.jobId() + ": " + result.summary();
        if (result.status() == JobStatus.COMPLETED) {
            success(line);
        } else if (result.status() == JobStatus.FAILED) {
            error(line);
        } else {
            warn(line + " [" + result.status() + "]");
        }
        statistics(result.statistics());

        var failures = result.failures();
        if (!failures.isEmpty()) {
            System.out.println();
            error("Failures (" + failures.size() + "):");
            for (ScreenOutcome f : failures) {
                error("  " + f.screenId() + " (" + f.screenName() + "): " + f.failureReason());
            }
        }
        if (!result.warnings().isEmpty()) {
            System.out.println();
            for (String w : result.warnings()) {
                warn(w);
            }
        }
    }

    public static void statistics(JobStatistics s) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Screens: @|fg(green) " + s.screensSucceeded() + " succeeded|@, @|fg(red) " +
                s.screensFailed() + " failed|@, " + s.screensSkipped() + " skipped"));
        System.out.println("  Files: " + s.totalFiles() + " | Oracle calls: " + s.oracleCalls()
                + " | Cost units: " + s.costUnits());
        System.out.println("  Duration: " + formatDuration(s.wallClockMs()) +
                (s.totalElapsedMs() > 0 ? " (aggregate: " + formatDuration(s.totalElapsedMs()) + ")" : ""));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }

    private static String truncate(String text, int max) {
        if (text == null) return "";
        return text.length() <= max ? text : text.substring(0, max - 1) + "…";
    }
}
