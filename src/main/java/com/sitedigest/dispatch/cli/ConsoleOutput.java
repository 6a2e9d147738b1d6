package com.sitedigest.dispatch.cli;

import com.sitedigest.core.events.PipelineEvent;
import com.sitedigest.core.model.FormattedResult;
import com.sitedigest.core.model.StepError;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Sitedigest CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SITEDIGEST v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SITEDIGEST]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void summary(int index, FormattedResult result) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold " + index + ". " + result.response().title() + "|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "   @|fg(blue) " + result.url() + "|@"));
        System.out.println("   " + result.response().description());
        System.out.println();
    }

    public static void stepError(StepError error) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(yellow) [" + error.step() + "]|@ " + error.message()));
    }

    /**
     * One line per step event; other event types are ignored.
     */
    public static void progress(PipelineEvent event) {
        String step = event.step() == null ? "" : event.step();
        String line = switch (event.eventType()) {
            case "step.started" -> "@|faint -> " + step + "|@";
            case "step.completed" -> "@|fg(green) ok|@ " + step + " ("
                    + formatDuration(((Number) event.payload().getOrDefault("elapsedMs", 0L)).longValue()) + ")";
            case "step.retrying" -> "@|fg(yellow) retry|@ " + step + " #" + event.payload().get("retryCount")
                    + ": " + event.payload().get("error");
            case "step.failed" -> "@|fg(red) failed|@ " + step + ": " + event.payload().get("error");
            default -> null;
        };
        if (line != null) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("  " + line));
        }
    }

    public static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
