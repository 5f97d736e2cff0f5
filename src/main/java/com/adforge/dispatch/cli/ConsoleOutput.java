package com.adforge.dispatch.cli;

import com.adforge.core.events.JobEvent;
import com.adforge.core.job.JobRecord;
import picocli.CommandLine;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * ANSI-colored terminal output utilities for the Adforge CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) ADFORGE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [ADFORGE]|@ " + message));
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

    public static void job(JobRecord job) {
        System.out.println();
        System.out.println("JOB " + job.id());
        System.out.println("Type: " + job.type());
        System.out.println("Created: " + job.createdAt() + "  Updated: " + job.updatedAt());
        switch (job.status()) {
            case COMPLETED -> success("Status: " + job.status());
            case FAILED -> error("Status: " + job.status());
            default -> info("Status: " + job.status());
        }
        if (job.resultSummary() != null) {
            System.out.println("Result: " + job.resultSummary());
        }
        if (job.error() != null) {
            error("Error: " + job.error());
        }
    }

    public static void jobEvent(JobEvent event) {
        String prefix = switch (event.eventType()) {
            case JobEvent.JOB_STARTED -> "@|fg(cyan) [JOB]|@";
            case JobEvent.JOB_PROGRESS -> "@|fg(cyan) [PROGRESS]|@";
            case JobEvent.ITEM_SUCCEEDED, JobEvent.SCENE_SUCCEEDED -> "@|fg(green) [ITEM]|@";
            case JobEvent.ITEM_SKIPPED -> "@|fg(white) [SKIP]|@";
            case JobEvent.ITEM_FAILED -> "@|fg(red) [ITEM]|@";
            case JobEvent.BREAKER_OPENED -> "@|bold,fg(yellow) [BREAKER]|@";
            case JobEvent.JOB_COMPLETED -> "@|fg(green),bold [COMPLETE]|@";
            case JobEvent.JOB_FAILED -> "@|fg(red),bold [FAILED]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String subject = event.itemId() != null ? event.itemId() + " " : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + subject + describe(event.payload())));
    }

    private static String describe(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            return "";
        }
        return payload.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(" "));
    }
}
