package com.foreman.dispatch.cli;

import com.foreman.core.events.AutoModeEvent;
import com.foreman.core.model.Feature;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output for the Foreman CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(ansi("@|bold,fg(yellow) FOREMAN v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(ansi("@|fg(cyan) [FOREMAN]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(ansi("@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(ansi("@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(ansi("@|fg(red) x|@ " + message));
    }

    public static void feature(Feature feature) {
        String status = switch (feature.status()) {
            case VERIFIED, COMPLETED -> "@|fg(green) " + feature.status().value() + "|@";
            case FAILED, INTERRUPTED -> "@|fg(red) " + feature.status().value() + "|@";
            case IN_PROGRESS, WAITING_APPROVAL -> "@|fg(yellow) " + feature.status().value() + "|@";
            default -> feature.status().value();
        };
        String branch = feature.branchName() != null ? " @|faint [" + feature.branchName() + "]|@" : "";
        System.out.println(ansi(String.format("  %-12s P%d %-28s %s", feature.id(), feature.effectivePriority(),
                status, feature.displayTitle()) + branch));
    }

    /**
     * Prints one auto mode event as a single line. Agent output lines are printed as-is.
     */
    public static void event(AutoModeEvent event) {
        String prefix = switch (event.eventType()) {
            case AutoModeEvent.AUTO_MODE_STARTED, AutoModeEvent.AUTO_MODE_STOPPED -> "@|bold,fg(cyan) [AUTO]|@";
            case AutoModeEvent.AUTO_MODE_IDLE -> "@|fg(cyan) [IDLE]|@";
            case AutoModeEvent.AUTO_MODE_FEATURE_START -> "@|fg(blue) [START]|@";
            case AutoModeEvent.AUTO_MODE_FEATURE_COMPLETE -> Boolean.TRUE.equals(event.payload().get("passes"))
                    ? "@|fg(green),bold [DONE]|@" : "@|fg(yellow),bold [DONE]|@";
            case AutoModeEvent.AUTO_MODE_ERROR -> "@|fg(red),bold [ERROR]|@";
            case AutoModeEvent.AUTO_MODE_PAUSED_FAILURES -> "@|fg(red),bold [PAUSED]|@";
            case AutoModeEvent.AUTO_MODE_RESUMING_FEATURES -> "@|fg(magenta) [RESUME]|@";
            case AutoModeEvent.PLAN_APPROVAL_REQUIRED, AutoModeEvent.PLAN_APPROVED,
                 AutoModeEvent.PLAN_REJECTED -> "@|fg(magenta) [PLAN]|@";
            case AutoModeEvent.AUTO_MODE_PROGRESS -> "@|faint   " + nullToEmpty(event.featureId()) + "|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String text = AutoModeEvent.AUTO_MODE_PROGRESS.equals(event.eventType())
                ? String.valueOf(event.payload().getOrDefault("content", ""))
                : describe(event);
        System.out.println(ansi(prefix) + " " + text);
    }

    private static String describe(AutoModeEvent event) {
        String message = event.message() != null ? event.message() : event.eventType();
        return event.featureId() != null ? event.featureId() + ": " + message : message;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    private static String ansi(String text) {
        return CommandLine.Help.Ansi.AUTO.string(text);
    }
}
