package com.gatekeeper.dispatch.cli;

import com.gatekeeper.core.audit.DecisionLogEntry;
import picocli.CommandLine;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * ANSI-colored terminal output utilities for the Gatekeeper CLI.
 * Never used by {@code gatekeeper hook}, whose stdout is reserved for the verdict.
 */
public class ConsoleOutput {

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) GATEKEEPER v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [GATEKEEPER]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void decision(DecisionLogEntry entry) {
        String status = entry.approved() ? "@|fg(green) APPROVE|@" : "@|fg(red),bold BLOCK  |@";
        String reason = entry.reason() == null ? "" : firstLine(entry.reason());
        String when = entry.timestamp() == null ? "-" : TIMESTAMP.format(entry.timestamp());
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + when + " " + status + " "
                        + entry.request() + " (" + entry.durationMs() + "ms)"));
        if (!reason.isEmpty()) {
            System.out.println("           " + reason);
        }
    }

    private static String firstLine(String text) {
        int newline = text.indexOf('\n');
        return newline >= 0 ? text.substring(0, newline) : text;
    }
}
