package com.stitchwork.cli;

import com.stitchwork.core.model.NodeStatus;
import com.stitchwork.core.model.ResultSummary;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Stitchwork CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) STITCHWORK v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [STITCHWORK]|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void nodeResult(ResultSummary summary) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + statusLabel(summary.status()) + " " + summary.nodeId() + " " + summary.brief()));
    }

    public static void fileChange(String path) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("    @|fg(green) ~|@ " + path));
    }

    static String statusLabel(NodeStatus status) {
        return switch (status) {
            case SUCCEEDED -> "@|fg(green) OK  |@";
            case FAILED -> "@|fg(red) FAIL|@";
            case SKIPPED -> "@|fg(yellow) SKIP|@";
            default -> "@|faint " + status.name() + "|@";
        };
    }
}
