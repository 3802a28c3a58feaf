package com.routeflow.dispatch.cli;

import picocli.CommandLine;

import java.util.List;

/**
 * ANSI-colored terminal output utilities for the RouteFlow CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) ROUTEFLOW v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [ROUTEFLOW]|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void stage(String stage, Object elapsedMs) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(blue) [" + stage + "]|@ done in " + elapsedMs + "ms"));
    }

    public static void confidence(double confidence, String path) {
        String color = confidence >= 0.7 ? "green" : confidence > 0.0 ? "yellow" : "red";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(" + color + ") Confidence " + String.format("%.2f", confidence) + "|@ via " + path));
    }

    public static void provenance(List<String> stages) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|faint Stages: " + String.join(" -> ", stages) + "|@"));
    }
}
