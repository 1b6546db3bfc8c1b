package com.sandcastle.dispatch.cli;

import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Sandcastle CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SANDCASTLE v0.1.0|@"));
        rule();
    }

    public static void rule() {
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SANDCASTLE]|@ " + message));
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

    public static void withheld(String name) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(red) -|@ " + name));
    }

    public static void passed(String name) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(green) =|@ " + name));
    }
}
