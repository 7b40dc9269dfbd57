package com.taskweave.dispatch.cli;

import com.taskweave.core.model.ExecutionStep;
import picocli.CommandLine;

import java.util.List;

/**
 * ANSI-colored terminal output utilities for Taskweave CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TASKWEAVE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TASKWEAVE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void step(ExecutionStep step) {
        String mode = step.canParallelize() ? "@|fg(green) parallel|@" : "@|faint sequential|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) [STEP " + step.stepNumber() + "]|@ " + mode + " "
                        + String.join(", ", step.taskIds())));
    }

    public static void criticalPath(List<String> path, int minutes) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(magenta) [CRITICAL PATH]|@ " + String.join(" -> ", path)
                        + " (" + minutes + " min)"));
    }
}
