package com.taskgraph.dispatch.cli;

import com.taskgraph.core.events.ExecutionSnapshot;
import com.taskgraph.core.model.RunnerStatus;
import com.taskgraph.core.model.TaskValue;
import picocli.CommandLine;

import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the taskgraph CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TASKGRAPH v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TASKGRAPH]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void entityResult(long entityId, RunnerStatus status, boolean finished) {
        String color = switch (status) {
            case SUCCESS -> "fg(green)";
            case FAILURE, ABORTED -> "fg(red)";
            case RUNNING -> "fg(yellow)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) [ENTITY " + entityId + "]|@ @|" + color + " " + status + "|@"
                + (finished ? "" : " (not finished)")));
    }

    public static void blackboard(Map<String, TaskValue> values) {
        if (values.isEmpty()) {
            System.out.println("    (no variables)");
            return;
        }
        values.forEach((name, value) -> System.out.println("    " + name + " = " + value));
    }

    public static void snapshot(ExecutionSnapshot snapshot) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(magenta) [TICK]|@ entity " + snapshot.entityId()
                + " node " + snapshot.activeNodeId() + " " + snapshot.status()));
    }
}
