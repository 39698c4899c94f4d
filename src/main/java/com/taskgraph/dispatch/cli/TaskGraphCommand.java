package com.taskgraph.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Root of the {@code taskgraph} command tree. Without a subcommand it prints usage.
 */
@Command(
        name = "taskgraph",
        mixinStandardHelpOptions = true,
        version = "TaskGraph 0.1.0",
        description = "Runs per-entity task graphs headless",
        footer = {"", "Exit codes: 0 finished, 1 load or usage error, 2 tick bound reached."},
        subcommands = {
                RunCommand.class,
                InspectCommand.class,
                TasksCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TaskGraphCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
