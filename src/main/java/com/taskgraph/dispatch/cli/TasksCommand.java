package com.taskgraph.dispatch.cli;

import com.taskgraph.core.tasks.AtomicTaskRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: taskgraph tasks
 * <p>
 * Lists every registered atomic task id.
 */
@Command(name = "tasks", mixinStandardHelpOptions = true, description = "List registered atomic task ids")
@Component
public class TasksCommand implements Runnable {

    private final AtomicTaskRegistry registry;

    public TasksCommand(AtomicTaskRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        var ids = registry.getAllTaskIds();
        ConsoleOutput.info(ids.size() + " atomic task ids registered");
        for (String id : ids) {
            System.out.println("  " + id);
        }
    }
}
