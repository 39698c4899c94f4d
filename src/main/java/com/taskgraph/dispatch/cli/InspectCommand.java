package com.taskgraph.dispatch.cli;

import com.taskgraph.core.graph.TaskGraphLoadException;
import com.taskgraph.core.graph.TaskGraphLoader;
import com.taskgraph.core.graph.TaskGraphTemplate;
import com.taskgraph.core.graph.TemplateValidationException;
import com.taskgraph.core.graph.TaskNodeDefinition;
import com.taskgraph.core.model.VariableDefinition;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: taskgraph inspect &lt;graph.json&gt;
 * <p>
 * Loads and validates a graph file, then prints its variables and node table.
 */
@Command(name = "inspect", mixinStandardHelpOptions = true, description = "Show the nodes and variables of a graph file")
@Component
public class InspectCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Graph JSON file")
    private Path graphFile;

    private final TaskGraphLoader loader;

    public InspectCommand(TaskGraphLoader loader) {
        this.loader = loader;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        TaskGraphTemplate template;
        try {
            template = loader.load(graphFile);
        } catch (TemplateValidationException e) {
            ConsoleOutput.error("Invalid graph " + graphFile + ":");
            e.problems().forEach(p -> System.out.println("    - " + p));
            return 1;
        } catch (TaskGraphLoadException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        System.out.println();
        System.out.println("TEMPLATE " + template.name());
        System.out.println("──────────────────────────────────");
        if (!template.description().isEmpty()) {
            System.out.println("  Description: " + template.description());
        }
        System.out.println("  Root:        " + template.rootNodeId());
        System.out.println("  Nodes:       " + template.nodeCount());

        System.out.println();
        System.out.println("  VARIABLES:");
        if (template.variables().isEmpty()) {
            System.out.println("    none");
        }
        for (VariableDefinition v : template.variables()) {
            System.out.println("    " + v.name() + " : " + v.type().displayName() + " = " + v.defaultValue());
        }

        System.out.println();
        System.out.println("  NODES:");
        for (TaskNodeDefinition node : template.nodes()) {
            String what = node.isAtomic() ? node.atomicTaskId() : node.type() + " " + node.children();
            System.out.println("    [" + node.id() + "] " + node.name() + " -> " + what
                    + "  (success: " + formatNext(node.nextOnSuccess())
                    + ", failure: " + formatNext(node.nextOnFailure()) + ")");
            node.parameters().forEach((name, binding) -> System.out.println("        " + name + " = "
                    + (binding.isLiteral() ? binding.literal() : "$" + binding.variableName())));
        }
        return 0;
    }

    private static String formatNext(int nodeId) {
        return nodeId == TaskGraphTemplate.NODE_NONE ? "none" : String.valueOf(nodeId);
    }
}
