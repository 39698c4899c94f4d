package com.taskgraph.dispatch.cli;

import com.taskgraph.config.TaskSystemProperties;
import com.taskgraph.core.engine.TaskSystem;
import com.taskgraph.core.events.ExecutionEventBus;
import com.taskgraph.core.graph.TaskGraphAssetManager;
import com.taskgraph.core.runner.TaskRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: taskgraph run &lt;graph.json&gt; [--entities N] [--dt S] [--max-ticks T]
 * <p>
 * Attaches N entities to the graph and ticks them until every runner has finished or the
 * tick bound is reached, then prints each entity's status and blackboard.
 * Exit code 0 when all runners finished, 1 when the graph could not be loaded and 2 when
 * the tick bound was hit first.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a graph file headless")
@Component
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Parameters(index = "0", description = "Graph JSON file")
    private Path graphFile;

    @Option(names = {"--entities", "-n"}, description = "Number of entities to run (default: 1)")
    private int entities = 1;

    @Option(names = "--dt", description = "Seconds per tick (default: taskgraph.tick.delta-seconds)")
    private Float deltaSeconds;

    @Option(names = "--max-ticks", description = "Stop after this many ticks (default: taskgraph.tick.max-ticks)")
    private Integer maxTicks;

    @Option(names = "--watch", description = "Print a line for every tick")
    private boolean watch;

    private final TaskGraphAssetManager assets;
    private final TaskSystem taskSystem;
    private final ExecutionEventBus eventBus;
    private final TaskSystemProperties properties;

    public RunCommand(TaskGraphAssetManager assets, TaskSystem taskSystem,
                      ExecutionEventBus eventBus, TaskSystemProperties properties) {
        this.assets = assets;
        this.taskSystem = taskSystem;
        this.eventBus = eventBus;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        long assetId = assets.load(graphFile);
        if (assetId == TaskGraphAssetManager.INVALID_ASSET_ID) {
            ConsoleOutput.error("Could not load graph " + graphFile + " (see log for details)");
            return 1;
        }
        if (entities < 1) {
            ConsoleOutput.error("--entities must be at least 1");
            return 1;
        }

        float dt = deltaSeconds != null ? deltaSeconds : properties.getTick().getDeltaSeconds();
        int bound = maxTicks != null ? maxTicks : properties.getTick().getMaxTicks();

        for (long entity = 1; entity <= entities; entity++) {
            taskSystem.attach(entity, assetId);
        }
        ConsoleOutput.info("Running " + entities + " entit" + (entities == 1 ? "y" : "ies")
                + " on " + graphFile.getFileName() + " (dt=" + dt + "s, max " + bound + " ticks)");

        ExecutionEventBus.Subscription subscription = watch ? eventBus.subscribeAll(ConsoleOutput::snapshot) : null;
        int ticks = 0;
        try {
            while (!taskSystem.allFinished() && ticks < bound) {
                taskSystem.tick(dt);
                ticks++;
            }
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }
        log.info("Run of {} stopped after {} ticks", graphFile, ticks);

        System.out.println();
        for (TaskRunner runner : taskSystem.runners()) {
            ConsoleOutput.entityResult(runner.entityId(), runner.lastStatus(), runner.isFinished());
            ConsoleOutput.blackboard(runner.blackboard().snapshot());
        }

        if (taskSystem.allFinished()) {
            ConsoleOutput.success("All entities finished after " + ticks + " ticks");
            return 0;
        }
        ConsoleOutput.error("Tick bound of " + bound + " reached before all entities finished");
        return 2;
    }
}
