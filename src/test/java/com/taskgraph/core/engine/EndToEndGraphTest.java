package com.taskgraph.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskgraph.core.graph.TaskGraphLoader;
import com.taskgraph.core.metrics.TaskSystemMetrics;
import com.taskgraph.core.model.RunnerStatus;
import com.taskgraph.core.model.TaskValue;
import com.taskgraph.core.model.Vector3;
import com.taskgraph.core.pathfinding.PathfindingService;
import com.taskgraph.core.runner.TaskRunner;
import com.taskgraph.core.tasks.AtomicTaskRegistry;
import com.taskgraph.core.tasks.BuiltinTasks;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URISyntaxException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Loads graph files and runs them with the builtin tasks until they finish.
 */
class EndToEndGraphTest {

    private static final float DT = 0.016f;

    private PathfindingService pathfinding;
    private TaskGraphLoader loader;
    private TaskExecutor executor;

    @BeforeEach
    void setUp() {
        pathfinding = new PathfindingService(1);
        var registry = new AtomicTaskRegistry();
        BuiltinTasks.registerAll(registry, pathfinding);
        loader = new TaskGraphLoader(new ObjectMapper());
        executor = new TaskExecutor(registry, new TaskSystemMetrics(new SimpleMeterRegistry()));
    }

    @AfterEach
    void tearDown() {
        pathfinding.close();
    }

    private static Path fixture(String name) {
        try {
            return Path.of(EndToEndGraphTest.class.getResource("/graphs/" + name).toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    private int runToCompletion(TaskRunner runner, int maxTicks) {
        int ticks = 0;
        while (!runner.isFinished() && ticks < maxTicks) {
            executor.tick(runner, DT);
            ticks++;
        }
        return ticks;
    }

    @Test
    @DisplayName("move, wait and set variable run to Success within 60 ticks")
    void moveWaitSet() {
        var runner = new TaskRunner(1L, loader.load(fixture("move_wait_set.json")), 1L);

        int ticks = runToCompletion(runner, 60);

        assertTrue(runner.isFinished(), "graph did not finish in " + ticks + " ticks");
        assertEquals(RunnerStatus.SUCCESS, runner.lastStatus());
        assertEquals(TaskValue.ofBool(true), runner.blackboard().getValue("Result"));
        assertEquals(new Vector3(5, 0, 0), runner.blackboard().getValue("Position").asVector());
    }

    @Test
    @DisplayName("the move leg takes several ticks at the default speed")
    void moveTakesSeveralTicks() {
        var runner = new TaskRunner(1L, loader.load(fixture("move_wait_set.json")), 1L);

        assertEquals(RunnerStatus.RUNNING, executor.tick(runner, DT));
        assertEquals(0, runner.currentNodeId());
        assertEquals(1.6f, runner.blackboard().getValue("Position").asVector().x(), 1e-4f);
    }

    @Test
    @DisplayName("a v2 graph enters its sequence, compares and logs")
    void legacyGraph() {
        var runner = new TaskRunner(1L, loader.load(fixture("legacy_v2.json")), 1L);

        assertEquals(RunnerStatus.SUCCESS, executor.tick(runner, DT));
        assertEquals(3, runner.currentNodeId());
        assertEquals(RunnerStatus.SUCCESS, executor.tick(runner, DT));
        assertTrue(runner.isFinished());
    }

    @Test
    @DisplayName("a pathfinding request completes asynchronously and writes the path")
    void pathfindingGraph() throws Exception {
        var runner = new TaskRunner(1L, loader.load(fixture("pathfinding.json")), 1L);

        long deadline = System.currentTimeMillis() + 5000;
        while (!runner.isFinished() && System.currentTimeMillis() < deadline) {
            executor.tick(runner, DT);
            Thread.sleep(2);
        }

        assertEquals(RunnerStatus.SUCCESS, runner.lastStatus());
        assertEquals("(1.0,2.0,0.0)->(4.0,6.0,0.0)", runner.blackboard().getValue("Path").asString());
        assertEquals(0, pathfinding.pendingCount());
    }

    @Test
    @DisplayName("interrupting a pending pathfinding request releases it")
    void interruptPathfinding() {
        var runner = new TaskRunner(1L, loader.load(fixture("pathfinding.json")), 1L);
        executor.tick(runner, DT);
        assertTrue(runner.hasActiveTask());

        runner.interrupt();

        assertEquals(RunnerStatus.ABORTED, executor.tick(runner, DT));
        assertEquals(0, pathfinding.pendingCount());
        assertEquals("", runner.blackboard().getValue("Path").asString());
    }

    @Test
    @DisplayName("rebinding while a pathfinding request is pending releases it")
    void rebindDuringPathfinding() {
        var template = loader.load(fixture("pathfinding.json"));
        var runner = new TaskRunner(1L, template, 1L);

        for (int i = 0; i < 100; i++) {
            assertEquals(RunnerStatus.RUNNING, executor.tick(runner, DT));
            assertTrue(runner.hasActiveTask());
            runner.bind(template, 1L);
        }

        assertFalse(runner.hasActiveTask());
        assertEquals(0, pathfinding.pendingCount());
    }
}
