package com.taskgraph.core.tasks;

import com.taskgraph.core.pathfinding.PathfindingService;
import com.taskgraph.core.tasks.builtin.CompareTask;
import com.taskgraph.core.tasks.builtin.LogMessageTask;
import com.taskgraph.core.tasks.builtin.MoveToLocationTask;
import com.taskgraph.core.tasks.builtin.RequestPathfindingTask;
import com.taskgraph.core.tasks.builtin.SetVariableTask;
import com.taskgraph.core.tasks.builtin.WaitTask;

import java.util.function.Supplier;

/**
 * Registers the built-in atomic tasks under their short id ({@code Wait}) and the
 * prefixed id used by older graphs ({@code Task_Wait}).
 */
public final class BuiltinTasks {

    public static final String LEGACY_PREFIX = "Task_";

    private BuiltinTasks() {}

    public static void registerAll(AtomicTaskRegistry registry, PathfindingService pathfinding,
                                   float defaultSpeed, float acceptanceRadius) {
        register(registry, WaitTask.ID, WaitTask::new);
        register(registry, MoveToLocationTask.ID, () -> new MoveToLocationTask(defaultSpeed, acceptanceRadius));
        register(registry, SetVariableTask.ID, SetVariableTask::new);
        register(registry, CompareTask.ID, CompareTask::new);
        register(registry, RequestPathfindingTask.ID, () -> new RequestPathfindingTask(pathfinding));
        register(registry, LogMessageTask.ID, LogMessageTask::new);
    }

    public static void registerAll(AtomicTaskRegistry registry, PathfindingService pathfinding) {
        registerAll(registry, pathfinding, MoveToLocationTask.DEFAULT_SPEED, MoveToLocationTask.DEFAULT_ACCEPTANCE_RADIUS);
    }

    private static void register(AtomicTaskRegistry registry, String id, Supplier<? extends AtomicTask> factory) {
        registry.register(id, factory);
        registry.register(LEGACY_PREFIX + id, factory);
    }
}
