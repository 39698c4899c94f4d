package com.taskgraph.core.engine;

import com.taskgraph.core.blackboard.BlackboardException;
import com.taskgraph.core.blackboard.LocalBlackboard;
import com.taskgraph.core.events.ExecutionObserver;
import com.taskgraph.core.events.ExecutionSnapshot;
import com.taskgraph.core.graph.TaskGraphTemplate;
import com.taskgraph.core.graph.TaskNodeDefinition;
import com.taskgraph.core.logging.MdcContext;
import com.taskgraph.core.metrics.TaskSystemMetrics;
import com.taskgraph.core.model.ParameterBinding;
import com.taskgraph.core.model.RunnerStatus;
import com.taskgraph.core.model.TaskStatus;
import com.taskgraph.core.model.TaskValue;
import com.taskgraph.core.runner.TaskRunner;
import com.taskgraph.core.tasks.AtomicTask;
import com.taskgraph.core.tasks.AtomicTaskRegistry;
import com.taskgraph.core.tasks.PositionSource;
import com.taskgraph.core.tasks.TaskContext;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Advances one {@link TaskRunner} per call over its template's flat node table.
 * <p>
 * Each tick:
 * <ol>
 *   <li>cursor NONE with a task in flight: abort it once, release it, record Aborted;</li>
 *   <li>cursor NONE and idle: nothing to do;</li>
 *   <li>resolve the cursor's node, entering composites through their first child;</li>
 *   <li>on node entry resolve parameters and create the task from the registry;</li>
 *   <li>execute: Running keeps the task and adds {@code dt} to the node timer,
 *       Success/Failure release it and follow NextOnSuccess/NextOnFailure.</li>
 * </ol>
 * A missing node, unknown task id, unresolvable parameter or task exception is logged
 * and handled as a Failure of that node, so a runner never stalls. A task that throws is
 * aborted before it is released.
 * <p>
 * Single-threaded per runner. Runners share nothing mutable, so distinct runners may be
 * ticked from distinct threads.
 */
public class TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    private final AtomicTaskRegistry registry;
    private final TaskSystemMetrics metrics;
    private final ExecutionObserver observer;

    public TaskExecutor(AtomicTaskRegistry registry, TaskSystemMetrics metrics) {
        this(registry, metrics, null);
    }

    /**
     * @param observer receives a snapshot after every tick; null to publish nothing
     */
    public TaskExecutor(AtomicTaskRegistry registry, TaskSystemMetrics metrics, ExecutionObserver observer) {
        this.registry = registry;
        this.metrics = metrics;
        this.observer = observer;
    }

    public RunnerStatus tick(TaskRunner runner, float deltaTime) {
        return tick(runner, deltaTime, null);
    }

    /**
     * Advances the runner by one tick.
     *
     * @param positionSource world-owned position for movement tasks, or null to run headless
     * @return {@link RunnerStatus#RUNNING} while a task is in flight after this tick,
     *         otherwise the runner's last completed status
     */
    public RunnerStatus tick(TaskRunner runner, float deltaTime, PositionSource positionSource) {
        TaskGraphTemplate template = runner.template();
        if (template == null) {
            log.warn("Entity {} has no bound template; skipping tick", runner.entityId());
            return runner.lastStatus();
        }

        RunnerStatus result;
        Timer.Sample sample = metrics.startTick();
        MdcContext.setEntity(runner.entityId());
        try {
            result = step(runner, template, deltaTime, positionSource);
        } finally {
            metrics.stopTick(sample);
            MdcContext.clear();
        }

        if (observer != null) {
            try {
                observer.onTick(new ExecutionSnapshot(runner.entityId(), template.name(), runner.currentNodeId(),
                        result, runner.blackboard().snapshot(), Instant.now()));
            } catch (RuntimeException e) {
                log.warn("Observer threw for entity {}: {}", runner.entityId(), e.getMessage(), e);
            }
        }
        return result;
    }

    private RunnerStatus step(TaskRunner runner, TaskGraphTemplate template, float deltaTime,
                              PositionSource positionSource) {
        if (runner.currentNodeId() == TaskGraphTemplate.NODE_NONE) {
            if (runner.hasActiveTask()) {
                abortActiveTask(runner);
            }
            return runner.lastStatus();
        }

        Optional<TaskNodeDefinition> resolved = enterAtomicNode(runner, template);
        if (resolved.isEmpty()) {
            return runner.lastStatus();
        }
        TaskNodeDefinition node = resolved.get();
        MdcContext.setNode(node.id(), node.atomicTaskId());

        if (!runner.hasActiveTask()) {
            Map<String, TaskValue> parameters;
            try {
                parameters = resolveParameters(node, runner.blackboard());
            } catch (BlackboardException e) {
                log.warn("Node {}: cannot resolve parameters: {}", node.label(), e.getMessage());
                return dispatchFailure(runner, node, "parameter");
            }
            Optional<AtomicTask> created = registry.create(node.atomicTaskId());
            if (created.isEmpty()) {
                log.warn("Node {}: unknown atomic task '{}'", node.label(), node.atomicTaskId());
                return dispatchFailure(runner, node, "unknown_task");
            }
            runner.startTask(node.atomicTaskId(), created.get(), parameters);
            log.debug("Node {} started task '{}'", node.label(), node.atomicTaskId());
        }

        var context = new TaskContext(runner.entityId(), runner.blackboard(), deltaTime,
                runner.stateTimer(), positionSource);
        TaskStatus status;
        try {
            status = runner.activeTask().execute(context, runner.activeParameters());
        } catch (RuntimeException e) {
            log.warn("Node {}: task '{}' threw {}", node.label(), node.atomicTaskId(), e.toString());
            abortQuietly(runner.activeTask(), node.atomicTaskId());
            return dispatchFailure(runner, node, "task_exception");
        }
        if (status == null) {
            log.warn("Node {}: task '{}' returned no status", node.label(), node.atomicTaskId());
            return dispatchFailure(runner, node, "task_exception");
        }

        if (status == TaskStatus.RUNNING) {
            runner.accumulate(deltaTime);
            return RunnerStatus.RUNNING;
        }

        metrics.recordTaskCompletion(node.atomicTaskId(), status);
        int next = status == TaskStatus.SUCCESS ? node.nextOnSuccess() : node.nextOnFailure();
        log.debug("Node {} completed with {} -> {}", node.label(), status, next);
        return completeNode(runner, RunnerStatus.from(status), next);
    }

    /**
     * Resolves the cursor to an atomic node. Composite, decorator and root nodes are entered
     * through their first child, following at most one hop per template node. On a structural
     * problem the node is failed and empty is returned.
     */
    private Optional<TaskNodeDefinition> enterAtomicNode(TaskRunner runner, TaskGraphTemplate template) {
        int hops = 0;
        while (true) {
            int nodeId = runner.currentNodeId();
            Optional<TaskNodeDefinition> node = template.node(nodeId);
            if (node.isEmpty()) {
                log.error("Node {} not found in template '{}'", nodeId, template.name());
                metrics.recordDispatchError("missing_node");
                completeNode(runner, RunnerStatus.FAILURE, TaskGraphTemplate.NODE_NONE);
                return Optional.empty();
            }

            TaskNodeDefinition def = node.get();
            if (def.isAtomic()) {
                return node;
            }
            if (def.children().isEmpty()) {
                log.warn("Node {}: {} has no children", def.label(), def.type());
                dispatchFailure(runner, def, "empty_composite");
                return Optional.empty();
            }
            if (++hops > template.nodeCount()) {
                log.error("Node {}: composite entry does not reach an atomic node", def.label());
                metrics.recordDispatchError("composite_cycle");
                completeNode(runner, RunnerStatus.FAILURE, TaskGraphTemplate.NODE_NONE);
                return Optional.empty();
            }
            log.trace("Entering {} {} through child {}", def.type(), def.label(), def.children().get(0));
            runner.moveTo(def.children().get(0));
        }
    }

    static Map<String, TaskValue> resolveParameters(TaskNodeDefinition node, LocalBlackboard blackboard) {
        Map<String, TaskValue> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, ParameterBinding> entry : node.parameters().entrySet()) {
            ParameterBinding binding = entry.getValue();
            if (binding.isLiteral()) {
                resolved.put(entry.getKey(), binding.literal());
            } else {
                resolved.put(entry.getKey(), blackboard.getValue(binding.variableName()));
            }
        }
        return resolved;
    }

    private RunnerStatus dispatchFailure(TaskRunner runner, TaskNodeDefinition node, String reason) {
        metrics.recordDispatchError(reason);
        return completeNode(runner, RunnerStatus.FAILURE, node.nextOnFailure());
    }

    private RunnerStatus completeNode(TaskRunner runner, RunnerStatus status, int next) {
        runner.complete(status, next);
        if (next == TaskGraphTemplate.NODE_NONE) {
            log.info("Entity {} finished graph '{}' with {}", runner.entityId(), runner.template().name(), status);
            metrics.recordGraphFinished(status);
        }
        return status;
    }

    private void abortActiveTask(TaskRunner runner) {
        String taskId = runner.activeTaskId();
        abortQuietly(runner.activeTask(), taskId);
        runner.markAborted();
        metrics.recordAbort(taskId);
        metrics.recordGraphFinished(RunnerStatus.ABORTED);
        log.info("Entity {} aborted task '{}'", runner.entityId(), taskId);
    }

    private static void abortQuietly(AtomicTask task, String taskId) {
        try {
            task.abort();
        } catch (RuntimeException e) {
            log.warn("Task '{}' threw during abort: {}", taskId, e.toString());
        }
    }
}
