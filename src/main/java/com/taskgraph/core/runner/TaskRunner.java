package com.taskgraph.core.runner;

import com.taskgraph.core.blackboard.LocalBlackboard;
import com.taskgraph.core.graph.TaskGraphTemplate;
import com.taskgraph.core.model.RunnerStatus;
import com.taskgraph.core.model.TaskValue;
import com.taskgraph.core.persistence.RestoreReport;
import com.taskgraph.core.tasks.AtomicTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * One entity's live execution state against a template: node cursor, per-node timer,
 * blackboard, last completed status and the in-flight task.
 * <p>
 * The template is shared and read-only; everything else is owned exclusively by this
 * runner. Cursor and task transitions are driven by the executor; external code only
 * binds, interrupts and persists.
 */
public class TaskRunner {

    private static final Logger log = LoggerFactory.getLogger(TaskRunner.class);

    private final long entityId;
    private final LocalBlackboard blackboard = new LocalBlackboard();

    private TaskGraphTemplate template;
    private long assetId;
    private int currentNodeId = TaskGraphTemplate.NODE_NONE;
    private float stateTimer;
    private RunnerStatus lastStatus = RunnerStatus.SUCCESS;

    private AtomicTask activeTask;
    private String activeTaskId;
    private Map<String, TaskValue> activeParameters = Map.of();

    public TaskRunner(long entityId) {
        this.entityId = entityId;
    }

    public TaskRunner(long entityId, TaskGraphTemplate template, long assetId) {
        this(entityId);
        bind(template, assetId);
    }

    /**
     * Points the runner at a template: the cursor moves to its root, the blackboard is
     * re-initialized from its declarations and the timer and status are reset.
     * An in-flight task is aborted before it is released.
     */
    public void bind(TaskGraphTemplate template, long assetId) {
        this.template = template;
        this.assetId = assetId;
        this.currentNodeId = template.rootNodeId();
        this.stateTimer = 0f;
        this.lastStatus = RunnerStatus.SUCCESS;
        this.blackboard.initialize(template);
        if (activeTask != null) {
            try {
                activeTask.abort();
            } catch (RuntimeException e) {
                log.warn("Task '{}' threw during abort on rebind: {}", activeTaskId, e.toString());
            }
        }
        clearActiveTask();
        log.debug("Entity {} bound to template '{}' (asset {})", entityId, template.name(), assetId);
    }

    /**
     * Requests a stop: the cursor becomes NONE and the next tick aborts the in-flight task.
     */
    public void interrupt() {
        log.debug("Entity {} interrupted at node {}", entityId, currentNodeId);
        currentNodeId = TaskGraphTemplate.NODE_NONE;
    }

    /**
     * @return true once the cursor is NONE and no task awaits abort
     */
    public boolean isFinished() {
        return currentNodeId == TaskGraphTemplate.NODE_NONE && activeTask == null;
    }

    public byte[] snapshotBlackboard() {
        return blackboard.serialize();
    }

    public RestoreReport restoreBlackboard(byte[] bytes) {
        RestoreReport report = blackboard.deserialize(bytes);
        if (!report.clean()) {
            log.warn("Entity {} blackboard restored with issues: {} restored, skipped {}, truncated={}",
                    entityId, report.restored(), report.skipped(), report.truncated());
        }
        return report;
    }

    public long entityId() {
        return entityId;
    }

    public TaskGraphTemplate template() {
        return template;
    }

    public long assetId() {
        return assetId;
    }

    public int currentNodeId() {
        return currentNodeId;
    }

    public float stateTimer() {
        return stateTimer;
    }

    public RunnerStatus lastStatus() {
        return lastStatus;
    }

    public LocalBlackboard blackboard() {
        return blackboard;
    }

    public AtomicTask activeTask() {
        return activeTask;
    }

    public String activeTaskId() {
        return activeTaskId;
    }

    public Map<String, TaskValue> activeParameters() {
        return activeParameters;
    }

    public boolean hasActiveTask() {
        return activeTask != null;
    }

    // --- executor-driven transitions ---

    public void moveTo(int nodeId) {
        this.currentNodeId = nodeId;
    }

    public void startTask(String taskId, AtomicTask task, Map<String, TaskValue> parameters) {
        this.activeTask = task;
        this.activeTaskId = taskId;
        this.activeParameters = Map.copyOf(parameters);
        this.stateTimer = 0f;
    }

    public void accumulate(float deltaTime) {
        this.stateTimer += deltaTime;
    }

    /**
     * Records a completed node: releases the task, resets the timer and moves the cursor.
     */
    public void complete(RunnerStatus status, int nextNodeId) {
        clearActiveTask();
        this.lastStatus = status;
        this.stateTimer = 0f;
        this.currentNodeId = nextNodeId;
    }

    /**
     * Releases the in-flight task after it was aborted.
     */
    public void markAborted() {
        clearActiveTask();
        this.lastStatus = RunnerStatus.ABORTED;
        this.stateTimer = 0f;
    }

    private void clearActiveTask() {
        this.activeTask = null;
        this.activeTaskId = null;
        this.activeParameters = Map.of();
    }

    @Override
    public String toString() {
        return "TaskRunner{entity=" + entityId
                + ", template=" + (template != null ? template.name() : "none")
                + ", node=" + currentNodeId
                + ", lastStatus=" + lastStatus + "}";
    }
}
