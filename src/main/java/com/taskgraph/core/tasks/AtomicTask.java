package com.taskgraph.core.tasks;

import com.taskgraph.core.model.TaskStatus;
import com.taskgraph.core.model.TaskValue;

import java.util.Map;

/**
 * A single pluggable unit of work, created fresh for each node entry by the
 * {@link AtomicTaskRegistry}.
 * <p>
 * An instance that returns {@link TaskStatus#RUNNING} is executed again on the next
 * tick (same instance, so progress such as a pending request handle is kept).
 * {@code execute} must never block; background work is polled.
 */
public interface AtomicTask {

    /**
     * Performs one tick of work.
     *
     * @param context    per-tick runtime data for the owning entity
     * @param parameters resolved parameter map for the current node
     */
    TaskStatus execute(TaskContext context, Map<String, TaskValue> parameters);

    /**
     * Releases in-progress resources without further side effects. Called at most once,
     * possibly before the first {@code execute}, and only when the task is interrupted
     * while running.
     */
    default void abort() {
    }
}
