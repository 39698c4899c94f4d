package com.taskgraph.core.tasks.builtin;

import com.taskgraph.core.model.TaskStatus;
import com.taskgraph.core.model.TaskValue;
import com.taskgraph.core.model.VariableType;
import com.taskgraph.core.tasks.AtomicTask;
import com.taskgraph.core.tasks.TaskContext;
import com.taskgraph.core.tasks.TaskParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Waits until the node has been active for {@code Duration} seconds (Float, required, &gt; 0).
 * <p>
 * Elapsed time comes from the executor's per-node timer, so the task keeps no state.
 */
public class WaitTask implements AtomicTask {

    private static final Logger log = LoggerFactory.getLogger(WaitTask.class);

    public static final String ID = "Wait";
    public static final String PARAM_DURATION = "Duration";

    @Override
    public TaskStatus execute(TaskContext context, Map<String, TaskValue> parameters) {
        var durationParam = TaskParams.typed(parameters, PARAM_DURATION, VariableType.FLOAT);
        if (durationParam.isEmpty()) {
            log.warn("Missing or invalid '{}' parameter", PARAM_DURATION);
            return TaskStatus.FAILURE;
        }
        float duration = durationParam.get().asFloat();
        if (duration <= 0f) {
            log.warn("Duration must be positive (got {})", duration);
            return TaskStatus.FAILURE;
        }

        if (context.stateTimer() >= duration) {
            log.debug("Entity {} wait of {}s complete", context.entityId(), duration);
            return TaskStatus.SUCCESS;
        }
        return TaskStatus.RUNNING;
    }
}
