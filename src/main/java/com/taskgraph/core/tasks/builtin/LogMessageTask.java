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
 * Logs the {@code message} parameter and succeeds immediately.
 */
public class LogMessageTask implements AtomicTask {

    private static final Logger log = LoggerFactory.getLogger(LogMessageTask.class);

    public static final String ID = "LogMessage";
    public static final String PARAM_MESSAGE = "message";
    public static final String DEFAULT_MESSAGE = "(no message)";

    @Override
    public TaskStatus execute(TaskContext context, Map<String, TaskValue> parameters) {
        String message = TaskParams.typed(parameters, PARAM_MESSAGE, VariableType.STRING)
                .map(TaskValue::asString)
                .orElse(DEFAULT_MESSAGE);
        log.info("[entity {}] {}", context.entityId(), message);
        return TaskStatus.SUCCESS;
    }
}
